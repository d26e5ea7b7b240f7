package org.umsforge.codegen.service.cql;

import com.google.common.io.Resources;
import org.apache.commons.lang3.StringUtils;
import org.umsforge.model.Measure;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Ordered list of {@link BoilerplateBundle}s keyed by predicates over measure metadata.
 */
public class CqlBoilerplateRegistry {
	private static final String RESOURCE_ROOT = "cql/boilerplate/";

	private final List<BoilerplateBundle> bundles = new CopyOnWriteArrayList<>();

	public static CqlBoilerplateRegistry empty() {
		return new CqlBoilerplateRegistry();
	}

	/**
	 * Registry holding the colorectal, cervical and breast cancer screening bundles.
	 */
	public static CqlBoilerplateRegistry defaultRegistry() {
		CqlBoilerplateRegistry registry = new CqlBoilerplateRegistry();
		registry.register(new BoilerplateBundle(
			"colorectal",
			m -> title(m).contains("colorectal") || measureId(m).contains("CMS130"),
			load("colorectal.cql"),
			List.of("\"Has Colorectal Cancer\"", "\"Has Total Colectomy\""),
			"exists \"Colonoscopy Performed\"\n"
				+ "    or exists \"Fecal Occult Blood Test Performed\"\n"
				+ "    or exists \"Flexible Sigmoidoscopy Performed\"\n"
				+ "    or exists \"FIT DNA Test Performed\"\n"
				+ "    or exists \"CT Colonography Performed\""));
		registry.register(new BoilerplateBundle(
			"cervical",
			m -> title(m).contains("cervical") || measureId(m).contains("CMS124"),
			load("cervical.cql"),
			List.of("\"Has Hysterectomy\"", "\"Absence of Cervix Diagnosis\""),
			"exists \"Cervical Cytology Within 3 Years\"\n"
				+ "    or (AgeInYearsAt(date from end of \"Measurement Period\") >= 30\n"
				+ "        and exists \"HPV Test Within 5 Years\")"));
		registry.register(new BoilerplateBundle(
			"breast",
			m -> (title(m).contains("breast") && title(m).contains("screen")) || measureId(m).contains("CMS125"),
			load("breast.cql"),
			List.of("\"Has Bilateral Mastectomy\"", "(\"Has Unilateral Mastectomy Left\" and \"Has Unilateral Mastectomy Right\")"),
			"exists \"Mammography Within 27 Months\""));
		return registry;
	}

	public CqlBoilerplateRegistry register(BoilerplateBundle bundle) {
		bundles.add(bundle);
		return this;
	}

	/**
	 * Bundles matching the measure, in registration order.
	 */
	public List<BoilerplateBundle> matching(Measure measure) {
		return bundles.stream().filter(b -> b.matches(measure)).collect(Collectors.toList());
	}

	public List<BoilerplateBundle> getBundles() {
		return new ArrayList<>(bundles);
	}

	private static String title(Measure measure) {
		return StringUtils.defaultString(measure.getTitle()).toLowerCase(Locale.ROOT);
	}

	private static String measureId(Measure measure) {
		return StringUtils.defaultString(measure.getId()).toUpperCase(Locale.ROOT);
	}

	static String load(String resourceName) {
		try {
			return Resources.toString(Resources.getResource(RESOURCE_ROOT + resourceName), StandardCharsets.UTF_8).trim();
		} catch (IOException | IllegalArgumentException e) {
			throw new IllegalStateException(String.format("Unable to load CQL boilerplate '%s'", resourceName), e);
		}
	}
}
