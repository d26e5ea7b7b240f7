package org.umsforge.codegen.service.cql;

import org.umsforge.model.Measure;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Measure-family specific CQL: helper definitions, extra denominator exclusions and an optional fixed numerator.
 */
public class BoilerplateBundle {
	private final String name;
	private final Predicate<Measure> matcher;
	private final String helperDefinitions;
	private final List<String> exclusions;
	private final String numerator;

	public BoilerplateBundle(String name, Predicate<Measure> matcher, String helperDefinitions, List<String> exclusions, String numerator) {
		this.name = Objects.requireNonNull(name, "name");
		this.matcher = Objects.requireNonNull(matcher, "matcher");
		this.helperDefinitions = Objects.requireNonNull(helperDefinitions, "helperDefinitions");
		this.exclusions = List.copyOf(exclusions);
		this.numerator = numerator;
	}

	public String getName() {
		return name;
	}

	public boolean matches(Measure measure) {
		return matcher.test(measure);
	}

	public String getHelperDefinitions() {
		return helperDefinitions;
	}

	public List<String> getExclusions() {
		return exclusions;
	}

	/**
	 * Numerator expression replacing the authored numerator tree, {@code null} when the bundle has none.
	 */
	public String getNumerator() {
		return numerator;
	}
}
