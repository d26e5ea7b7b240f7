package org.umsforge.model;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * A value set referenced by the measure, optionally carrying its expansion.
 */
public class ValueSetReference {
	public static final String VSAC_BASE_URL = "http://cts.nlm.nih.gov/fhir/ValueSet/";

	private String id;
	private String name;
	private String oid;
	private String url;
	private String version;
	private List<CodeReference> codes = new ArrayList<>();
	private Double confidence;
	private boolean verified;

	public String getId() {
		return id;
	}

	public ValueSetReference setId(String id) {
		this.id = id;
		return this;
	}

	public String getName() {
		return name;
	}

	public ValueSetReference setName(String name) {
		this.name = name;
		return this;
	}

	public String getOid() {
		return oid;
	}

	public ValueSetReference setOid(String oid) {
		this.oid = oid;
		return this;
	}

	public String getUrl() {
		return url;
	}

	public ValueSetReference setUrl(String url) {
		this.url = url;
		return this;
	}

	public String getVersion() {
		return version;
	}

	public ValueSetReference setVersion(String version) {
		this.version = version;
		return this;
	}

	public List<CodeReference> getCodes() {
		return codes;
	}

	public ValueSetReference setCodes(List<CodeReference> codes) {
		this.codes = codes == null ? new ArrayList<>() : codes;
		return this;
	}

	public ValueSetReference addCode(CodeReference code) {
		this.codes.add(code);
		return this;
	}

	public Double getConfidence() {
		return confidence;
	}

	public ValueSetReference setConfidence(Double confidence) {
		this.confidence = confidence;
		return this;
	}

	public boolean isVerified() {
		return verified;
	}

	public ValueSetReference setVerified(boolean verified) {
		this.verified = verified;
		return this;
	}

	/**
	 * Canonical url of the value set: the explicit url, else the VSAC url derived from the OID, else {@code null}.
	 */
	public String resolveUrl() {
		if (StringUtils.isNotBlank(url)) return url;
		if (StringUtils.isNotBlank(oid)) return VSAC_BASE_URL + oid;
		return null;
	}

	/**
	 * Identifier used by the {@code valueset_codes} terminology table: the OID, else the last url segment.
	 */
	public String resolveOid() {
		if (StringUtils.isNotBlank(oid)) return oid;
		if (StringUtils.isNotBlank(url)) return StringUtils.substringAfterLast(url, "/");
		return null;
	}

	/**
	 * Name used when the value set is referenced from generated code.
	 */
	public String displayName() {
		if (StringUtils.isNotBlank(name)) return name;
		if (StringUtils.isNotBlank(id)) return id;
		return resolveOid();
	}
}
