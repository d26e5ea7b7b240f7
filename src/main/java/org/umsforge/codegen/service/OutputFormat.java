package org.umsforge.codegen.service;

/**
 * Target languages of the generators.
 */
public enum OutputFormat {
	CQL("cql", "//"),
	SYNAPSE_SQL("synapse-sql", "--");

	private final String code;
	private final String commentPrefix;

	OutputFormat(String code, String commentPrefix) {
		this.code = code;
		this.commentPrefix = commentPrefix;
	}

	public static OutputFormat fromCode(String code) {
		if (code == null) throw new IllegalArgumentException("The output format is missing");
		String c = code.trim().toLowerCase();
		for (OutputFormat format : values()) {
			if (format.code.equals(c)) return format;
		}
		if ("sql".equals(c) || "synapse".equals(c)) return SYNAPSE_SQL;
		throw new IllegalArgumentException("Unsupported output format: " + code);
	}

	public String code() {
		return code;
	}

	/**
	 * Line comment introducer of the language.
	 */
	public String commentPrefix() {
		return commentPrefix;
	}
}
