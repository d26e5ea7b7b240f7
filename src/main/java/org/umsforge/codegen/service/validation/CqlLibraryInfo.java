package org.umsforge.codegen.service.validation;

/**
 * Library facts read from CQL text by the validator.
 */
public class CqlLibraryInfo {
	private final String libraryName;
	private final String version;
	private final int definitionCount;
	private final int valueSetCount;

	public CqlLibraryInfo(String libraryName, String version, int definitionCount, int valueSetCount) {
		this.libraryName = libraryName;
		this.version = version;
		this.definitionCount = definitionCount;
		this.valueSetCount = valueSetCount;
	}

	public String getLibraryName() {
		return libraryName;
	}

	public String getVersion() {
		return version;
	}

	public int getDefinitionCount() {
		return definitionCount;
	}

	public int getValueSetCount() {
		return valueSetCount;
	}
}
