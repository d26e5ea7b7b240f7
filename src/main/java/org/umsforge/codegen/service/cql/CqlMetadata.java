package org.umsforge.codegen.service.cql;

public class CqlMetadata {
	private final String libraryName;
	private final String version;
	private final int populationCount;
	private final int valueSetCount;
	private final int definitionCount;

	public CqlMetadata(String libraryName, String version, int populationCount, int valueSetCount, int definitionCount) {
		this.libraryName = libraryName;
		this.version = version;
		this.populationCount = populationCount;
		this.valueSetCount = valueSetCount;
		this.definitionCount = definitionCount;
	}

	public static CqlMetadata empty() {
		return new CqlMetadata("", "", 0, 0, 0);
	}

	public String getLibraryName() {
		return libraryName;
	}

	public String getVersion() {
		return version;
	}

	public int getPopulationCount() {
		return populationCount;
	}

	public int getValueSetCount() {
		return valueSetCount;
	}

	public int getDefinitionCount() {
		return definitionCount;
	}
}
