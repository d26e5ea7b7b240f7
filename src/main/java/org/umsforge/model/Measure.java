package org.umsforge.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root of the Universal Measure Specification: measure metadata, its populations and the value sets they use.
 */
public class Measure {
	private String id;
	private String title;
	private String version;
	private String steward;
	private String program;
	private String measureType;
	private String status;
	private String description;
	private MeasurementPeriod measurementPeriod;
	private GlobalConstraints globalConstraints;
	private List<Population> populations = new ArrayList<>();
	private List<ValueSetReference> valueSets = new ArrayList<>();

	public String getId() {
		return id;
	}

	public Measure setId(String id) {
		this.id = id;
		return this;
	}

	public String getTitle() {
		return title;
	}

	public Measure setTitle(String title) {
		this.title = title;
		return this;
	}

	public String getVersion() {
		return version;
	}

	public Measure setVersion(String version) {
		this.version = version;
		return this;
	}

	public String getSteward() {
		return steward;
	}

	public Measure setSteward(String steward) {
		this.steward = steward;
		return this;
	}

	public String getProgram() {
		return program;
	}

	public Measure setProgram(String program) {
		this.program = program;
		return this;
	}

	public String getMeasureType() {
		return measureType;
	}

	public Measure setMeasureType(String measureType) {
		this.measureType = measureType;
		return this;
	}

	public String getStatus() {
		return status;
	}

	public Measure setStatus(String status) {
		this.status = status;
		return this;
	}

	public String getDescription() {
		return description;
	}

	public Measure setDescription(String description) {
		this.description = description;
		return this;
	}

	public MeasurementPeriod getMeasurementPeriod() {
		return measurementPeriod;
	}

	public Measure setMeasurementPeriod(MeasurementPeriod measurementPeriod) {
		this.measurementPeriod = measurementPeriod;
		return this;
	}

	public GlobalConstraints getGlobalConstraints() {
		return globalConstraints;
	}

	public Measure setGlobalConstraints(GlobalConstraints globalConstraints) {
		this.globalConstraints = globalConstraints;
		return this;
	}

	public List<Population> getPopulations() {
		return populations;
	}

	public Measure setPopulations(List<Population> populations) {
		this.populations = populations == null ? new ArrayList<>() : populations;
		return this;
	}

	public Measure addPopulation(Population population) {
		this.populations.add(population);
		return this;
	}

	public List<ValueSetReference> getValueSets() {
		return valueSets;
	}

	public Measure setValueSets(List<ValueSetReference> valueSets) {
		this.valueSets = valueSets == null ? new ArrayList<>() : valueSets;
		return this;
	}

	public Measure addValueSet(ValueSetReference valueSet) {
		this.valueSets.add(valueSet);
		return this;
	}

	/**
	 * First population of the given type, if any.
	 */
	public Optional<Population> findPopulation(PopulationType type) {
		return populations.stream().filter(p -> p.getType() == type).findFirst();
	}

	/**
	 * Every data element of every population, in tree order.
	 */
	public List<DataElement> dataElements() {
		List<DataElement> elements = new ArrayList<>();
		for (Population population : populations) {
			if (population.getCriteria() != null) elements.addAll(CriteriaTrees.dataElements(population.getCriteria()));
		}
		return elements;
	}

	public Optional<DataElement> findDataElement(String elementId) {
		return dataElements().stream().filter(e -> elementId != null && elementId.equals(e.getId())).findFirst();
	}
}
