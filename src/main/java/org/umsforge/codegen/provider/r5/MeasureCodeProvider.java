package org.umsforge.codegen.provider.r5;

import ca.uhn.fhir.rest.annotation.Operation;
import ca.uhn.fhir.rest.annotation.OperationParam;
import ca.uhn.fhir.rest.api.server.RequestDetails;
import ca.uhn.fhir.rest.server.exceptions.InvalidRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.commons.lang3.StringUtils;
import org.hl7.fhir.r5.model.Attachment;
import org.hl7.fhir.r5.model.BooleanType;
import org.hl7.fhir.r5.model.CodeableConcept;
import org.hl7.fhir.r5.model.DataType;
import org.hl7.fhir.r5.model.Enumerations;
import org.hl7.fhir.r5.model.IntegerType;
import org.hl7.fhir.r5.model.Library;
import org.hl7.fhir.r5.model.Parameters;
import org.hl7.fhir.r5.model.StringType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.umsforge.codegen.service.GenerationResult;
import org.umsforge.codegen.service.MeasureCodeService;
import org.umsforge.codegen.service.OutputFormat;
import org.umsforge.codegen.service.diff.MeasureDiff;
import org.umsforge.codegen.service.impl.MeasureCodeServiceFactory;
import org.umsforge.codegen.service.override.ChangeType;
import org.umsforge.codegen.service.override.CodeOverride;
import org.umsforge.codegen.service.override.OverrideSaveResult;
import org.umsforge.codegen.service.sql.SqlGenerationConfig;
import org.umsforge.codegen.service.utils.UmsJsonReader;
import org.umsforge.codegen.service.validation.DetailedSqlValidation;
import org.umsforge.codegen.service.validation.ValidationIssue;
import org.umsforge.codegen.service.validation.ValidationResult;
import org.umsforge.model.Measure;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Server level FHIR operations of the measure code compiler. Measures travel as UMS JSON strings.
 */
public class MeasureCodeProvider {
	private static final Logger logger = LoggerFactory.getLogger(MeasureCodeProvider.class);

	static final String LIBRARY_TYPE_SYSTEM = "http://terminology.hl7.org/CodeSystem/library-type";
	static final String CQL_CONTENT_TYPE = "text/cql";

	private final MeasureCodeServiceFactory myFactory;
	private final UmsJsonReader myJsonReader;

	public MeasureCodeProvider(MeasureCodeServiceFactory theFactory, UmsJsonReader theJsonReader) {
		this.myFactory = theFactory;
		this.myJsonReader = theJsonReader;
	}

	/**
	 * Implements {@code $generate-measure-code}: compiles a UMS measure to CQL or Synapse SQL, applying the locked
	 * manual overrides of the measure.
	 *
	 * @param measure      the UMS measure as JSON
	 * @param format       {@code cql} or {@code synapse-sql}
	 * @param populationId population the SQL is filtered on; a placeholder is emitted when absent
	 * @return {@code success}, {@code code}, {@code error}, {@code warning} and {@code appliedOverride} parameters,
	 * plus a {@code library} Library resource for CQL output
	 */
	@Operation(name = "$generate-measure-code", idempotent = true)
	public Parameters generateMeasureCode(
		@OperationParam(name = "measure") String measure,
		@OperationParam(name = "format") String format,
		@OperationParam(name = "populationId") String populationId,
		RequestDetails requestDetails) {
		OutputFormat outputFormat = parseFormat(format);
		Measure parsed = parseMeasure(measure, "measure");
		MeasureCodeService service = myFactory.create(requestDetails);
		GenerationResult result = service.generate(outputFormat, parsed, sqlConfig(service, populationId));

		Parameters parameters = new Parameters();
		add(parameters, "success", new BooleanType(result.isSuccess()));
		if (result.getCode() != null) add(parameters, "code", new StringType(result.getCode()));
		result.getErrors().forEach(e -> add(parameters, "error", new StringType(e)));
		result.getWarnings().forEach(w -> add(parameters, "warning", new StringType(w)));
		result.getAppliedOverrides().forEach(c -> add(parameters, "appliedOverride", new StringType(c)));
		if (result.isSuccess() && outputFormat == OutputFormat.CQL) {
			parameters.addParameter().setName("library").setResource(toLibrary(parsed, result));
		}
		return parameters;
	}

	/**
	 * Implements {@code $validate-measure-code}: structural validation of CQL or Synapse SQL text.
	 *
	 * @param detailed for SQL, also return the CTE and column analysis as JSON
	 */
	@Operation(name = "$validate-measure-code", idempotent = true)
	public Parameters validateMeasureCode(
		@OperationParam(name = "code") String code,
		@OperationParam(name = "format") String format,
		@OperationParam(name = "populationId") String populationId,
		@OperationParam(name = "detailed") BooleanType detailed,
		RequestDetails requestDetails) {
		OutputFormat outputFormat = parseFormat(format);
		MeasureCodeService service = myFactory.create(requestDetails);
		SqlGenerationConfig config = sqlConfig(service, populationId);

		Parameters parameters = new Parameters();
		ValidationResult result;
		if (outputFormat == OutputFormat.SYNAPSE_SQL && detailed != null && detailed.booleanValue()) {
			DetailedSqlValidation validation = service.validateDetailed(code, config);
			result = validation.getResult();
			add(parameters, "analysis", new StringType(toJson(validation)));
		} else {
			result = service.validate(outputFormat, code, config);
		}
		add(parameters, "valid", new BooleanType(result.isValid()));
		add(parameters, "score", new IntegerType(result.getScore()));
		result.getErrors().forEach(i -> addIssue(parameters, i));
		result.getWarnings().forEach(i -> addIssue(parameters, i));
		result.getSuggestions().forEach(s -> add(parameters, "suggestion", new StringType(s)));
		return parameters;
	}

	/**
	 * Implements {@code $save-code-override}: stores and locks manually edited code for one component.
	 */
	@Operation(name = "$save-code-override")
	public Parameters saveCodeOverride(
		@OperationParam(name = "measureId") String measureId,
		@OperationParam(name = "componentId") String componentId,
		@OperationParam(name = "format") String format,
		@OperationParam(name = "code") String code,
		@OperationParam(name = "note") String note,
		@OperationParam(name = "originalCode") String originalCode,
		@OperationParam(name = "changeType") String changeType,
		RequestDetails requestDetails) {
		OutputFormat outputFormat = parseFormat(format);
		ChangeType type;
		try {
			type = ChangeType.fromCode(changeType);
		} catch (IllegalArgumentException e) {
			throw new InvalidRequestException(e.getMessage());
		}
		OverrideSaveResult result = myFactory.create(requestDetails)
			.saveOverride(measureId, componentId, outputFormat, code, note, originalCode, type);

		Parameters parameters = new Parameters();
		add(parameters, "success", new BooleanType(result.isSuccess()));
		result.getErrors().forEach(e -> add(parameters, "error", new StringType(e)));
		if (result.getOverride() != null) add(parameters, "override", new StringType(toJson(result.getOverride())));
		return parameters;
	}

	/**
	 * Implements {@code $revert-code-override}: unlocks an override so generated code is used again.
	 */
	@Operation(name = "$revert-code-override")
	public Parameters revertCodeOverride(
		@OperationParam(name = "measureId") String measureId,
		@OperationParam(name = "componentId") String componentId,
		@OperationParam(name = "format") String format,
		RequestDetails requestDetails) {
		boolean found = myFactory.create(requestDetails).revertOverride(measureId, componentId, parseFormat(format));
		Parameters parameters = new Parameters();
		add(parameters, "reverted", new BooleanType(found));
		return parameters;
	}

	/**
	 * Implements {@code $code-overrides}: lists the overrides of a measure, one JSON {@code override} parameter each.
	 */
	@Operation(name = "$code-overrides", idempotent = true)
	public Parameters codeOverrides(
		@OperationParam(name = "measureId") String measureId,
		@OperationParam(name = "format") String format,
		RequestDetails requestDetails) {
		if (StringUtils.isBlank(measureId)) throw new InvalidRequestException("Parameter 'measureId' is required");
		OutputFormat outputFormat = StringUtils.isBlank(format) ? null : parseFormat(format);
		List<CodeOverride> overrides = myFactory.create(requestDetails).getOverridesForMeasure(measureId, outputFormat);
		Parameters parameters = new Parameters();
		for (CodeOverride override : overrides) {
			add(parameters, "override", new StringType(toJson(override)));
		}
		return parameters;
	}

	/**
	 * Implements {@code $diff-measure}: compares two versions of a measure.
	 *
	 * @param includeCode also diff the generated CQL line by line
	 */
	@Operation(name = "$diff-measure", idempotent = true)
	public Parameters diffMeasure(
		@OperationParam(name = "oldMeasure") String oldMeasure,
		@OperationParam(name = "newMeasure") String newMeasure,
		@OperationParam(name = "includeCode") BooleanType includeCode,
		RequestDetails requestDetails) {
		Measure before = parseMeasure(oldMeasure, "oldMeasure");
		Measure after = parseMeasure(newMeasure, "newMeasure");
		MeasureCodeService service = myFactory.create(requestDetails);
		Optional<MeasureDiff> diff = service.diff(before, after, includeCode != null && includeCode.booleanValue());
		if (diff.isEmpty()) throw new InvalidRequestException("The measures could not be compared");

		Parameters parameters = new Parameters();
		add(parameters, "totalChanges", new IntegerType(diff.get().getSummary().getTotalChanges()));
		add(parameters, "summary", new StringType(service.summarize(diff.get())));
		add(parameters, "diff", new StringType(toJson(diff.get())));
		return parameters;
	}

	static Library toLibrary(Measure measure, GenerationResult result) {
		Library library = new Library();
		library.setId(measure.getId());
		if (result.getCqlMetadata() != null) {
			library.setName(result.getCqlMetadata().getLibraryName());
			library.setVersion(result.getCqlMetadata().getVersion());
		}
		library.setTitle(measure.getTitle());
		library.setStatus(Enumerations.PublicationStatus.DRAFT);
		CodeableConcept type = new CodeableConcept();
		type.addCoding().setSystem(LIBRARY_TYPE_SYSTEM).setCode("logic-library");
		library.setType(type);
		library.addContent(new Attachment()
			.setContentType(CQL_CONTENT_TYPE)
			.setData(result.getCode().getBytes(StandardCharsets.UTF_8)));
		return library;
	}

	private static SqlGenerationConfig sqlConfig(MeasureCodeService service, String populationId) {
		SqlGenerationConfig config = service.getOptions().defaultSqlConfig();
		if (StringUtils.isNotBlank(populationId)) config.setPopulationId(populationId);
		return config;
	}

	private static OutputFormat parseFormat(String format) {
		try {
			return OutputFormat.fromCode(format);
		} catch (IllegalArgumentException e) {
			throw new InvalidRequestException(e.getMessage());
		}
	}

	private Measure parseMeasure(String json, String parameterName) {
		if (StringUtils.isBlank(json)) {
			throw new InvalidRequestException(String.format("Parameter '%s' is required", parameterName));
		}
		try {
			return myJsonReader.readMeasure(json);
		} catch (JsonProcessingException | IllegalArgumentException e) {
			logger.warn("Rejected UMS document in parameter {}: {}", parameterName, e.getMessage());
			throw new InvalidRequestException(String.format("Parameter '%s' is not a valid UMS measure: %s", parameterName, e.getMessage()));
		}
	}

	private String toJson(Object value) {
		try {
			return myJsonReader.write(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), e);
		}
	}

	private static void addIssue(Parameters parameters, ValidationIssue issue) {
		Parameters.ParametersParameterComponent component = parameters.addParameter().setName("issue");
		component.addPart().setName("severity").setValue(new StringType(issue.getSeverity().code()));
		component.addPart().setName("code").setValue(new StringType(issue.getCode()));
		component.addPart().setName("message").setValue(new StringType(issue.getMessage()));
		if (issue.getLine() != null) component.addPart().setName("line").setValue(new IntegerType(issue.getLine()));
		if (issue.getColumn() != null) component.addPart().setName("column").setValue(new IntegerType(issue.getColumn()));
		if (issue.getSuggestion() != null) component.addPart().setName("suggestion").setValue(new StringType(issue.getSuggestion()));
	}

	private static void add(Parameters parameters, String name, DataType value) {
		parameters.addParameter().setName(name).setValue(value);
	}
}
