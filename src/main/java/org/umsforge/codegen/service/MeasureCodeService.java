package org.umsforge.codegen.service;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.umsforge.codegen.service.cql.CqlGenerationResult;
import org.umsforge.codegen.service.cql.CqlGenerator;
import org.umsforge.codegen.service.diff.MeasureDiff;
import org.umsforge.codegen.service.diff.MeasureDiffService;
import org.umsforge.codegen.service.override.ChangeType;
import org.umsforge.codegen.service.override.CodeOverride;
import org.umsforge.codegen.service.override.CodeOverrideStore;
import org.umsforge.codegen.service.override.InjectionResult;
import org.umsforge.codegen.service.override.OverrideInjector;
import org.umsforge.codegen.service.override.OverrideKey;
import org.umsforge.codegen.service.override.OverrideSaveResult;
import org.umsforge.codegen.service.sql.SqlGenerationConfig;
import org.umsforge.codegen.service.sql.SqlGenerationResult;
import org.umsforge.codegen.service.sql.SqlGenerator;
import org.umsforge.codegen.service.validation.CqlValidator;
import org.umsforge.codegen.service.validation.DetailedSqlValidation;
import org.umsforge.codegen.service.validation.SqlValidator;
import org.umsforge.codegen.service.validation.ValidationIssue;
import org.umsforge.codegen.service.validation.ValidationResult;
import org.umsforge.model.Measure;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the measure code compiler: generation with override injection, validation, override management
 * and version comparison.
 * <p>
 * No method throws for bad input or unexpected failures; they are logged and reported in the returned result.
 */
public class MeasureCodeService {
	private static final Logger logger = LoggerFactory.getLogger(MeasureCodeService.class);

	static final String INTERNAL_ERROR = "INTERNAL_ERROR";

	private final CqlGenerator cqlGenerator;
	private final SqlGenerator sqlGenerator;
	private final CqlValidator cqlValidator;
	private final SqlValidator sqlValidator;
	private final CodeOverrideStore overrideStore;
	private final OverrideInjector overrideInjector;
	private final MeasureDiffService diffService;
	private final MeasureCodeOptions options;

	public MeasureCodeService(CqlGenerator cqlGenerator, SqlGenerator sqlGenerator, CodeOverrideStore overrideStore,
			MeasureCodeOptions options) {
		this(cqlGenerator, sqlGenerator, new CqlValidator(), new SqlValidator(), overrideStore, new OverrideInjector(),
			new MeasureDiffService(cqlGenerator), options);
	}

	public MeasureCodeService(CqlGenerator cqlGenerator, SqlGenerator sqlGenerator, CqlValidator cqlValidator,
			SqlValidator sqlValidator, CodeOverrideStore overrideStore, OverrideInjector overrideInjector,
			MeasureDiffService diffService, MeasureCodeOptions options) {
		this.cqlGenerator = Objects.requireNonNull(cqlGenerator, "cqlGenerator must not be null");
		this.sqlGenerator = Objects.requireNonNull(sqlGenerator, "sqlGenerator must not be null");
		this.cqlValidator = Objects.requireNonNull(cqlValidator, "cqlValidator must not be null");
		this.sqlValidator = Objects.requireNonNull(sqlValidator, "sqlValidator must not be null");
		this.overrideStore = Objects.requireNonNull(overrideStore, "overrideStore must not be null");
		this.overrideInjector = Objects.requireNonNull(overrideInjector, "overrideInjector must not be null");
		this.diffService = Objects.requireNonNull(diffService, "diffService must not be null");
		this.options = options == null ? MeasureCodeOptions.defaultOptions() : options;
	}

	/**
	 * Generates code for a measure and injects its locked overrides.
	 *
	 * @param format  target language
	 * @param measure the measure to compile
	 * @param config  SQL settings, ignored for CQL; {@code null} for the configured defaults
	 * @return the generated code, or a failed result with the reasons
	 */
	public GenerationResult generate(OutputFormat format, Measure measure, SqlGenerationConfig config) {
		if (format == null) return GenerationResult.failure(null, List.of("Output format is required"));
		try {
			GenerationResult generated = format == OutputFormat.CQL ? generateCql(measure) : generateSql(measure, config);
			if (!generated.isSuccess()) return generated;

			List<CodeOverride> locked = overrideStore.findLocked(measure.getId(), format);
			if (locked.isEmpty()) return generated;
			InjectionResult injected = overrideInjector.apply(generated.getCode(), measure, format, locked);
			List<String> warnings = new ArrayList<>(generated.getWarnings());
			for (String componentId : injected.getAppendedComponents()) {
				warnings.add(String.format("Override anchor not found for component %s; appended at the end", componentId));
			}
			return new GenerationResult(format, true, injected.getCode(), generated.getErrors(), warnings,
				injected.getAppliedComponents(), generated.getCqlMetadata(), generated.getSqlMetadata());
		} catch (RuntimeException e) {
			logger.error("Code generation failed for measure {}", measure == null ? null : measure.getId(), e);
			return GenerationResult.failure(format, List.of(String.format("Code generation failed: %s", e.getMessage())));
		}
	}

	private GenerationResult generateCql(Measure measure) {
		CqlGenerationResult result = cqlGenerator.generate(measure);
		return new GenerationResult(OutputFormat.CQL, result.isSuccess(), result.getCode(), result.getErrors(), result.getWarnings(),
			List.of(), result.getMetadata(), null);
	}

	private GenerationResult generateSql(Measure measure, SqlGenerationConfig config) {
		SqlGenerationResult result = sqlGenerator.generate(measure, config == null ? options.defaultSqlConfig() : config);
		return new GenerationResult(OutputFormat.SYNAPSE_SQL, result.isSuccess(), result.getCode(), result.getErrors(),
			result.getWarnings(), List.of(), null, result.getMetadata());
	}

	/**
	 * Validates code of either format. CQL results are {@link org.umsforge.codegen.service.validation.CqlValidationResult}.
	 */
	public ValidationResult validate(OutputFormat format, String code, SqlGenerationConfig config) {
		try {
			if (format == OutputFormat.CQL) return cqlValidator.validate(code);
			return sqlValidator.validate(code, config == null ? options.defaultSqlConfig() : config);
		} catch (RuntimeException e) {
			logger.error("Validation failed", e);
			return internalError(e);
		}
	}

	public DetailedSqlValidation validateDetailed(String code, SqlGenerationConfig config) {
		try {
			return sqlValidator.validateDetailed(code, config == null ? options.defaultSqlConfig() : config);
		} catch (RuntimeException e) {
			logger.error("Detailed SQL validation failed", e);
			return new DetailedSqlValidation(internalError(e), null, null);
		}
	}

	public OverrideSaveResult saveOverride(String measureId, String componentId, OutputFormat format, String code, String note,
			String originalCode) {
		return saveOverride(measureId, componentId, format, code, note, originalCode, ChangeType.OTHER);
	}

	/**
	 * Stores and locks manually edited code for one component.
	 *
	 * @param originalCode the generated code being replaced, kept as the audit snapshot
	 * @return the saved override, or the reasons it was rejected
	 */
	public OverrideSaveResult saveOverride(String measureId, String componentId, OutputFormat format, String code, String note,
			String originalCode, ChangeType changeType) {
		List<String> errors = keyErrors(measureId, componentId, format);
		if (!errors.isEmpty()) {
			logger.warn("Rejected override save: {}", errors);
			return OverrideSaveResult.rejected(errors);
		}
		try {
			return overrideStore.save(new OverrideKey(measureId, componentId, format), code, note, changeType, originalCode);
		} catch (RuntimeException e) {
			logger.error("Saving override {}/{} failed", measureId, componentId, e);
			return OverrideSaveResult.rejected(List.of(String.format("Saving override failed: %s", e.getMessage())));
		}
	}

	/**
	 * Unlocks the override of a component. Reverting an unknown or already reverted override is a no-op.
	 *
	 * @return {@code true} when an override exists for the key
	 */
	public boolean revertOverride(String measureId, String componentId, OutputFormat format) {
		if (!keyErrors(measureId, componentId, format).isEmpty()) return false;
		try {
			return overrideStore.revert(new OverrideKey(measureId, componentId, format)).isPresent();
		} catch (RuntimeException e) {
			logger.error("Reverting override {}/{} failed", measureId, componentId, e);
			return false;
		}
	}

	/**
	 * @param format restricts the result to one format, {@code null} for all
	 */
	public List<CodeOverride> getOverridesForMeasure(String measureId, OutputFormat format) {
		if (StringUtils.isBlank(measureId)) return List.of();
		try {
			return overrideStore.findByMeasure(measureId, format);
		} catch (RuntimeException e) {
			logger.error("Listing overrides of {} failed", measureId, e);
			return List.of();
		}
	}

	public Optional<MeasureDiff> diff(Measure oldMeasure, Measure newMeasure) {
		return diff(oldMeasure, newMeasure, false);
	}

	/**
	 * Compares two versions of a measure.
	 *
	 * @return the diff, empty when a measure is missing or the comparison failed
	 */
	public Optional<MeasureDiff> diff(Measure oldMeasure, Measure newMeasure, boolean includeCode) {
		if (oldMeasure == null || newMeasure == null) return Optional.empty();
		try {
			return Optional.of(diffService.compare(oldMeasure, newMeasure, includeCode));
		} catch (RuntimeException e) {
			logger.error("Comparing {} with {} failed", oldMeasure.getId(), newMeasure.getId(), e);
			return Optional.empty();
		}
	}

	public String summarize(MeasureDiff diff) {
		return diffService.summarize(diff);
	}

	public MeasureCodeOptions getOptions() {
		return options;
	}

	private static List<String> keyErrors(String measureId, String componentId, OutputFormat format) {
		List<String> errors = new ArrayList<>();
		if (StringUtils.isBlank(measureId)) errors.add("Measure id is required");
		if (StringUtils.isBlank(componentId)) errors.add("Component id is required");
		if (format == null) errors.add("Output format is required");
		return errors;
	}

	private static ValidationResult internalError(RuntimeException e) {
		return new ValidationResult(List.of(ValidationIssue.error(INTERNAL_ERROR, String.format("Validation failed: %s", e.getMessage()))),
			List.of(), List.of());
	}
}
