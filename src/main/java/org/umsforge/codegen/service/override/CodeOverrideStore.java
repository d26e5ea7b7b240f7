package org.umsforge.codegen.service.override;

import org.umsforge.codegen.service.OutputFormat;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of manual code overrides. Every lookup is by the full {@link OverrideKey}; implementations must be
 * safe for concurrent use and must never expose a partially updated record.
 */
public interface CodeOverrideStore {

	/**
	 * Stores new code for a component and locks it.
	 *
	 * @param key                   measure, component and format
	 * @param code                  the replacement code
	 * @param note                  why the code was edited; rejected when shorter than the configured minimum
	 * @param changeType            category of the edit, {@code null} for {@link ChangeType#OTHER}
	 * @param originalGeneratedCode generated code being replaced; kept from the first save while the override is locked
	 * @return the stored record, or the reasons the save was rejected
	 */
	OverrideSaveResult save(OverrideKey key, String code, String note, ChangeType changeType, String originalGeneratedCode);

	/**
	 * Appends a note to an existing override without touching its code.
	 */
	OverrideSaveResult addNote(OverrideKey key, String note, ChangeType changeType);

	/**
	 * Unlocks an override so the generated code is used again. Code and notes stay for audit. Reverting twice is a
	 * no-op.
	 *
	 * @return the record after the revert, empty when none exists
	 */
	Optional<CodeOverride> revert(OverrideKey key);

	/**
	 * Reverts the component in every format.
	 *
	 * @return the number of overrides that were unlocked
	 */
	int revertAll(String measureId, String componentId);

	Optional<CodeOverride> find(OverrideKey key);

	/**
	 * Locked overrides of a measure in one format.
	 */
	List<CodeOverride> findLocked(String measureId, OutputFormat format);

	/**
	 * Every override of a measure, locked or not.
	 *
	 * @param format restricts the result to one format, {@code null} for all
	 */
	List<CodeOverride> findByMeasure(String measureId, OutputFormat format);

	/**
	 * Notes of a component id across all measures and formats, newest first.
	 */
	List<EditNote> getAllNotes(String componentId);

	/**
	 * Notes of a component of one measure across formats, newest first.
	 */
	List<EditNote> getAllNotes(String measureId, String componentId);
}
