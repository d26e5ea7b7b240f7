package org.umsforge.codegen.service.override;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.umsforge.codegen.service.OutputFormat;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Process local override store. Records are replaced whole inside {@link ConcurrentHashMap#compute}, which
 * serializes writers per key.
 */
public class InMemoryCodeOverrideStore implements CodeOverrideStore {
	private static final Logger logger = LoggerFactory.getLogger(InMemoryCodeOverrideStore.class);

	public static final int DEFAULT_MIN_NOTE_LENGTH = 10;

	private final Map<OverrideKey, CodeOverride> overrides = new ConcurrentHashMap<>();
	private final Clock clock;
	private final int minNoteLength;
	private final String author;

	public InMemoryCodeOverrideStore() {
		this(Clock.systemUTC(), DEFAULT_MIN_NOTE_LENGTH, EditNote.DEFAULT_AUTHOR);
	}

	public InMemoryCodeOverrideStore(Clock clock, int minNoteLength, String author) {
		Preconditions.checkNotNull(clock, "clock must not be null");
		Preconditions.checkArgument(minNoteLength >= 0, "minNoteLength must not be negative: %s", minNoteLength);
		this.clock = clock;
		this.minNoteLength = minNoteLength;
		this.author = author;
	}

	@Override
	public OverrideSaveResult save(OverrideKey key, String code, String note, ChangeType changeType, String originalGeneratedCode) {
		List<String> errors = new ArrayList<>();
		if (key == null) errors.add("Measure id, component id and format are required");
		if (code == null) errors.add("Override code is required");
		checkNote(note, errors);
		if (!errors.isEmpty()) {
			logger.warn("Rejected override save for {}: {}", key, errors);
			return OverrideSaveResult.rejected(errors);
		}

		Instant now = clock.instant();
		CodeOverride saved = overrides.compute(key, (k, existing) -> {
			if (existing == null) {
				EditNote first = newNote(now, note, k.getFormat(), changeType, null);
				return new CodeOverride(k, code, true, originalGeneratedCode, now, now, List.of(first));
			}
			// a locked override keeps the snapshot of the code it first replaced
			String original = existing.isLocked() ? existing.getOriginalGeneratedCode() : originalGeneratedCode;
			return existing.withEdit(code, original, now, newNote(now, note, k.getFormat(), changeType, existing.getCode()));
		});
		logger.info("Saved override {} ({} note(s))", key, saved.getNotes().size());
		return OverrideSaveResult.saved(saved);
	}

	@Override
	public OverrideSaveResult addNote(OverrideKey key, String note, ChangeType changeType) {
		List<String> errors = new ArrayList<>();
		if (key == null) errors.add("Measure id, component id and format are required");
		checkNote(note, errors);
		if (!errors.isEmpty()) return OverrideSaveResult.rejected(errors);

		Instant now = clock.instant();
		CodeOverride updated = overrides.computeIfPresent(key, (k, existing) ->
			existing.withNote(now, newNote(now, note, k.getFormat(), changeType, null)));
		if (updated == null) {
			logger.warn("No override to annotate for {}", key);
			return OverrideSaveResult.rejected(List.of(String.format("No override exists for %s", key)));
		}
		return OverrideSaveResult.saved(updated);
	}

	@Override
	public Optional<CodeOverride> revert(OverrideKey key) {
		if (key == null) return Optional.empty();
		Instant now = clock.instant();
		CodeOverride reverted = overrides.computeIfPresent(key, (k, existing) -> existing.isLocked() ? existing.unlocked(now) : existing);
		if (reverted != null) logger.info("Reverted override {}", key);
		return Optional.ofNullable(reverted);
	}

	@Override
	public int revertAll(String measureId, String componentId) {
		int count = 0;
		for (OutputFormat format : OutputFormat.values()) {
			OverrideKey key = new OverrideKey(measureId, componentId, format);
			AtomicReference<Boolean> changed = new AtomicReference<>(false);
			Instant now = clock.instant();
			overrides.computeIfPresent(key, (k, existing) -> {
				if (!existing.isLocked()) return existing;
				changed.set(true);
				return existing.unlocked(now);
			});
			if (changed.get()) count++;
		}
		return count;
	}

	@Override
	public Optional<CodeOverride> find(OverrideKey key) {
		return key == null ? Optional.empty() : Optional.ofNullable(overrides.get(key));
	}

	@Override
	public List<CodeOverride> findLocked(String measureId, OutputFormat format) {
		return select(o -> o.isLocked() && o.getKey().getMeasureId().equals(measureId) && o.getKey().getFormat() == format);
	}

	@Override
	public List<CodeOverride> findByMeasure(String measureId, OutputFormat format) {
		return select(o -> o.getKey().getMeasureId().equals(measureId) && (format == null || o.getKey().getFormat() == format));
	}

	@Override
	public List<EditNote> getAllNotes(String componentId) {
		return notes(o -> o.getKey().getComponentId().equals(componentId));
	}

	@Override
	public List<EditNote> getAllNotes(String measureId, String componentId) {
		return notes(o -> o.getKey().getMeasureId().equals(measureId) && o.getKey().getComponentId().equals(componentId));
	}

	private void checkNote(String note, List<String> errors) {
		if (StringUtils.trimToEmpty(note).length() < minNoteLength) {
			errors.add(String.format("Edit note must be at least %d characters", minNoteLength));
		}
	}

	private EditNote newNote(Instant now, String content, OutputFormat format, ChangeType changeType, String previousCode) {
		return new EditNote(UUID.randomUUID().toString(), now, author, content.trim(), format, changeType, previousCode);
	}

	private List<CodeOverride> select(Predicate<CodeOverride> filter) {
		return overrides.values().stream()
			.filter(filter)
			.sorted(Comparator.comparing((CodeOverride o) -> o.getKey().getComponentId()).thenComparing(o -> o.getKey().getFormat()))
			.collect(Collectors.toList());
	}

	private List<EditNote> notes(Predicate<CodeOverride> filter) {
		return overrides.values().stream()
			.filter(filter)
			.flatMap(o -> o.getNotes().stream())
			.sorted(Comparator.comparing(EditNote::getTimestamp).reversed())
			.collect(Collectors.toList());
	}
}
