package org.umsforge.codegen.service.override;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Manually edited code of one component. Instances are immutable; every change produces a new record.
 */
public final class CodeOverride {
	private final OverrideKey key;
	private final String code;
	private final boolean locked;
	private final String originalGeneratedCode;
	private final Instant createdAt;
	private final Instant updatedAt;
	private final List<EditNote> notes;

	public CodeOverride(OverrideKey key, String code, boolean locked, String originalGeneratedCode, Instant createdAt,
			Instant updatedAt, List<EditNote> notes) {
		this.key = Objects.requireNonNull(key, "key must not be null");
		this.code = code;
		this.locked = locked;
		this.originalGeneratedCode = originalGeneratedCode;
		this.createdAt = createdAt;
		this.updatedAt = updatedAt;
		this.notes = notes == null ? List.of() : List.copyOf(notes);
	}

	CodeOverride withEdit(String newCode, String original, Instant now, EditNote note) {
		List<EditNote> all = new ArrayList<>(notes);
		all.add(note);
		return new CodeOverride(key, newCode, true, original, createdAt, now, all);
	}

	CodeOverride withNote(Instant now, EditNote note) {
		List<EditNote> all = new ArrayList<>(notes);
		all.add(note);
		return new CodeOverride(key, code, locked, originalGeneratedCode, createdAt, now, all);
	}

	CodeOverride unlocked(Instant now) {
		return new CodeOverride(key, code, false, originalGeneratedCode, createdAt, now, notes);
	}

	public OverrideKey getKey() {
		return key;
	}

	public String getCode() {
		return code;
	}

	/**
	 * A locked override replaces the generated code of its component.
	 */
	public boolean isLocked() {
		return locked;
	}

	public String getOriginalGeneratedCode() {
		return originalGeneratedCode;
	}

	public Instant getCreatedAt() {
		return createdAt;
	}

	public Instant getUpdatedAt() {
		return updatedAt;
	}

	/**
	 * Notes in the order they were added.
	 */
	public List<EditNote> getNotes() {
		return notes;
	}
}
