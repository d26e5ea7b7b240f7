package org.umsforge.codegen.service.override;

import org.umsforge.codegen.service.OutputFormat;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable audit entry attached to an override.
 */
public final class EditNote {
	public static final String DEFAULT_AUTHOR = "User";

	private final String id;
	private final Instant timestamp;
	private final String author;
	private final String content;
	private final OutputFormat format;
	private final ChangeType changeType;
	private final String previousCode;

	public EditNote(String id, Instant timestamp, String author, String content, OutputFormat format, ChangeType changeType,
			String previousCode) {
		this.id = id == null ? UUID.randomUUID().toString() : id;
		this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
		this.author = author == null || author.isBlank() ? DEFAULT_AUTHOR : author;
		this.content = Objects.requireNonNull(content, "content must not be null");
		this.format = format;
		this.changeType = changeType == null ? ChangeType.OTHER : changeType;
		this.previousCode = previousCode;
	}

	public String getId() {
		return id;
	}

	public Instant getTimestamp() {
		return timestamp;
	}

	public String getAuthor() {
		return author;
	}

	public String getContent() {
		return content;
	}

	public OutputFormat getFormat() {
		return format;
	}

	public ChangeType getChangeType() {
		return changeType;
	}

	/**
	 * Code of the override before this edit, {@code null} for the first edit or a note without a code change.
	 */
	public String getPreviousCode() {
		return previousCode;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof EditNote)) return false;
		return id.equals(((EditNote) o).id);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}
}
