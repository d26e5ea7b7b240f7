package org.umsforge.codegen.service.diff;

import org.umsforge.model.PopulationType;

import java.util.List;

public class PopulationChange {
	private final PopulationType type;
	private final ChangeKind kind;
	private final String oldDescription;
	private final String newDescription;
	private final List<String> changes;

	public PopulationChange(PopulationType type, ChangeKind kind, String oldDescription, String newDescription, List<String> changes) {
		this.type = type;
		this.kind = kind;
		this.oldDescription = oldDescription;
		this.newDescription = newDescription;
		this.changes = List.copyOf(changes);
	}

	public PopulationType getType() {
		return type;
	}

	public ChangeKind getKind() {
		return kind;
	}

	public String getOldDescription() {
		return oldDescription;
	}

	public String getNewDescription() {
		return newDescription;
	}

	public List<String> getChanges() {
		return changes;
	}
}
