package org.umsforge.codegen.service.diff;

import java.util.Objects;

/**
 * Differences between the value sets of two versions of a data element.
 */
public class ValueSetDiff {
	private final ChangeKind kind;
	private final String oldName;
	private final String newName;
	private final String oldOid;
	private final String newOid;
	private final int codesAdded;
	private final int codesRemoved;

	public ValueSetDiff(ChangeKind kind, String oldName, String newName, String oldOid, String newOid, int codesAdded, int codesRemoved) {
		this.kind = kind;
		this.oldName = oldName;
		this.newName = newName;
		this.oldOid = oldOid;
		this.newOid = newOid;
		this.codesAdded = codesAdded;
		this.codesRemoved = codesRemoved;
	}

	public ChangeKind getKind() {
		return kind;
	}

	public boolean isNameChanged() {
		return !Objects.equals(oldName, newName);
	}

	public boolean isOidChanged() {
		return !Objects.equals(oldOid, newOid);
	}

	public String getOldName() {
		return oldName;
	}

	public String getNewName() {
		return newName;
	}

	public String getOldOid() {
		return oldOid;
	}

	public String getNewOid() {
		return newOid;
	}

	public int getCodesAdded() {
		return codesAdded;
	}

	public int getCodesRemoved() {
		return codesRemoved;
	}
}
