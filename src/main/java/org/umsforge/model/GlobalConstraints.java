package org.umsforge.model;

/**
 * Constraints applying to every population of a measure.
 */
public class GlobalConstraints {
	private AgeRange ageRange;
	private Gender gender;

	public AgeRange getAgeRange() {
		return ageRange;
	}

	public GlobalConstraints setAgeRange(AgeRange ageRange) {
		this.ageRange = ageRange;
		return this;
	}

	public Gender getGender() {
		return gender;
	}

	public GlobalConstraints setGender(Gender gender) {
		this.gender = gender;
		return this;
	}

	public boolean hasAgeRange() {
		return ageRange != null && ageRange.isBounded();
	}

	public boolean hasRestrictiveGender() {
		return gender != null && gender.isRestrictive();
	}
}
