package org.umsforge.codegen.service.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Line based diff using a longest common subsequence table.
 */
public final class LineDiff {

	private LineDiff() {
	}

	public static List<LineChange> diff(String oldText, String newText) {
		String[] a = split(oldText);
		String[] b = split(newText);
		int[][] lcs = new int[a.length + 1][b.length + 1];
		for (int i = a.length - 1; i >= 0; i--) {
			for (int j = b.length - 1; j >= 0; j--) {
				lcs[i][j] = a[i].equals(b[j]) ? lcs[i + 1][j + 1] + 1 : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
			}
		}

		List<LineChange> changes = new ArrayList<>();
		int i = 0;
		int j = 0;
		while (i < a.length && j < b.length) {
			if (a[i].equals(b[j])) {
				changes.add(new LineChange(LineChange.Type.UNCHANGED, a[i]));
				i++;
				j++;
			} else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
				changes.add(new LineChange(LineChange.Type.REMOVED, a[i++]));
			} else {
				changes.add(new LineChange(LineChange.Type.ADDED, b[j++]));
			}
		}
		while (i < a.length) changes.add(new LineChange(LineChange.Type.REMOVED, a[i++]));
		while (j < b.length) changes.add(new LineChange(LineChange.Type.ADDED, b[j++]));
		return changes;
	}

	private static String[] split(String text) {
		if (text == null || text.isEmpty()) return new String[0];
		return text.split("\r?\n", -1);
	}
}
