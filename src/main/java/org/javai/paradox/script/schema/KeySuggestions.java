package org.javai.paradox.script.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * "Did you mean" lookup for misspelled keys.
 */
final class KeySuggestions {

	static final int MAX_DISTANCE = 2;

	private KeySuggestions() {
	}

	/**
	 * Returns the candidates within {@link #MAX_DISTANCE} edits of {@code key}, ignoring case, in
	 * candidate order.
	 */
	static List<String> similarTo(String key, Collection<String> candidates) {
		String lower = key.toLowerCase(Locale.ROOT);
		List<String> suggestions = new ArrayList<>();
		for (String candidate : candidates) {
			if (levenshtein(lower, candidate.toLowerCase(Locale.ROOT)) <= MAX_DISTANCE) {
				suggestions.add(candidate);
			}
		}
		return suggestions;
	}

	static int levenshtein(String a, String b) {
		int[] previous = new int[b.length() + 1];
		int[] current = new int[b.length() + 1];
		for (int j = 0; j <= b.length(); j++) {
			previous[j] = j;
		}
		for (int i = 1; i <= a.length(); i++) {
			current[0] = i;
			for (int j = 1; j <= b.length(); j++) {
				int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
				current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
			}
			int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous[b.length()];
	}
}
