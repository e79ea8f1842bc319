package org.javai.paradox.script.node;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import org.javai.paradox.script.ScriptParseException;

/**
 * Calendar date as written in Paradox scripts ({@code 1444.11.11}).
 * <p>
 * Validation is lenient on purpose: any day from 1 to 31 is accepted for every month, so
 * {@code 1600.2.30} is a valid value. Use {@link #asLocalDate()} when a real calendar day is needed.
 *
 * @param year  1..9999
 * @param month 1..12
 * @param day   1..31
 */
public record ParadoxDate(int year, int month, int day) implements Comparable<ParadoxDate> {

	public ParadoxDate {
		if (!isValid(year, month, day)) {
			throw new IllegalArgumentException("Date out of range: " + year + "." + month + "." + day);
		}
	}

	/**
	 * Parses {@code year.month.day} text.
	 *
	 * @throws ScriptParseException if the text does not split into three valid integer parts
	 */
	public static ParadoxDate parse(String text) {
		Optional<ParadoxDate> parsed = tryParse(text);
		if (parsed.isEmpty()) {
			throw new ScriptParseException("Invalid date format: " + text);
		}
		return parsed.get();
	}

	/**
	 * Lenient variant of {@link #parse(String)}.
	 */
	public static Optional<ParadoxDate> tryParse(String text) {
		if (text == null) {
			return Optional.empty();
		}
		String[] parts = text.trim().split("\\.", -1);
		if (parts.length != 3) {
			return Optional.empty();
		}
		try {
			int year = Integer.parseInt(parts[0]);
			int month = Integer.parseInt(parts[1]);
			int day = Integer.parseInt(parts[2]);
			return isValid(year, month, day) ? Optional.of(new ParadoxDate(year, month, day)) : Optional.empty();
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}

	public static boolean isValid(int year, int month, int day) {
		return year >= 1 && year <= 9999
				&& month >= 1 && month <= 12
				&& day >= 1 && day <= 31;
	}

	public static ParadoxDate of(LocalDate date) {
		return new ParadoxDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
	}

	/**
	 * Strict conversion.
	 *
	 * @throws DateTimeException if the month has no such day
	 */
	public LocalDate toLocalDate() {
		return LocalDate.of(year, month, day);
	}

	public Optional<LocalDate> asLocalDate() {
		try {
			return Optional.of(toLocalDate());
		} catch (DateTimeException e) {
			return Optional.empty();
		}
	}

	@Override
	public int compareTo(ParadoxDate other) {
		if (year != other.year) {
			return Integer.compare(year, other.year);
		}
		if (month != other.month) {
			return Integer.compare(month, other.month);
		}
		return Integer.compare(day, other.day);
	}

	@Override
	public String toString() {
		return year + "." + month + "." + day;
	}
}
