package org.javai.paradox.script.node;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient conversions behind {@link ScriptNode#getValue}. Every method answers
 * {@link Optional#empty()} instead of throwing when a value does not convert.
 */
final class ValueCoercion {

	// Invariant number syntax: '.' is the only decimal separator, no exponent or type suffix.
	private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
	private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

	private ValueCoercion() {
	}

	static <T> Optional<T> coerce(ScriptNode node, Class<T> type) {
		Class<T> target = wrap(type);
		if (target.isInstance(node)) {
			return Optional.of(target.cast(node));
		}
		return switch (node.kind()) {
			case SCALAR -> coerceValue(((ScalarNode) node).value(), target);
			case DATE -> coerceValue(((DateNode) node).date(), target);
			case OBJECT, LIST -> Optional.empty();
		};
	}

	static <T> Optional<T> coerceValue(Object value, Class<T> type) {
		if (value == null) {
			return Optional.empty();
		}
		Class<T> target = wrap(type);
		if (target == String.class) {
			return Optional.of(target.cast(String.valueOf(value)));
		}
		if (target.isInstance(value)) {
			return Optional.of(target.cast(value));
		}
		Object converted = null;
		if (target == Boolean.class) {
			converted = toBoolean(value);
		} else if (target == Integer.class) {
			Long l = toLong(value);
			converted = l != null && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? Integer.valueOf(l.intValue()) : null;
		} else if (target == Long.class) {
			converted = toLong(value);
		} else if (target == Double.class) {
			converted = toDouble(value);
		} else if (target == Float.class) {
			Double d = toDouble(value);
			converted = d != null ? Float.valueOf(d.floatValue()) : null;
		} else if (target == ParadoxDate.class) {
			converted = toDate(value);
		} else if (target == LocalDate.class) {
			ParadoxDate date = toDate(value);
			converted = date != null ? date.asLocalDate().orElse(null) : null;
		} else if (target == RgbColor.class && value instanceof String text) {
			converted = RgbColor.tryParse(text).orElse(null);
		}
		return Optional.ofNullable(converted).map(target::cast);
	}

	private static Boolean toBoolean(Object value) {
		if (value instanceof String text) {
			String lower = text.trim().toLowerCase(Locale.ROOT);
			if (lower.equals("yes") || lower.equals("true")) {
				return Boolean.TRUE;
			}
			if (lower.equals("no") || lower.equals("false")) {
				return Boolean.FALSE;
			}
		}
		return null;
	}

	private static Long toLong(Object value) {
		if (value instanceof Integer || value instanceof Long) {
			return ((Number) value).longValue();
		}
		if (value instanceof Double d) {
			return isWhole(d) ? Long.valueOf(d.longValue()) : null;
		}
		if (value instanceof String text) {
			String trimmed = text.trim();
			if (INTEGER.matcher(trimmed).matches()) {
				try {
					return Long.parseLong(trimmed);
				} catch (NumberFormatException e) {
					return null;
				}
			}
			Double d = toDouble(trimmed);
			return d != null && isWhole(d) ? Long.valueOf(d.longValue()) : null;
		}
		return null;
	}

	private static Double toDouble(Object value) {
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		if (value instanceof String text) {
			String trimmed = text.trim();
			return DECIMAL.matcher(trimmed).matches() ? Double.valueOf(trimmed) : null;
		}
		return null;
	}

	private static ParadoxDate toDate(Object value) {
		if (value instanceof ParadoxDate date) {
			return date;
		}
		if (value instanceof String text) {
			return ParadoxDate.tryParse(text).orElse(null);
		}
		return null;
	}

	private static boolean isWhole(double d) {
		return !Double.isInfinite(d) && d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63;
	}

	@SuppressWarnings("unchecked")
	private static <T> Class<T> wrap(Class<T> type) {
		if (!type.isPrimitive()) {
			return type;
		}
		if (type == int.class) {
			return (Class<T>) Integer.class;
		}
		if (type == long.class) {
			return (Class<T>) Long.class;
		}
		if (type == double.class) {
			return (Class<T>) Double.class;
		}
		if (type == float.class) {
			return (Class<T>) Float.class;
		}
		if (type == boolean.class) {
			return (Class<T>) Boolean.class;
		}
		return type;
	}
}
