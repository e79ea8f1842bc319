package org.javai.paradox.script.node;

import java.util.Optional;

/**
 * RGB color literal, written {@code { r g b }} in scripts.
 */
public record RgbColor(int red, int green, int blue) {

	public RgbColor {
		checkComponent("red", red);
		checkComponent("green", green);
		checkComponent("blue", blue);
	}

	/**
	 * Parses the source text of a color literal, with or without the surrounding braces.
	 */
	public static Optional<RgbColor> tryParse(String text) {
		if (text == null) {
			return Optional.empty();
		}
		String body = text.trim();
		if (body.startsWith("{") && body.endsWith("}")) {
			body = body.substring(1, body.length() - 1).trim();
		}
		String[] parts = body.split("\\s+");
		if (parts.length != 3) {
			return Optional.empty();
		}
		try {
			int r = Integer.parseInt(parts[0]);
			int g = Integer.parseInt(parts[1]);
			int b = Integer.parseInt(parts[2]);
			if (!inRange(r) || !inRange(g) || !inRange(b)) {
				return Optional.empty();
			}
			return Optional.of(new RgbColor(r, g, b));
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}

	public static boolean inRange(int component) {
		return component >= 0 && component <= 255;
	}

	private static void checkComponent(String name, int value) {
		if (!inRange(value)) {
			throw new IllegalArgumentException(name + " must be within 0..255, was " + value);
		}
	}

	/**
	 * Packs the color as {@code 0xRRGGBB}.
	 */
	public int toRgbInt() {
		return (red << 16) | (green << 8) | blue;
	}

	@Override
	public String toString() {
		return "{ " + red + " " + green + " " + blue + " }";
	}
}
