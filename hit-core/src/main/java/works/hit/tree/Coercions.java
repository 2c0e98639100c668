package works.hit.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import works.hit.lex.Grammar;

/**
 * Conversions from the raw text of a value to Java types.
 * <p>
 * These throw {@link IllegalArgumentException} (or its subclass {@link NumberFormatException})
 * when the text doesn't represent the requested type;
 * {@link Field} turns those into {@link works.hit.exceptions.ValueException}s
 * that name the offending field.
 */
public final class Coercions {
	private Coercions() {}

	/**
	 * Accepts the same keywords as the lexer, in any case.
	 */
	public static boolean toBool(String text) {
		return Grammar.boolValue(text);
	}

	public static int toInt(String text) {
		return Integer.parseInt(text);
	}

	public static long toLong(String text) {
		return Long.parseLong(text);
	}

	/**
	 * Accepts only what the lexer would classify as a number,
	 * so Java-specific forms like {@code 1.5f}, {@code 0x1p3} and {@code NaN} are rejected.
	 */
	public static double toFloat(String text) {
		if (!Grammar.isNumber(text)) {
			throw new NumberFormatException("Not a number: \"" + text + "\"");
		}
		return Double.parseDouble(text);
	}

	/**
	 * @return the whitespace-separated elements of {@code text}, each converted by {@code elementConversion}
	 * @throws IllegalArgumentException if any element fails to convert
	 */
	public static <T> List<T> toVector(String text, Function<String, T> elementConversion) {
		List<String> elements = split(text);
		List<T> result = new ArrayList<>(elements.size());
		for (int i = 0; i < elements.size(); i++) {
			try {
				result.add(elementConversion.apply(elements.get(i)));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("element " + i + " \"" + elements.get(i) + "\": " + e.getMessage(), e);
			}
		}
		return result;
	}

	/**
	 * @return the whitespace-separated elements of {@code text}; empty if {@code text} is blank
	 */
	public static List<String> split(String text) {
		String trimmed = text.strip();
		if (trimmed.isEmpty()) {
			return List.of();
		}
		return List.of(trimmed.split("\\s+"));
	}
}
