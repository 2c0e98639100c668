package works.hit.lex;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recognition rules for the HIT terminals.
 * <pre>
 * PATH    = [a-zA-Z0-9_./:&lt;&gt;+\-]+
 * NUMBER  = [+-]?([0-9]+(\.[0-9]*)?|\.[0-9]+)([eE][+-]?[0-9]+)?
 * BOOL    = true|yes|on|false|no|off   (any case)
 * UNQUOTED_STRING_BODY = [^ \t\r\n\[]+
 * </pre>
 */
public final class Grammar {
	private Grammar() {}

	/**
	 * The text of a section terminator besides the empty one.
	 */
	public static final String CLOSING_PATH = "../";

	public static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on");
	public static final Set<String> FALSE_WORDS = Set.of("false", "no", "off");

	private static final Pattern NUMBER = Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");
	private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

	public static boolean isPathChar(int c) {
		return (c >= 'a' && c <= 'z')
			|| (c >= 'A' && c <= 'Z')
			|| (c >= '0' && c <= '9')
			|| c == '_' || c == '.' || c == '/' || c == ':'
			|| c == '<' || c == '>' || c == '+' || c == '-';
	}

	/**
	 * Spaces, tabs and line breaks separate tokens and are otherwise ignored.
	 */
	public static boolean isWhitespace(int c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	public static boolean isUnquotedValueChar(int c) {
		return c >= 0 && !isWhitespace(c) && c != '[';
	}

	public static boolean isQuote(int c) {
		return c == '\'' || c == '"';
	}

	public static boolean isBool(String text) {
		String lower = text.toLowerCase(Locale.ROOT);
		return TRUE_WORDS.contains(lower) || FALSE_WORDS.contains(lower);
	}

	/**
	 * @return the boolean denoted by {@code text}
	 * @throws IllegalArgumentException if {@code text} is not one of the boolean keywords
	 */
	public static boolean boolValue(String text) {
		String lower = text.toLowerCase(Locale.ROOT);
		if (TRUE_WORDS.contains(lower)) {
			return true;
		} else if (FALSE_WORDS.contains(lower)) {
			return false;
		} else {
			throw new IllegalArgumentException("Not a boolean: \"" + text + "\"");
		}
	}

	public static boolean isNumber(String text) {
		return NUMBER.matcher(text).matches();
	}

	/**
	 * @return true if {@code text} has no fraction or exponent and fits in an {@code int}
	 */
	public static boolean isInt(String text) {
		if (!INTEGER.matcher(text).matches()) {
			return false;
		}
		try {
			Integer.parseInt(text);
			return true;
		} catch (NumberFormatException e) {
			return false;
		}
	}

	/**
	 * Classifies an unquoted value by trying, in order, boolean, number, and string.
	 */
	public static TokenType classifyUnquoted(String text) {
		if (isBool(text)) {
			return TokenType.BOOL;
		} else if (isNumber(text)) {
			return TokenType.NUMBER;
		} else {
			return TokenType.STRING;
		}
	}
}
