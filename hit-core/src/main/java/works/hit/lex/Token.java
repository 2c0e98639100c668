package works.hit.lex;

import static java.util.Objects.requireNonNull;

/**
 * A classified piece of input text.
 *
 * @param type what kind of token this is
 * @param text the characters exactly as they appeared in the input
 * @param offset index of the first character within the input
 * @param line 1-based line number of the first character
 */
public record Token(
	TokenType type,
	String text,
	int offset,
	int line
) {
	public Token {
		requireNonNull(type);
		requireNonNull(text);
	}

	@Override
	public String toString() {
		return type + "(" + text + ")@" + line;
	}
}
