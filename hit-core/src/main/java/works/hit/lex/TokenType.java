package works.hit.lex;

/**
 * A syntactically significant element of HIT text.
 */
public enum TokenType {
	END_TEXT,
	LEFT_BRACKET,
	RIGHT_BRACKET,
	EQUALS,

	/**
	 * A section header, a section terminator ({@code ../}), or a field name.
	 * We don't distinguish at the token level.
	 */
	PATH,

	NUMBER,
	BOOL,

	/**
	 * An unquoted value that is neither a number nor a boolean.
	 */
	STRING,

	/**
	 * A single- or double-quoted value. The token text includes the quotes.
	 */
	QUOTED_STRING,

	/**
	 * A comment on a line of its own.
	 */
	COMMENT,

	/**
	 * A comment following some other token on the same line.
	 */
	INLINE_COMMENT,
	;

	/**
	 * @return true for tokens that are always represented with the same characters
	 */
	public boolean hasFixedRepresentation() {
		return switch (this) {
			case END_TEXT, LEFT_BRACKET, RIGHT_BRACKET, EQUALS -> true;
			default -> false;
		};
	}

	public String fixedRepresentation() {
		return switch (this) {
			case END_TEXT -> "";
			case LEFT_BRACKET -> "[";
			case RIGHT_BRACKET -> "]";
			case EQUALS -> "=";
			default ->
				throw new IllegalArgumentException("Token has no fixed representation: " + this);
		};
	}

	/**
	 * @return true for tokens that can appear to the right of {@code =}
	 */
	public boolean isValue() {
		return switch (this) {
			case NUMBER, BOOL, STRING, QUOTED_STRING -> true;
			default -> false;
		};
	}

	public boolean isComment() {
		return this == COMMENT || this == INLINE_COMMENT;
	}
}
