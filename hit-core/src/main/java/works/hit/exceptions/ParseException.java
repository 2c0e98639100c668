package works.hit.exceptions;

/**
 * The input text is not valid HIT.
 * <p>
 * The message always begins with {@code label:line:} so it can be shown to a user as-is.
 * No partial tree is ever produced alongside this exception.
 */
public final class ParseException extends HitException {
	private final String label;
	private final int line;

	public ParseException(String label, int line, String message) {
		super(label + ":" + line + ": " + message);
		this.label = label;
		this.line = line;
	}

	/**
	 * Used by {@link HitException#wrap}; the message is taken verbatim.
	 */
	ParseException(String label, int line, String fullMessage, Throwable cause) {
		super(fullMessage, cause);
		this.label = label;
		this.line = line;
	}

	/**
	 * @return the caller-supplied name of the input, usually a file name
	 */
	public String label() {
		return label;
	}

	/**
	 * @return the 1-based line on which the problem was detected
	 */
	public int line() {
		return line;
	}
}
