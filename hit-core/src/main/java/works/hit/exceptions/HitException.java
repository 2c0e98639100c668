package works.hit.exceptions;

/**
 * Superclass of the errors raised while reading HIT input or extracting values from a parsed tree.
 */
public sealed abstract class HitException extends RuntimeException permits ParseException, ValueException {
	protected HitException(String message) {
		super(message);
	}

	protected HitException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same type as {@code exception} whose message
	 * is prefixed with {@code context}, and whose cause is {@code exception}.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends HitException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof ParseException e) {
			return (T) new ParseException(e.label(), e.line(), newMessage, e);
		} else {
			return (T) new ValueException(newMessage, exception);
		}
	}
}
