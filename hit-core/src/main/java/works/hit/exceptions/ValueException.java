package works.hit.exceptions;

/**
 * A requested parameter is absent, or its value can't be represented as the requested type.
 * <p>
 * Unlike {@link ParseException}, this doesn't invalidate the tree;
 * the caller can retry with another type or path.
 */
public final class ValueException extends HitException {
	public ValueException(String message) {
		super(message);
	}

	public ValueException(String message, Throwable cause) {
		super(message, cause);
	}
}
