package works.delta.exceptions;

/**
 * A set of type descriptors cannot be used for conversion,
 * for example because a referenced type is missing or disabled.
 */
public class InvalidTypeException extends Exception {
	public InvalidTypeException(String message) {
		super(message);
	}

	public InvalidTypeException(String message, Throwable cause) {
		super(message, cause);
	}
}
