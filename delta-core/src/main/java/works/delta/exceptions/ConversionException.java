package works.delta.exceptions;

import works.delta.ConvertStatus;

/**
 * A conversion between an instance and a value tree could not be completed.
 * <p>
 * The first failure aborts the whole conversion call.
 * Nothing is rolled back: a destination instance may be left partially populated.
 */
public sealed abstract class ConversionException extends RuntimeException permits
	AllocationException,
	InvalidArgumentException,
	MalformedTreeException
{
	protected ConversionException(String message) {
		super(message);
	}

	protected ConversionException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return the status code reported to callers that prefer codes over exceptions
	 */
	public abstract ConvertStatus status();

	/**
	 * Prefixes the message with the location at which the failure occurred,
	 * keeping the same exception type.
	 */
	public static ConversionException wrap(ConversionException exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof AllocationException) {
			return new AllocationException(newMessage, exception);
		} else if (exception instanceof InvalidArgumentException) {
			return new InvalidArgumentException(newMessage, exception);
		} else {
			return new MalformedTreeException(newMessage, exception);
		}
	}
}
