package works.delta.exceptions;

import works.delta.ConvertStatus;

/**
 * A required argument (the value tree or the destination instance) was absent.
 * Checked before any other work is done.
 */
public final class InvalidArgumentException extends ConversionException {
	public InvalidArgumentException(String message) {
		super(message);
	}

	public InvalidArgumentException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public ConvertStatus status() {
		return ConvertStatus.INVALID_PARAM;
	}
}
