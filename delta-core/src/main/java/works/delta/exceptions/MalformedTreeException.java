package works.delta.exceptions;

import works.delta.ConvertStatus;

/**
 * The value tree does not have the shape the target type requires,
 * such as an array where an object was expected.
 */
public final class MalformedTreeException extends ConversionException {
	public MalformedTreeException(String message) {
		super(message);
	}

	public MalformedTreeException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public ConvertStatus status() {
		return ConvertStatus.PARSE_ERROR;
	}
}
