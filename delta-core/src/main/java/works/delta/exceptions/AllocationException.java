package works.delta.exceptions;

import works.delta.ConvertStatus;

/**
 * An instance could not be materialized during deserialization,
 * or the value tree could not create a node during serialization.
 */
public final class AllocationException extends ConversionException {
	public AllocationException(String message) {
		super(message);
	}

	public AllocationException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public ConvertStatus status() {
		return ConvertStatus.ALLOCATION_ERROR;
	}
}
