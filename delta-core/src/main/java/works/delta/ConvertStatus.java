package works.delta;

import works.delta.exceptions.ConversionException;

/**
 * Outcome of a decode operation, for callers that prefer status codes to exceptions.
 *
 * @see ConversionException#status()
 */
public enum ConvertStatus {
	SUCCESS,
	ALLOCATION_ERROR,
	PARSE_ERROR,
	INVALID_PARAM,
}
