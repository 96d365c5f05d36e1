/**
 * Exceptions thrown by conversions ({@link works.delta.exceptions.ConversionException} and subclasses)
 * and by type registration ({@link works.delta.exceptions.InvalidTypeException}).
 */
package works.delta.exceptions;
