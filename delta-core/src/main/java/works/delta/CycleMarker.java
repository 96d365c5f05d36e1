package works.delta;

/**
 * What the serializer writes in place of an instance it is already in the middle of serializing.
 */
public enum CycleMarker {
	/**
	 * The field that would close the cycle is left out of its parent object.
	 */
	OMIT,

	/**
	 * The field is written as an empty object.
	 * Deserializing that empty object onto a fresh destination allocates a default pointee,
	 * so this marker does not restore the cycle; it only records that one was there.
	 */
	EMPTY_OBJECT,
}
