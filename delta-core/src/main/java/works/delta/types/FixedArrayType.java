package works.delta.types;

import static java.util.Objects.requireNonNull;

/**
 * A sequence of {@code length} elements of one type, owned by its container.
 * Multi-dimensional arrays are arrays whose element type is itself a {@link FixedArrayType}.
 */
public record FixedArrayType(TypeDescriptor element, int length) implements TypeDescriptor {
	public FixedArrayType {
		requireNonNull(element);
		if (length < 1) {
			throw new IllegalArgumentException("Array length must be positive: " + length);
		}
	}

	public static FixedArrayType of(TypeDescriptor element, int length) {
		return new FixedArrayType(element, length);
	}

	@Override
	public String briefIdentifier() {
		return element.briefIdentifier() + "[" + length + "]";
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}
}
