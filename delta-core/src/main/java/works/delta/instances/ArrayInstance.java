package works.delta.instances;

import java.util.Arrays;
import works.delta.types.FixedArrayType;
import works.delta.types.ScalarType;

import static java.util.Objects.requireNonNull;

/**
 * A mutable, fixed-capacity sequence of elements.
 */
public final class ArrayInstance {
	private final FixedArrayType type;
	private final Object[] elements;

	ArrayInstance(FixedArrayType type, Object[] elements) {
		this.type = requireNonNull(type);
		assert elements.length == type.length();
		this.elements = elements;
	}

	public FixedArrayType type() {
		return type;
	}

	public int length() {
		return elements.length;
	}

	public Object get(int index) {
		return elements[index];
	}

	/**
	 * @return {@code this}
	 */
	public ArrayInstance set(int index, Object value) {
		if (type.element() instanceof ScalarType s) {
			elements[index] = s.normalize(value);
		} else {
			elements[index] = value;
		}
		return this;
	}

	public StructInstance struct(int index) {
		return (StructInstance) elements[index];
	}

	@Override
	public String toString() {
		return Arrays.toString(elements);
	}
}
