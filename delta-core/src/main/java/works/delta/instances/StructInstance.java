package works.delta.instances;

import java.util.StringJoiner;
import works.delta.types.AggregateType;
import works.delta.types.FieldDescriptor;
import works.delta.types.ScalarType;

import static java.util.Objects.requireNonNull;

/**
 * A mutable in-memory instance of an {@link AggregateType}, holding one slot per field.
 * <p>
 * Identity matters: the conversion engine tracks instances by reference
 * to detect cycles, so this class deliberately does not override {@code equals}.
 * Use {@link Instances#structurallyEqual} to compare contents.
 */
public final class StructInstance {
	private final AggregateType type;
	private final Object[] slots;

	StructInstance(AggregateType type, Object[] slots) {
		this.type = requireNonNull(type);
		assert slots.length == type.fields().size();
		this.slots = slots;
	}

	public AggregateType type() {
		return type;
	}

	public Object get(int index) {
		return slots[index];
	}

	public Object get(String fieldName) {
		return slots[indexOf(fieldName)];
	}

	/**
	 * Scalars are normalized to their field's canonical form;
	 * other values are stored as given.
	 *
	 * @return {@code this}
	 */
	public StructInstance set(String fieldName, Object value) {
		return set(indexOf(fieldName), value);
	}

	public StructInstance set(int index, Object value) {
		FieldDescriptor field = type.fields().get(index);
		if (field.type() instanceof ScalarType s) {
			slots[index] = s.normalize(value);
		} else {
			slots[index] = value;
		}
		return this;
	}

	/**
	 * Convenience for fixtures and tests: the nested {@link StructInstance} in the given field.
	 */
	public StructInstance struct(String fieldName) {
		return (StructInstance) get(fieldName);
	}

	public ArrayInstance array(String fieldName) {
		return (ArrayInstance) get(fieldName);
	}

	private int indexOf(String fieldName) {
		int index = type.indexOf(fieldName);
		if (index < 0) {
			throw new IllegalArgumentException("No field \"" + fieldName + "\" in " + type.name());
		}
		return index;
	}

	@Override
	public String toString() {
		StringJoiner result = new StringJoiner(", ", type.name() + "{", "}");
		for (int i = 0; i < slots.length; i++) {
			Object slot = slots[i];
			String rendered;
			if (slot instanceof StructInstance s) {
				// Avoid walking cycles
				rendered = s.type().name() + "@" + Integer.toHexString(System.identityHashCode(s));
			} else {
				rendered = String.valueOf(slot);
			}
			result.add(type.fields().get(i).name() + "=" + rendered);
		}
		return result.toString();
	}
}
