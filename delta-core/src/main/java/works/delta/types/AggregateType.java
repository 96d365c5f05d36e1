package works.delta.types;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A structure with an ordered list of uniquely named fields.
 * Serialized as a JSON object whose members are the fields that differ from the baseline.
 */
public record AggregateType(
	String name,
	List<FieldDescriptor> fields
) implements TypeDescriptor {
	public AggregateType {
		requireNonNull(name);
		fields = List.copyOf(fields);
		Map<String, FieldDescriptor> seen = new HashMap<>();
		for (FieldDescriptor field : fields) {
			if (seen.put(field.name(), field) != null) {
				throw new IllegalArgumentException("Duplicate field \"" + field.name() + "\" in " + name);
			}
		}
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	/**
	 * @return the index of the named field, or -1 if there isn't one
	 */
	public int indexOf(String fieldName) {
		for (int i = 0; i < fields.size(); i++) {
			if (fields.get(i).name().equals(fieldName)) {
				return i;
			}
		}
		return -1;
	}

	public FieldDescriptor field(String fieldName) {
		int index = indexOf(fieldName);
		if (index < 0) {
			throw new IllegalArgumentException("No field \"" + fieldName + "\" in " + name);
		}
		return fields.get(index);
	}

	@Override
	public String briefIdentifier() {
		return name;
	}

	@Override
	public String toString() {
		return name + fields.stream().map(FieldDescriptor::toString).collect(joining(", ", "{", "}"));
	}

	public static final class Builder {
		private final String name;
		private final List<FieldDescriptor> fields = new ArrayList<>();

		Builder(String name) {
			this.name = requireNonNull(name);
		}

		public Builder field(String fieldName, TypeDescriptor type) {
			fields.add(FieldDescriptor.of(fieldName, type));
			return this;
		}

		public Builder field(FieldDescriptor field) {
			fields.add(requireNonNull(field));
			return this;
		}

		public AggregateType build() {
			return new AggregateType(name, fields);
		}
	}
}
