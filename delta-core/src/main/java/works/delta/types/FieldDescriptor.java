package works.delta.types;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * One named member of an {@link AggregateType}.
 *
 * @param comparison how this field is compared against a baseline when serializing
 */
public record FieldDescriptor(
	String name,
	TypeDescriptor type,
	Comparison comparison
) {
	public FieldDescriptor {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(comparison);
		if (!IDENTIFIER.matcher(name).matches()) {
			throw new IllegalArgumentException("Invalid field name \"" + name + "\"");
		}
	}

	public static FieldDescriptor of(String name, TypeDescriptor type) {
		return new FieldDescriptor(name, type, Comparison.defaultFor(type));
	}

	public static FieldDescriptor identity(String name, TypeDescriptor type) {
		return new FieldDescriptor(name, type, Comparison.IDENTITY);
	}

	public enum Comparison {
		/**
		 * Value equality; when the field differs from its baseline it is written out in full.
		 */
		IDENTITY,

		/**
		 * Member-by-member; only the differing members are written.
		 */
		STRUCTURAL;

		public static Comparison defaultFor(TypeDescriptor type) {
			if (type instanceof ScalarType || type instanceof FixedArrayType) {
				return IDENTITY;
			} else {
				return STRUCTURAL;
			}
		}
	}

	@Override
	public String toString() {
		return name + ":" + type;
	}

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
}
