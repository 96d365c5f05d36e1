package works.delta.types;

import static java.util.Objects.requireNonNull;

/**
 * Refers to a type registered by name in a {@link works.delta.TypeRegistry TypeRegistry}.
 * Makes it possible to describe recursive types.
 */
public record TypeRef(String name) implements TypeDescriptor {
	public TypeRef {
		requireNonNull(name);
	}

	public static TypeRef to(String name) {
		return new TypeRef(name);
	}

	@Override
	public String briefIdentifier() {
		return name;
	}

	@Override
	public String toString() {
		return "Ref:" + name;
	}
}
