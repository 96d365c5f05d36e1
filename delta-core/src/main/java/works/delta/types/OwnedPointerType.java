package works.delta.types;

import static java.util.Objects.requireNonNull;

/**
 * A field that is either null or the exclusive owner of one pointee instance.
 * <p>
 * For self-referential types, {@code pointee} is usually a {@link TypeRef}.
 */
public record OwnedPointerType(TypeDescriptor pointee) implements TypeDescriptor {
	public OwnedPointerType {
		requireNonNull(pointee);
	}

	public static OwnedPointerType to(TypeDescriptor pointee) {
		return new OwnedPointerType(pointee);
	}

	@Override
	public String briefIdentifier() {
		return pointee.briefIdentifier() + "*";
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}
}
