package works.delta.types;

import static java.util.Objects.requireNonNull;

/**
 * A non-owning link back to the instance that owns this one,
 * such as the {@code prev} field of a doubly linked list node.
 * <p>
 * Back-references are never written to the value tree.
 * When deserialization materializes a pointee through the owned pointer field named {@code inverseOf},
 * the pointee's back-reference is pointed at its new owner.
 *
 * @param targetType name of the registered aggregate type the link refers to
 * @param inverseOf name of the owning pointer field, in {@code targetType}, that this link mirrors
 */
public record BackReferenceType(String targetType, String inverseOf) implements TypeDescriptor {
	public BackReferenceType {
		requireNonNull(targetType);
		requireNonNull(inverseOf);
	}

	@Override
	public String briefIdentifier() {
		return "&" + targetType;
	}

	@Override
	public String toString() {
		return briefIdentifier() + "<-" + inverseOf;
	}
}
