package works.delta.instances;

import static java.util.Objects.requireNonNull;

/**
 * The value of a {@link works.delta.types.TaggedUnionType TaggedUnionType}:
 * the active alternative's name and its payload.
 */
public record UnionInstance(String tag, Object payload) {
	public UnionInstance {
		requireNonNull(tag);
		requireNonNull(payload);
	}

	public static UnionInstance of(String tag, Object payload) {
		return new UnionInstance(tag, payload);
	}
}
