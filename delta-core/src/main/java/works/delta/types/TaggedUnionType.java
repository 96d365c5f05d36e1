package works.delta.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A value that holds exactly one of several named alternatives.
 * <p>
 * The in-memory form carries its discriminant explicitly
 * (see {@link works.delta.instances.UnionInstance UnionInstance}),
 * so the active alternative is never inferred from raw storage.
 * In the value tree, a union is an object with a single member whose name is the tag.
 *
 * @param alternatives in declaration order
 */
public record TaggedUnionType(
	String name,
	Map<String, TypeDescriptor> alternatives
) implements TypeDescriptor {
	public TaggedUnionType {
		requireNonNull(name);
		if (alternatives.isEmpty()) {
			throw new IllegalArgumentException("Union " + name + " has no alternatives");
		}
		alternatives = Collections.unmodifiableMap(new LinkedHashMap<>(alternatives));
	}

	/**
	 * @throws IllegalArgumentException if {@code tag} isn't one of the alternatives
	 */
	public TypeDescriptor alternative(String tag) {
		TypeDescriptor result = alternatives.get(tag);
		if (result == null) {
			throw new IllegalArgumentException("Union " + name + " has no alternative \"" + tag + "\"; expected one of " + alternatives.keySet());
		}
		return result;
	}

	@Override
	public String briefIdentifier() {
		return name;
	}

	@Override
	public String toString() {
		return "union " + name + alternatives;
	}
}
