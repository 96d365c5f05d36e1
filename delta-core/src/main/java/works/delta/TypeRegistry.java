package works.delta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.delta.exceptions.InvalidFieldTypeException;
import works.delta.exceptions.InvalidTypeException;
import works.delta.types.AggregateType;
import works.delta.types.BackReferenceType;
import works.delta.types.BitfieldGroupType;
import works.delta.types.FieldDescriptor;
import works.delta.types.FixedArrayType;
import works.delta.types.OwnedPointerType;
import works.delta.types.ScalarType;
import works.delta.types.TaggedUnionType;
import works.delta.types.TypeDescriptor;
import works.delta.types.TypeRef;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * The closed set of named types a {@link DeltaCodec} can convert.
 * <p>
 * Each type is registered with an enable flag; only enabled types get converters.
 * {@link Builder#build()} checks that the enabled types hang together
 * and returns a registry that can no longer change.
 */
public final class TypeRegistry {
	private final Map<String, Entry> entries;

	private record Entry(TypeDescriptor type, boolean enabled) {}

	private TypeRegistry(Map<String, Entry> entries) {
		this.entries = entries;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Follows {@link TypeRef}s until reaching a concrete descriptor.
	 * Any other descriptor is returned unchanged.
	 *
	 * @throws IllegalArgumentException if a reference names an unregistered type
	 */
	public TypeDescriptor resolve(TypeDescriptor type) {
		TypeDescriptor result = type;
		// Aliases can't form loops; build() rejects them
		while (result instanceof TypeRef ref) {
			result = get(ref.name());
		}
		return result;
	}

	/**
	 * @throws IllegalArgumentException if there's no type with this name
	 */
	public TypeDescriptor get(String name) {
		Entry entry = entries.get(name);
		if (entry == null) {
			throw new IllegalArgumentException("No registered type named \"" + name + "\"");
		}
		return entry.type();
	}

	public boolean isRegistered(String name) {
		return entries.containsKey(name);
	}

	public boolean isEnabled(String name) {
		Entry entry = entries.get(name);
		return entry != null && entry.enabled();
	}

	/**
	 * @return names of the enabled types, in registration order
	 */
	public List<String> enabledNames() {
		return entries.entrySet().stream()
			.filter(e -> e.getValue().enabled())
			.map(Map.Entry::getKey)
			.toList();
	}

	/**
	 * @return the enabled types that resolve to an {@link AggregateType}, in registration order
	 */
	public List<AggregateType> enabledAggregates() {
		List<AggregateType> result = new ArrayList<>();
		for (String name : enabledNames()) {
			if (resolve(get(name)) instanceof AggregateType a && !result.contains(a)) {
				result.add(a);
			}
		}
		return result;
	}

	public String contentDescription() {
		return "{\n" + entries.entrySet().stream()
			.map(e -> "\t\"" + e.getKey() + "\": " + e.getValue().type() + (e.getValue().enabled() ? "" : " (disabled)"))
			.collect(joining("\n"))
			+ "\n}";
	}

	@Override
	public String toString() {
		return "TypeRegistry" + entries.keySet();
	}

	public static final class Builder {
		private final Map<String, Entry> entries = new LinkedHashMap<>();
		private final AtomicBoolean isBuilt = new AtomicBoolean(false);

		Builder() {}

		/**
		 * Registers an enabled aggregate under its own name.
		 */
		public Builder define(AggregateType type) {
			return define(type.name(), type, true);
		}

		public Builder define(String name, TypeDescriptor type) {
			return define(name, type, true);
		}

		/**
		 * @param enabled whether a converter is wanted for this type.
		 *                A disabled type may still be registered so that it can be enabled later
		 *                without changing its definition.
		 */
		public Builder define(String name, TypeDescriptor type, boolean enabled) {
			if (isBuilt.get()) {
				throw new IllegalStateException("TypeRegistry is frozen");
			}
			requireNonNull(name);
			requireNonNull(type);
			if (type instanceof TypeRef ref && ref.name().equals(name)) {
				throw new IllegalArgumentException("Type \"" + name + "\" can't be defined as a reference to itself");
			}
			if (entries.putIfAbsent(name, new Entry(type, enabled)) != null) {
				throw new IllegalArgumentException("Type \"" + name + "\" is already registered");
			}
			return this;
		}

		/**
		 * @throws InvalidTypeException if an enabled type depends on a type that isn't registered and enabled,
		 * if a back-reference doesn't mirror an owned pointer,
		 * or if an aggregate contains itself by value
		 */
		public TypeRegistry build() throws InvalidTypeException {
			if (isBuilt.getAndSet(true)) {
				throw new IllegalStateException("TypeRegistry is frozen");
			}
			TypeRegistry result = new TypeRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
			Validator validator = new Validator(result);
			for (var e : entries.entrySet()) {
				if (e.getValue().enabled()) {
					validator.checkAliases(e.getKey());
				}
			}
			for (var e : entries.entrySet()) {
				if (e.getValue().enabled()) {
					validator.checkDescriptor(e.getKey(), e.getValue().type());
				}
			}
			for (var e : entries.entrySet()) {
				if (e.getValue().enabled()) {
					validator.checkByValueContainment(e.getKey());
				}
			}
			LOGGER.debug("Built {} with {} enabled types", result, result.enabledNames().size());
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("Registered types:\n{}", result.contentDescription());
			}
			return result;
		}
	}

	private record Validator(TypeRegistry registry) {
		void checkAliases(String name) throws InvalidTypeException {
			Set<String> seen = new LinkedHashSet<>();
			String current = name;
			while (seen.add(current)) {
				TypeDescriptor type = registry.entries.get(current).type();
				if (type instanceof TypeRef ref) {
					requireEnabled(name, ref.name());
					current = ref.name();
				} else {
					return;
				}
			}
			throw new InvalidTypeException("Type references form a loop: " + String.join(" -> ", seen) + " -> " + current);
		}

		void checkDescriptor(String owner, TypeDescriptor type) throws InvalidTypeException {
			if (type instanceof AggregateType a) {
				for (FieldDescriptor field : a.fields()) {
					try {
						checkField(owner, a, field.type());
					} catch (InvalidFieldTypeException e) {
						throw e;
					} catch (InvalidTypeException e) {
						throw new InvalidFieldTypeException(a.name(), field.name(), e.getMessage(), e);
					}
				}
			} else {
				checkField(owner, null, type);
			}
		}

		private void checkField(String owner, AggregateType container, TypeDescriptor type) throws InvalidTypeException {
			if (type instanceof ScalarType || type instanceof BitfieldGroupType) {
				return;
			} else if (type instanceof TypeRef ref) {
				requireEnabled(owner, ref.name());
			} else if (type instanceof FixedArrayType a) {
				checkField(owner, container, a.element());
			} else if (type instanceof OwnedPointerType p) {
				checkField(owner, container, p.pointee());
			} else if (type instanceof TaggedUnionType u) {
				for (TypeDescriptor alternative : u.alternatives().values()) {
					checkField(owner, container, alternative);
				}
			} else if (type instanceof AggregateType a) {
				checkDescriptor(owner, a);
			} else if (type instanceof BackReferenceType b) {
				checkBackReference(owner, container, b);
			}
		}

		private void checkBackReference(String owner, AggregateType container, BackReferenceType b) throws InvalidTypeException {
			requireEnabled(owner, b.targetType());
			if (!(registry.resolve(registry.get(b.targetType())) instanceof AggregateType target)) {
				throw new InvalidTypeException("Back-reference target " + b.targetType() + " is not an aggregate");
			}
			if (container == null) {
				throw new InvalidTypeException("Back-reference " + b + " must be a field of an aggregate");
			}
			int index = target.indexOf(b.inverseOf());
			if (index < 0) {
				throw new InvalidTypeException("Back-reference target " + target.name() + " has no field \"" + b.inverseOf() + "\"");
			}
			TypeDescriptor inverse = target.fields().get(index).type();
			if (!(inverse instanceof OwnedPointerType p) || !registry.resolve(p.pointee()).equals(container)) {
				throw new InvalidTypeException("Field " + target.name() + "." + b.inverseOf()
					+ " must be an owned pointer to " + container.name() + " to be the inverse of a back-reference; found " + inverse);
			}
		}

		/**
		 * An aggregate that holds itself inline, directly or through arrays and other aggregates,
		 * would have infinite size.
		 */
		void checkByValueContainment(String name) throws InvalidTypeException {
			TypeDescriptor root = registry.resolve(registry.get(name));
			if (root instanceof AggregateType a) {
				walkByValue(a, new ArrayList<>());
			}
		}

		private void walkByValue(AggregateType type, List<String> path) throws InvalidTypeException {
			if (path.contains(type.name())) {
				throw new InvalidTypeException("Type " + type.name() + " contains itself by value: "
					+ String.join(" -> ", path) + " -> " + type.name());
			}
			path.add(type.name());
			for (FieldDescriptor field : type.fields()) {
				TypeDescriptor fieldType = registry.resolve(field.type());
				while (fieldType instanceof FixedArrayType array) {
					fieldType = registry.resolve(array.element());
				}
				if (fieldType instanceof AggregateType nested) {
					walkByValue(nested, path);
				}
			}
			path.remove(path.size() - 1);
		}

		private void requireEnabled(String dependent, String dependency) throws InvalidTypeException {
			if (!registry.isRegistered(dependency)) {
				throw new InvalidTypeException(dependent + " converter requires " + dependency + " converter, which is not registered");
			}
			if (!registry.isEnabled(dependency)) {
				throw new InvalidTypeException(dependent + " converter requires " + dependency + " converter to be enabled");
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);
}
