package works.delta.instances;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.delta.TypeRegistry;
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

/**
 * Creation, copying, and comparison of instances, driven by their type descriptors.
 */
public final class Instances {
	private Instances() {}

	/**
	 * Zero for numbers, false, empty text, null pointers and unions,
	 * and recursively defaulted aggregates and arrays.
	 */
	public static Object defaultValue(TypeDescriptor type, TypeRegistry registry) {
		TypeDescriptor resolved = registry.resolve(type);
		if (resolved instanceof ScalarType s) {
			return s.defaultValue();
		} else if (resolved instanceof FixedArrayType a) {
			Object[] elements = new Object[a.length()];
			for (int i = 0; i < elements.length; i++) {
				elements[i] = defaultValue(a.element(), registry);
			}
			return new ArrayInstance(a, elements);
		} else if (resolved instanceof AggregateType a) {
			List<FieldDescriptor> fields = a.fields();
			Object[] slots = new Object[fields.size()];
			for (int i = 0; i < slots.length; i++) {
				slots[i] = defaultValue(fields.get(i).type(), registry);
			}
			return new StructInstance(a, slots);
		} else if (resolved instanceof BitfieldGroupType) {
			return 0L;
		} else {
			// Pointers, back-references, and unions start out absent
			return null;
		}
	}

	public static StructInstance newStruct(AggregateType type, TypeRegistry registry) {
		return (StructInstance) defaultValue(type, registry);
	}

	public static StructInstance newStruct(String typeName, TypeRegistry registry) {
		return (StructInstance) defaultValue(new TypeRef(typeName), registry);
	}

	public static ArrayInstance newArray(FixedArrayType type, TypeRegistry registry) {
		return (ArrayInstance) defaultValue(type, registry);
	}

	/**
	 * Copies {@code value} so that the copy shares no mutable state with the original.
	 * <p>
	 * Owned pointees are copied too, because ownership is exclusive.
	 * Cycles are reproduced in the copy, and back-references to copied instances
	 * are redirected to the corresponding copy; other back-references are kept as they are.
	 */
	public static Object deepCopy(TypeDescriptor type, @Nullable Object value, TypeRegistry registry) {
		return new Copier(registry).copy(type, value);
	}

	/**
	 * Makes {@code destination} a deep copy of {@code source}, in place.
	 * References inside {@code source} that point back at {@code source} itself
	 * end up pointing at {@code destination}.
	 *
	 * @param destination a {@link StructInstance} or {@link ArrayInstance} of the same type as {@code source}
	 */
	public static void copyInto(TypeDescriptor type, Object source, Object destination, TypeRegistry registry) {
		TypeDescriptor resolved = registry.resolve(type);
		Copier copier = new Copier(registry);
		if (resolved instanceof AggregateType a) {
			StructInstance from = (StructInstance) source;
			StructInstance to = (StructInstance) destination;
			copier.copies.put(from, to);
			copier.fillStruct(a, from, to);
		} else if (resolved instanceof FixedArrayType a) {
			ArrayInstance from = (ArrayInstance) source;
			ArrayInstance to = (ArrayInstance) destination;
			copier.copies.put(from, to);
			for (int i = 0; i < from.length(); i++) {
				to.set(i, copier.copy(a.element(), from.get(i)));
			}
		} else {
			throw new IllegalArgumentException("Can only copy into aggregates and arrays, not " + resolved);
		}
	}

	/**
	 * Compares contents rather than identity.
	 * Back-references are not compared, since they only observe structure that is compared elsewhere.
	 * A pair of instances already under comparison is assumed equal, which makes cyclic structures terminate.
	 */
	public static boolean structurallyEqual(TypeDescriptor type, @Nullable Object a, @Nullable Object b, TypeRegistry registry) {
		return new Comparer(registry).equal(type, a, b);
	}

	private static final class Copier {
		final TypeRegistry registry;
		final Map<Object, Object> copies = new IdentityHashMap<>();

		Copier(TypeRegistry registry) {
			this.registry = registry;
		}

		void fillStruct(AggregateType type, StructInstance original, StructInstance result) {
			List<FieldDescriptor> fields = type.fields();
			for (int i = 0; i < fields.size(); i++) {
				if (!(registry.resolve(fields.get(i).type()) instanceof BackReferenceType)) {
					result.set(i, copy(fields.get(i).type(), original.get(i)));
				}
			}
			// Back-references last, once everything they might point at has been copied
			for (int i = 0; i < fields.size(); i++) {
				if (registry.resolve(fields.get(i).type()) instanceof BackReferenceType) {
					Object target = original.get(i);
					Object targetCopy = (target == null) ? null : copies.get(target);
					result.set(i, (targetCopy == null) ? target : targetCopy);
				}
			}
		}

		Object copy(TypeDescriptor type, Object value) {
			if (value == null) {
				return null;
			}
			TypeDescriptor resolved = registry.resolve(type);
			if (resolved instanceof ScalarType || resolved instanceof BitfieldGroupType) {
				return value;
			} else if (resolved instanceof FixedArrayType a) {
				ArrayInstance original = (ArrayInstance) value;
				Object[] elements = new Object[original.length()];
				ArrayInstance result = new ArrayInstance(a, elements);
				copies.put(original, result);
				for (int i = 0; i < elements.length; i++) {
					elements[i] = copy(a.element(), original.get(i));
				}
				return result;
			} else if (resolved instanceof AggregateType a) {
				StructInstance original = (StructInstance) value;
				Object existing = copies.get(original);
				if (existing != null) {
					return existing;
				}
				StructInstance result = new StructInstance(a, new Object[a.fields().size()]);
				copies.put(original, result);
				fillStruct(a, original, result);
				return result;
			} else if (resolved instanceof OwnedPointerType p) {
				Object existing = copies.get(value);
				if (existing != null) {
					return existing;
				}
				return copy(p.pointee(), value);
			} else if (resolved instanceof TaggedUnionType u) {
				UnionInstance union = (UnionInstance) value;
				return new UnionInstance(union.tag(), copy(u.alternative(union.tag()), union.payload()));
			} else {
				// Back-references are resolved by the owning aggregate
				return value;
			}
		}
	}

	private static final class Comparer {
		final TypeRegistry registry;
		final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

		Comparer(TypeRegistry registry) {
			this.registry = registry;
		}

		boolean equal(TypeDescriptor type, Object a, Object b) {
			if (a == b) {
				return true;
			} else if (a == null || b == null) {
				return false;
			}
			TypeDescriptor resolved = registry.resolve(type);
			if (resolved instanceof ScalarType s) {
				return s.valuesEqual(a, b);
			} else if (resolved instanceof BitfieldGroupType g) {
				long wordA = (Long) a;
				long wordB = (Long) b;
				return g.members().stream().allMatch(m -> m.extract(wordA) == m.extract(wordB));
			} else if (resolved instanceof FixedArrayType t) {
				ArrayInstance arrayA = (ArrayInstance) a;
				ArrayInstance arrayB = (ArrayInstance) b;
				if (arrayA.length() != arrayB.length()) {
					return false;
				}
				for (int i = 0; i < arrayA.length(); i++) {
					if (!equal(t.element(), arrayA.get(i), arrayB.get(i))) {
						return false;
					}
				}
				return true;
			} else if (resolved instanceof AggregateType t) {
				if (!inProgress.add(a)) {
					return true;
				}
				try {
					StructInstance structA = (StructInstance) a;
					StructInstance structB = (StructInstance) b;
					List<FieldDescriptor> fields = t.fields();
					for (int i = 0; i < fields.size(); i++) {
						TypeDescriptor fieldType = fields.get(i).type();
						if (registry.resolve(fieldType) instanceof BackReferenceType) {
							continue;
						}
						if (!equal(fieldType, structA.get(i), structB.get(i))) {
							return false;
						}
					}
					return true;
				} finally {
					inProgress.remove(a);
				}
			} else if (resolved instanceof OwnedPointerType p) {
				return equal(p.pointee(), a, b);
			} else if (resolved instanceof TaggedUnionType u) {
				UnionInstance unionA = (UnionInstance) a;
				UnionInstance unionB = (UnionInstance) b;
				return unionA.tag().equals(unionB.tag())
					&& equal(u.alternative(unionA.tag()), unionA.payload(), unionB.payload());
			} else {
				return true;
			}
		}
	}
}
