package works.delta.codec;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.delta.ConverterSettings;
import works.delta.CycleMarker;
import works.delta.TypeRegistry;
import works.delta.exceptions.AllocationException;
import works.delta.instances.ArrayInstance;
import works.delta.instances.Instances;
import works.delta.instances.StructInstance;
import works.delta.instances.UnionInstance;
import works.delta.naming.FieldNaming;
import works.delta.tree.ValueTree;
import works.delta.types.AggregateType;
import works.delta.types.BitfieldGroupType;
import works.delta.types.BitfieldMember;
import works.delta.types.FieldDescriptor;
import works.delta.types.FixedArrayType;
import works.delta.types.OwnedPointerType;
import works.delta.types.ScalarType;
import works.delta.types.TaggedUnionType;
import works.delta.types.TypeDescriptor;

import static works.delta.types.FieldDescriptor.Comparison.IDENTITY;

/**
 * Writes an instance as a value tree containing only what differs from a baseline.
 * <p>
 * With no baseline, everything is written. With a baseline, the result is the smallest tree that,
 * overlaid onto a copy of the baseline by {@link OverlayDeserializer}, reproduces the instance.
 * Null pointers and back-references are never written.
 * <p>
 * Serialization never modifies the instance or the baseline.
 * If the value tree can't create a node for some field, that field is left out and a warning is logged.
 */
public final class DiffingSerializer<N> {
	private final TypeRegistry registry;
	private final ValueTree<N> tree;
	private final ConverterSettings settings;
	private final FieldNaming naming;

	public DiffingSerializer(TypeRegistry registry, ValueTree<N> tree, ConverterSettings settings, FieldNaming naming) {
		this.registry = registry;
		this.tree = tree;
		this.settings = settings;
		this.naming = naming;
	}

	/**
	 * @param baseline null to write everything
	 * @return null if {@code instance} is null, if nothing at all needs to be written for a non-aggregate type,
	 * or if the root node couldn't be created.
	 * An aggregate with no differences from its baseline gives an empty object.
	 */
	public @Nullable N serialize(TypeDescriptor type, @Nullable Object instance, @Nullable Object baseline) {
		LOGGER.debug("Serializing {} {}", type.briefIdentifier(), (baseline == null) ? "in full" : "against baseline");
		if (instance == null) {
			return null;
		}
		Session session = newSession(type.briefIdentifier());
		try {
			if (registry.resolve(type) instanceof AggregateType a) {
				return session.aggregate(a, (StructInstance) instance, (StructInstance) baseline);
			} else {
				return session.diff(type, instance, baseline);
			}
		} catch (AllocationException e) {
			LOGGER.warn("Unable to create value tree for {}", type.briefIdentifier(), e);
			return null;
		}
	}

	Session newSession(String rootName) {
		return new Session(rootName);
	}

	final class Session {
		final VisitGuard guard = new VisitGuard(settings.getMaxDepth());
		final String rootName;
		final List<String> path = new ArrayList<>();

		Session(String rootName) {
			this.rootName = rootName;
		}

		/**
		 * @return the node to write, or null if nothing needs to be written
		 */
		@Nullable N diff(TypeDescriptor type, @Nullable Object value, @Nullable Object baseline) {
			if (value == null) {
				return null;
			}
			TypeDescriptor resolved = registry.resolve(type);
			if (resolved instanceof ScalarType s) {
				if (baseline != null && s.valuesEqual(value, baseline)) {
					return null;
				}
				return scalar(s, value);
			} else if (resolved instanceof FixedArrayType a) {
				if (baseline != null && Instances.structurallyEqual(a, value, baseline, registry)) {
					return null;
				}
				return fullArray(a, (ArrayInstance) value);
			} else if (resolved instanceof AggregateType a) {
				N result = aggregate(a, (StructInstance) value, (StructInstance) baseline);
				if (baseline != null && tree.size(result) == 0) {
					return null;
				}
				return result;
			} else if (resolved instanceof OwnedPointerType p) {
				return pointer(p, value, baseline);
			} else if (resolved instanceof TaggedUnionType u) {
				return union(u, (UnionInstance) value, (UnionInstance) baseline);
			} else if (resolved instanceof BitfieldGroupType g) {
				return bitfields(g, (Long) value, (Long) baseline);
			} else {
				// Back-references are implied by their owning pointer
				return null;
			}
		}

		N aggregate(AggregateType type, StructInstance value, @Nullable StructInstance baseline) {
			N result = tree.newObject();
			guard.enter(value);
			try {
				List<FieldDescriptor> fields = type.fields();
				for (int i = 0; i < fields.size(); i++) {
					FieldDescriptor field = fields.get(i);
					path.add("." + field.name());
					try {
						N child = field(field, value.get(i), (baseline == null) ? null : baseline.get(i));
						if (child != null) {
							tree.setMember(result, naming.keyFor(type, field), child);
						}
					} catch (AllocationException e) {
						LOGGER.warn("Omitting {}: unable to create node", currentPath(), e);
					} finally {
						path.remove(path.size() - 1);
					}
				}
			} finally {
				guard.exit(value);
			}
			return result;
		}

		private @Nullable N field(FieldDescriptor field, @Nullable Object value, @Nullable Object baseline) {
			if (field.comparison() == IDENTITY && !(registry.resolve(field.type()) instanceof ScalarType)) {
				if (baseline != null && Instances.structurallyEqual(field.type(), value, baseline, registry)) {
					return null;
				}
				return diff(field.type(), value, null);
			} else {
				return diff(field.type(), value, baseline);
			}
		}

		/**
		 * Every element, each written in full, so positions are preserved.
		 */
		private N fullArray(FixedArrayType type, ArrayInstance value) {
			N result = tree.newArray();
			for (int i = 0; i < value.length(); i++) {
				path.add("[" + i + "]");
				try {
					N element = diff(type.element(), value.get(i), null);
					tree.addElement(result, (element == null) ? tree.newNull() : element);
				} finally {
					path.remove(path.size() - 1);
				}
			}
			return result;
		}

		private @Nullable N pointer(OwnedPointerType type, Object pointee, @Nullable Object baselinePointee) {
			if (guard.isOnPath(pointee)) {
				LOGGER.debug("Cycle at {} ({} pointers deep)", currentPath(), guard.pointerDepth());
				if (settings.getCycleMarker() == CycleMarker.EMPTY_OBJECT) {
					return tree.newObject();
				} else {
					return null;
				}
			}
			if (guard.atDepthLimit()) {
				LOGGER.warn("Omitting {}: more than {} pointers deep", currentPath(), settings.getMaxDepth());
				return null;
			}
			guard.enterPointer();
			try {
				return diff(type.pointee(), pointee, baselinePointee);
			} finally {
				guard.exitPointer();
			}
		}

		/**
		 * Payloads are only diffed when the baseline holds the same alternative;
		 * a change of alternative writes the new payload in full.
		 */
		private @Nullable N union(TaggedUnionType type, UnionInstance value, @Nullable UnionInstance baseline) {
			TypeDescriptor alternative = type.alternative(value.tag());
			path.add("." + value.tag());
			try {
				boolean sameAlternative = baseline != null && baseline.tag().equals(value.tag());
				N payload = diff(alternative, value.payload(), sameAlternative ? baseline.payload() : null);
				if (payload == null) {
					return null;
				}
				N result = tree.newObject();
				tree.setMember(result, value.tag(), payload);
				return result;
			} finally {
				path.remove(path.size() - 1);
			}
		}

		private @Nullable N bitfields(BitfieldGroupType type, long word, @Nullable Long baselineWord) {
			N result = tree.newObject();
			for (BitfieldMember member : type.members()) {
				long value = member.extract(word);
				if (baselineWord == null || member.extract(baselineWord) != value) {
					tree.setMember(result, member.name(), tree.newNumber(value));
				}
			}
			if (baselineWord != null && tree.size(result) == 0) {
				return null;
			}
			return result;
		}

		private N scalar(ScalarType type, Object value) {
			Object normalized = type.normalize(value);
			switch (type.kind()) {
				case F32:
					// Widen through the shortest decimal form so 0.1F is written as 0.1
					return tree.newNumber(Double.parseDouble(normalized.toString()));
				case F64:
					return tree.newNumber((Double) normalized);
				case BOOL:
					return tree.newBoolean((Boolean) normalized);
				case TEXT:
					return tree.newString((String) normalized);
				default:
					return tree.newNumber((long) (Long) normalized);
			}
		}

		String currentPath() {
			return rootName + String.join("", path);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DiffingSerializer.class);
}
