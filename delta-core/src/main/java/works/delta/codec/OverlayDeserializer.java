package works.delta.codec;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.delta.ConverterSettings;
import works.delta.TypeRegistry;
import works.delta.exceptions.AllocationException;
import works.delta.exceptions.ConversionException;
import works.delta.exceptions.InvalidArgumentException;
import works.delta.exceptions.MalformedTreeException;
import works.delta.instances.ArrayInstance;
import works.delta.instances.InstanceAllocator;
import works.delta.instances.Instances;
import works.delta.instances.StructInstance;
import works.delta.instances.UnionInstance;
import works.delta.naming.FieldNaming;
import works.delta.tree.NodeKind;
import works.delta.tree.ValueTree;
import works.delta.types.AggregateType;
import works.delta.types.BackReferenceType;
import works.delta.types.BitfieldGroupType;
import works.delta.types.BitfieldMember;
import works.delta.types.FieldDescriptor;
import works.delta.types.FixedArrayType;
import works.delta.types.OwnedPointerType;
import works.delta.types.ScalarKind;
import works.delta.types.ScalarType;
import works.delta.types.TaggedUnionType;
import works.delta.types.TypeDescriptor;

/**
 * Reads a value tree onto a destination that starts out as a copy of a baseline.
 * <p>
 * Only members present in the tree are read; everything else keeps its baseline value.
 * A member that is explicitly null counts as absent. Unknown members are ignored.
 * Owned pointers that are null in the destination are allocated, through the {@link InstanceAllocator},
 * when the tree has something for them.
 * <p>
 * The first failure aborts the whole call. The destination is not rolled back,
 * so it may be left partially populated.
 */
public final class OverlayDeserializer<N> {
	private final TypeRegistry registry;
	private final ValueTree<N> tree;
	private final ConverterSettings settings;
	private final FieldNaming naming;
	private final InstanceAllocator allocator;

	public OverlayDeserializer(TypeRegistry registry, ValueTree<N> tree, ConverterSettings settings, FieldNaming naming, InstanceAllocator allocator) {
		this.registry = registry;
		this.tree = tree;
		this.settings = settings;
		this.naming = naming;
		this.allocator = allocator;
	}

	/**
	 * Allocates a new instance of {@code type}, then proceeds as for {@link #deserializeInto}.
	 * Types other than aggregates and arrays, whose instances are immutable, are decoded directly.
	 *
	 * @throws InvalidArgumentException if {@code node} is null
	 * @throws MalformedTreeException if the tree doesn't have the shape {@code type} requires
	 * @throws AllocationException if an instance couldn't be allocated
	 */
	public Object deserialize(TypeDescriptor type, @Nullable N node, @Nullable Object baseline) {
		if (node == null) {
			throw new InvalidArgumentException("No value tree to deserialize as " + type.briefIdentifier());
		}
		TypeDescriptor resolved = registry.resolve(type);
		Session session = newSession(type.briefIdentifier());
		if (resolved instanceof AggregateType || resolved instanceof FixedArrayType) {
			Object result = session.allocate(type);
			deserializeInto(type, node, baseline, result);
			return result;
		} else {
			Object current = (baseline == null) ? Instances.defaultValue(type, registry) : Instances.deepCopy(type, baseline, registry);
			if (isAbsent(node)) {
				return current;
			}
			return session.overlay(type, node, current);
		}
	}

	/**
	 * Copies {@code baseline}, if any, into {@code out}, then overlays the contents of {@code node}.
	 * With no baseline, {@code out} keeps whatever it held wherever the tree is silent.
	 *
	 * @param out a {@link StructInstance} or {@link ArrayInstance} of the given type
	 * @throws InvalidArgumentException if {@code node} or {@code out} is null, or {@code out} doesn't fit {@code type}
	 * @throws MalformedTreeException if the tree doesn't have the shape {@code type} requires
	 * @throws AllocationException if a pointee couldn't be allocated
	 */
	public void deserializeInto(TypeDescriptor type, @Nullable N node, @Nullable Object baseline, @Nullable Object out) {
		if (node == null) {
			throw new InvalidArgumentException("No value tree to deserialize as " + type.briefIdentifier());
		}
		if (out == null) {
			throw new InvalidArgumentException("No destination for " + type.briefIdentifier());
		}
		LOGGER.debug("Deserializing {} {}", type.briefIdentifier(), (baseline == null) ? "onto destination" : "onto baseline");
		TypeDescriptor resolved = registry.resolve(type);
		Session session = newSession(type.briefIdentifier());
		if (resolved instanceof AggregateType a) {
			if (!(out instanceof StructInstance s) || !s.type().equals(a)) {
				throw new InvalidArgumentException("Destination is not an instance of " + a.name() + ": " + out);
			}
			if (baseline != null && (!(baseline instanceof StructInstance b) || !b.type().equals(a))) {
				throw new InvalidArgumentException("Baseline is not an instance of " + a.name() + ": " + baseline);
			}
			session.requireKind(node, NodeKind.OBJECT, a);
		} else if (resolved instanceof FixedArrayType a) {
			if (!(out instanceof ArrayInstance array) || array.length() != a.length()) {
				throw new InvalidArgumentException("Destination is not an array of length " + a.length() + ": " + out);
			}
			if (baseline != null && (!(baseline instanceof ArrayInstance b) || b.length() != a.length())) {
				throw new InvalidArgumentException("Baseline is not an array of length " + a.length() + ": " + baseline);
			}
			session.requireKind(node, NodeKind.ARRAY, a);
		} else {
			throw new InvalidArgumentException("Can only deserialize into aggregates and arrays, not " + type.briefIdentifier());
		}
		if (baseline != null) {
			Instances.copyInto(type, baseline, out, registry);
		}
		session.overlay(type, node, out);
	}

	Session newSession(String rootName) {
		return new Session(rootName);
	}

	boolean isAbsent(@Nullable N node) {
		return node == null || tree.kindOf(node) == NodeKind.NULL;
	}

	final class Session {
		final VisitGuard guard = new VisitGuard(settings.getMaxDepth());
		final String rootName;
		final List<String> path = new ArrayList<>();

		Session(String rootName) {
			this.rootName = rootName;
		}

		/**
		 * @param current the destination's existing value; aggregates and arrays are updated in place
		 * @return the new value for the destination
		 */
		Object overlay(TypeDescriptor type, N node, @Nullable Object current) {
			TypeDescriptor resolved = registry.resolve(type);
			if (resolved instanceof ScalarType s) {
				return scalar(s, node, current);
			} else if (resolved instanceof AggregateType a) {
				return aggregate(a, node, (StructInstance) current);
			} else if (resolved instanceof FixedArrayType a) {
				return array(a, node, (ArrayInstance) current);
			} else if (resolved instanceof OwnedPointerType p) {
				return pointer(p, node, current);
			} else if (resolved instanceof TaggedUnionType u) {
				return union(u, node, (UnionInstance) current);
			} else if (resolved instanceof BitfieldGroupType g) {
				return bitfields(g, node, (Long) current);
			} else {
				// Back-references are never read; the owning pointer sets them
				return current;
			}
		}

		private StructInstance aggregate(AggregateType type, N node, StructInstance current) {
			requireKind(node, NodeKind.OBJECT, type);
			guard.enter(current);
			try {
				List<FieldDescriptor> fields = type.fields();
				for (int i = 0; i < fields.size(); i++) {
					FieldDescriptor field = fields.get(i);
					if (registry.resolve(field.type()) instanceof BackReferenceType) {
						continue;
					}
					N child = tree.getMember(node, naming.keyFor(type, field));
					if (isAbsent(child)) {
						continue;
					}
					path.add("." + field.name());
					try {
						Object updated = overlay(field.type(), child, current.get(i));
						current.set(i, updated);
						if (updated instanceof StructInstance pointee && registry.resolve(field.type()) instanceof OwnedPointerType) {
							linkBackReferences(type, field, current, pointee);
						}
					} finally {
						path.remove(path.size() - 1);
					}
				}
			} finally {
				guard.exit(current);
			}
			return current;
		}

		/**
		 * Points every back-reference in {@code pointee} that mirrors {@code field} at {@code owner}.
		 */
		private void linkBackReferences(AggregateType ownerType, FieldDescriptor field, StructInstance owner, StructInstance pointee) {
			List<FieldDescriptor> pointeeFields = pointee.type().fields();
			for (int i = 0; i < pointeeFields.size(); i++) {
				if (registry.resolve(pointeeFields.get(i).type()) instanceof BackReferenceType b
					&& b.inverseOf().equals(field.name())
					&& registry.resolve(registry.get(b.targetType())).equals(ownerType)) {
					pointee.set(i, owner);
				}
			}
		}

		private ArrayInstance array(FixedArrayType type, N node, ArrayInstance current) {
			requireKind(node, NodeKind.ARRAY, type);
			int size = tree.size(node);
			int count = ArrayConverter.copyCount(size, type.length());
			if (count < size) {
				LOGGER.debug("Discarding {} excess elements at {}", size - count, currentPath());
			}
			for (int i = 0; i < count; i++) {
				N element = tree.getElement(node, i);
				if (isAbsent(element)) {
					continue;
				}
				path.add("[" + i + "]");
				try {
					current.set(i, overlay(type.element(), element, current.get(i)));
				} finally {
					path.remove(path.size() - 1);
				}
			}
			return current;
		}

		private @Nullable Object pointer(OwnedPointerType type, N node, @Nullable Object current) {
			if (current != null && guard.isOnPath(current)) {
				LOGGER.debug("Cycle at {}; leaving pointee as is", currentPath());
				return current;
			}
			if (guard.atDepthLimit()) {
				throw new MalformedTreeException(currentPath() + ": more than " + settings.getMaxDepth() + " pointers deep");
			}
			Object pointee = (current == null) ? fresh(type.pointee()) : current;
			guard.enterPointer();
			try {
				return overlay(type.pointee(), node, pointee);
			} finally {
				guard.exitPointer();
			}
		}

		/**
		 * An empty object leaves the union alone. Otherwise, the single member names the alternative;
		 * if that's the alternative already held, its payload is overlaid, and if not, a fresh payload is.
		 */
		private @Nullable UnionInstance union(TaggedUnionType type, N node, @Nullable UnionInstance current) {
			requireKind(node, NodeKind.OBJECT, type);
			List<String> names = tree.memberNames(node);
			if (names.isEmpty()) {
				return current;
			}
			if (names.size() > 1) {
				throw new MalformedTreeException(currentPath() + ": union " + type.name() + " must have exactly one member; found " + names);
			}
			String tag = names.get(0);
			TypeDescriptor alternative = type.alternatives().get(tag);
			if (alternative == null) {
				throw new MalformedTreeException(currentPath() + ": union " + type.name() + " has no alternative \"" + tag + "\"");
			}
			N payloadNode = tree.getMember(node, tag);
			if (isAbsent(payloadNode)) {
				return current;
			}
			path.add("." + tag);
			try {
				Object payload = (current != null && current.tag().equals(tag)) ? current.payload() : fresh(alternative);
				Object updated = overlay(alternative, payloadNode, payload);
				if (updated == null) {
					return current;
				}
				return new UnionInstance(tag, updated);
			} finally {
				path.remove(path.size() - 1);
			}
		}

		/**
		 * Sub-fields are written into their own bit ranges one at a time,
		 * so the order of members in the tree doesn't matter.
		 */
		private Long bitfields(BitfieldGroupType type, N node, @Nullable Long current) {
			requireKind(node, NodeKind.OBJECT, type);
			long word = (current == null) ? 0L : current;
			for (BitfieldMember member : type.members()) {
				N child = tree.getMember(node, member.name());
				if (isAbsent(child)) {
					continue;
				}
				if (tree.kindOf(child) != NodeKind.NUMBER) {
					if (settings.isStrictScalars()) {
						throw new MalformedTreeException(currentPath() + "." + member.name() + ": expected NUMBER but found " + tree.kindOf(child));
					}
					LOGGER.debug("Skipping {}.{}: expected NUMBER but found {}", currentPath(), member.name(), tree.kindOf(child));
					continue;
				}
				word = member.insert(word, tree.longValue(child));
			}
			return word;
		}

		private @Nullable Object scalar(ScalarType type, N node, @Nullable Object current) {
			NodeKind expected;
			if (type.kind().isNumeric()) {
				expected = NodeKind.NUMBER;
			} else if (type.kind() == ScalarKind.BOOL) {
				expected = NodeKind.BOOLEAN;
			} else {
				expected = NodeKind.STRING;
			}
			NodeKind actual = tree.kindOf(node);
			if (actual != expected) {
				if (settings.isStrictScalars()) {
					throw new MalformedTreeException(currentPath() + ": expected " + expected + " for " + type.briefIdentifier() + " but found " + actual);
				}
				LOGGER.debug("Skipping {}: expected {} but found {}", currentPath(), expected, actual);
				return current;
			}
			switch (type.kind()) {
				case F32:
				case F64:
					return type.normalize(tree.doubleValue(node));
				case BOOL:
					return tree.booleanValue(node);
				case TEXT:
					return type.normalize(tree.stringValue(node));
				default:
					return type.normalize(tree.longValue(node));
			}
		}

		/**
		 * Aggregates and arrays come from the allocator. Anything else starts from its default,
		 * which is null for pointers and unions; those are filled in when overlaid.
		 */
		private @Nullable Object fresh(TypeDescriptor type) {
			TypeDescriptor resolved = registry.resolve(type);
			if (resolved instanceof AggregateType || resolved instanceof FixedArrayType) {
				return allocate(type);
			} else {
				return Instances.defaultValue(type, registry);
			}
		}

		Object allocate(TypeDescriptor type) {
			Object result;
			try {
				result = allocator.allocate(type, registry);
			} catch (AllocationException e) {
				throw ConversionException.wrap(e, currentPath());
			}
			if (result == null) {
				throw new AllocationException(currentPath() + ": allocator returned nothing for " + type.briefIdentifier());
			}
			return result;
		}

		void requireKind(N node, NodeKind expected, TypeDescriptor type) {
			NodeKind actual = tree.kindOf(node);
			if (actual != expected) {
				throw new MalformedTreeException(currentPath() + ": expected " + expected + " for " + type.briefIdentifier() + " but found " + actual);
			}
		}

		String currentPath() {
			return rootName + String.join("", path);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OverlayDeserializer.class);
}
