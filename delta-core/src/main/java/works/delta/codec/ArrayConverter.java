package works.delta.codec;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.delta.TypeRegistry;
import works.delta.exceptions.AllocationException;
import works.delta.exceptions.InvalidArgumentException;
import works.delta.instances.ArrayInstance;
import works.delta.tree.ValueTree;
import works.delta.types.AggregateType;
import works.delta.types.FixedArrayType;
import works.delta.types.OwnedPointerType;
import works.delta.types.TypeDescriptor;

/**
 * Converts whole arrays of instances, diffing each element against the corresponding baseline element.
 * <p>
 * Unlike an array field, which is written in full whenever anything in it changes,
 * a top-level array is written element by element. The result always has one node per element
 * so that positions survive: an unchanged aggregate becomes an empty object,
 * and an unchanged value of any other type is written in full.
 * <p>
 * When reading, at most {@code length} elements are taken from the tree and any excess is discarded.
 * If the tree is shorter, the remaining elements come from the baseline, if there is one,
 * and are otherwise left as they were.
 */
public final class ArrayConverter<N> {
	private final TypeRegistry registry;
	private final ValueTree<N> tree;
	private final DiffingSerializer<N> serializer;
	private final OverlayDeserializer<N> deserializer;

	public ArrayConverter(TypeRegistry registry, ValueTree<N> tree, DiffingSerializer<N> serializer, OverlayDeserializer<N> deserializer) {
		this.registry = registry;
		this.tree = tree;
		this.serializer = serializer;
		this.deserializer = deserializer;
	}

	/**
	 * @return null if {@code values} is null or the array node couldn't be created
	 * @throws InvalidArgumentException if {@code baseline} is not the same length as {@code values}
	 */
	public @Nullable N toTree(FixedArrayType type, @Nullable ArrayInstance values, @Nullable ArrayInstance baseline) {
		if (values == null) {
			return null;
		}
		if (baseline != null && baseline.length() != values.length()) {
			throw new InvalidArgumentException("Baseline has " + baseline.length() + " elements; expected " + values.length());
		}
		LOGGER.debug("Serializing {} {}", type.briefIdentifier(), (baseline == null) ? "in full" : "element by element");
		DiffingSerializer<N>.Session session = serializer.newSession(type.briefIdentifier());
		N result;
		try {
			result = tree.newArray();
		} catch (AllocationException e) {
			LOGGER.warn("Unable to create array node for {}", type.briefIdentifier(), e);
			return null;
		}
		for (int i = 0; i < values.length(); i++) {
			session.path.add("[" + i + "]");
			try {
				tree.addElement(result, element(session, type.element(), values.get(i), (baseline == null) ? null : baseline.get(i)));
			} catch (AllocationException e) {
				LOGGER.warn("Writing null for {}: unable to create node", session.currentPath(), e);
				tree.addElement(result, tree.newNull());
			} finally {
				session.path.remove(session.path.size() - 1);
			}
		}
		return result;
	}

	private N element(DiffingSerializer<N>.Session session, TypeDescriptor elementType, @Nullable Object value, @Nullable Object baseline) {
		if (value == null) {
			return tree.newNull();
		}
		N diff = session.diff(elementType, value, baseline);
		if (diff != null) {
			return diff;
		} else if (isAggregate(elementType)) {
			return tree.newObject();
		} else {
			N full = session.diff(elementType, value, null);
			return (full == null) ? tree.newNull() : full;
		}
	}

	private boolean isAggregate(TypeDescriptor type) {
		TypeDescriptor resolved = registry.resolve(type);
		while (resolved instanceof OwnedPointerType p) {
			resolved = registry.resolve(p.pointee());
		}
		return resolved instanceof AggregateType;
	}

	/**
	 * @throws works.delta.exceptions.InvalidArgumentException if {@code node} or {@code out} is null
	 * @throws works.delta.exceptions.MalformedTreeException if {@code node} is not an array
	 */
	public void fromTree(FixedArrayType type, @Nullable N node, @Nullable ArrayInstance baseline, @Nullable ArrayInstance out) {
		deserializer.deserializeInto(type, node, baseline, out);
	}

	/**
	 * @return how many elements to read from a tree array of {@code treeSize} elements into an array of {@code capacity}
	 */
	static int copyCount(int treeSize, int capacity) {
		return Math.min(treeSize, capacity);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ArrayConverter.class);
}
