package works.delta;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.delta.exceptions.ConversionException;
import works.delta.exceptions.InvalidArgumentException;
import works.delta.instances.ArrayInstance;
import works.delta.instances.Instances;
import works.delta.types.FixedArrayType;
import works.delta.types.TypeDescriptor;

/**
 * The conversion entry points for one registered type.
 * <p>
 * {@link #fromTree} and {@link #treeToArray} report failures as a {@link ConvertStatus};
 * {@link #deserialize} and {@link #deserializeInto} throw {@link ConversionException} instead.
 */
public final class StructConverter<N> {
	private final String typeName;
	private final TypeDescriptor type;
	private final DeltaCodec<N> codec;

	StructConverter(String typeName, TypeDescriptor type, DeltaCodec<N> codec) {
		this.typeName = typeName;
		this.type = type;
		this.codec = codec;
	}

	public String typeName() {
		return typeName;
	}

	public TypeDescriptor type() {
		return type;
	}

	/**
	 * @return a new instance with default values
	 */
	public Object newInstance() {
		return Instances.defaultValue(type, codec.registry());
	}

	/**
	 * @param baseline null to write every field
	 * @return the fields of {@code instance} that differ from {@code baseline};
	 * null if {@code instance} is null or no node could be created
	 */
	public @Nullable N toTree(@Nullable Object instance, @Nullable Object baseline) {
		return codec.serializer().serialize(type, instance, baseline);
	}

	/**
	 * Copies {@code baseline} into {@code out}, if given, then overlays {@code node}.
	 */
	public ConvertStatus fromTree(@Nullable N node, @Nullable Object baseline, @Nullable Object out) {
		try {
			deserializeInto(node, baseline, out);
			return ConvertStatus.SUCCESS;
		} catch (ConversionException e) {
			LOGGER.debug("Unable to convert {} from tree: {}", typeName, e.getMessage(), e);
			return e.status();
		}
	}

	/**
	 * @return a new instance holding {@code baseline}, if given, overlaid by {@code node}
	 */
	public Object deserialize(@Nullable N node, @Nullable Object baseline) {
		return codec.deserializer().deserialize(type, node, baseline);
	}

	public void deserializeInto(@Nullable N node, @Nullable Object baseline, @Nullable Object out) {
		codec.deserializer().deserializeInto(type, node, baseline, out);
	}

	/**
	 * @param values an array whose elements are of this converter's type
	 * @param baseline null, or an array of the same length whose elements are the per-element baselines
	 */
	public @Nullable N arrayToTree(@Nullable ArrayInstance values, @Nullable ArrayInstance baseline) {
		if (values == null) {
			return null;
		}
		return codec.arrayConverter().toTree(checkedArrayType(values), values, baseline);
	}

	public ConvertStatus treeToArray(@Nullable N node, @Nullable ArrayInstance baseline, @Nullable ArrayInstance out) {
		try {
			if (out == null) {
				throw new InvalidArgumentException("No destination array for " + typeName);
			}
			codec.arrayConverter().fromTree(checkedArrayType(out), node, baseline, out);
			return ConvertStatus.SUCCESS;
		} catch (ConversionException e) {
			LOGGER.debug("Unable to convert {} array from tree: {}", typeName, e.getMessage(), e);
			return e.status();
		}
	}

	private FixedArrayType checkedArrayType(ArrayInstance array) {
		TypeRegistry registry = codec.registry();
		FixedArrayType arrayType = array.type();
		if (!registry.resolve(arrayType.element()).equals(registry.resolve(type))) {
			throw new InvalidArgumentException("Expected an array of " + typeName + "; found " + arrayType.briefIdentifier());
		}
		return arrayType;
	}

	@Override
	public String toString() {
		return "StructConverter(" + typeName + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StructConverter.class);
}
