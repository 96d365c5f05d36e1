package works.delta;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.delta.codec.ArrayConverter;
import works.delta.codec.DiffingSerializer;
import works.delta.codec.OverlayDeserializer;
import works.delta.exceptions.InvalidTypeException;
import works.delta.instances.InstanceAllocator;
import works.delta.naming.FieldNaming;
import works.delta.naming.ObfuscatedFieldNaming;
import works.delta.tree.ValueTree;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Converts instances of the types in a {@link TypeRegistry} to and from value trees of type {@code N}.
 * <p>
 * Immutable and thread-safe once created. Every enabled type gets a {@link StructConverter}.
 *
 * @param <N> the value tree node type
 */
public final class DeltaCodec<N> {
	private final TypeRegistry registry;
	private final ValueTree<N> tree;
	private final ConverterSettings settings;
	private final FieldNaming naming;
	private final DiffingSerializer<N> serializer;
	private final OverlayDeserializer<N> deserializer;
	private final ArrayConverter<N> arrayConverter;
	private final Map<String, StructConverter<N>> converters;

	private DeltaCodec(TypeRegistry registry, ValueTree<N> tree, ConverterSettings settings, FieldNaming naming, InstanceAllocator allocator) {
		this.registry = registry;
		this.tree = tree;
		this.settings = settings;
		this.naming = naming;
		this.serializer = new DiffingSerializer<>(registry, tree, settings, naming);
		this.deserializer = new OverlayDeserializer<>(registry, tree, settings, naming, allocator);
		this.arrayConverter = new ArrayConverter<>(registry, tree, serializer, deserializer);
		Map<String, StructConverter<N>> converters = new LinkedHashMap<>();
		for (String name : registry.enabledNames()) {
			converters.put(name, new StructConverter<>(name, registry.get(name), this));
		}
		this.converters = unmodifiableMap(converters);
	}

	public static <N> DeltaCodec<N> create(TypeRegistry registry, ValueTree<N> tree) throws InvalidTypeException {
		return create(registry, tree, ConverterSettings.DEFAULT, InstanceAllocator.DEFAULT);
	}

	public static <N> DeltaCodec<N> create(TypeRegistry registry, ValueTree<N> tree, ConverterSettings settings) throws InvalidTypeException {
		return create(registry, tree, settings, InstanceAllocator.DEFAULT);
	}

	/**
	 * @throws InvalidTypeException if field obfuscation is enabled and some selected field can't be obfuscated
	 */
	public static <N> DeltaCodec<N> create(TypeRegistry registry, ValueTree<N> tree, ConverterSettings settings, InstanceAllocator allocator) throws InvalidTypeException {
		requireNonNull(registry);
		requireNonNull(tree);
		requireNonNull(settings);
		requireNonNull(allocator);
		FieldNaming naming = ObfuscatedFieldNaming.forSettings(registry, settings.getObfuscation());
		LOGGER.debug("Creating codec for {} with {}", registry, settings);
		return new DeltaCodec<>(registry, tree, settings, naming, allocator);
	}

	/**
	 * @throws IllegalArgumentException if {@code typeName} isn't registered and enabled
	 */
	public StructConverter<N> converter(String typeName) {
		StructConverter<N> result = converters.get(typeName);
		if (result == null) {
			if (registry.isRegistered(typeName)) {
				throw new IllegalArgumentException("Converter for " + typeName + " is not enabled");
			} else {
				throw new IllegalArgumentException("No registered type named \"" + typeName + "\"");
			}
		}
		return result;
	}

	public Map<String, StructConverter<N>> converters() {
		return converters;
	}

	public TypeRegistry registry() {
		return registry;
	}

	public ValueTree<N> tree() {
		return tree;
	}

	public ConverterSettings settings() {
		return settings;
	}

	public FieldNaming naming() {
		return naming;
	}

	DiffingSerializer<N> serializer() {
		return serializer;
	}

	OverlayDeserializer<N> deserializer() {
		return deserializer;
	}

	ArrayConverter<N> arrayConverter() {
		return arrayConverter;
	}

	@Override
	public String toString() {
		return "DeltaCodec" + converters.keySet();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DeltaCodec.class);
}
