package works.delta.jackson;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.delta.ConvertStatus;
import works.delta.ConverterSettings;
import works.delta.DeltaCodec;
import works.delta.StructConverter;
import works.delta.TypeRegistry;
import works.delta.exceptions.ConversionException;
import works.delta.exceptions.InvalidArgumentException;
import works.delta.exceptions.InvalidTypeException;
import works.delta.exceptions.MalformedTreeException;
import works.delta.instances.ArrayInstance;
import works.delta.instances.InstanceAllocator;
import works.delta.naming.ObfuscatedFieldNaming;

/**
 * Conversions straight to and from JSON text, using a {@link DeltaCodec} over Jackson nodes.
 * <p>
 * Text that isn't valid JSON is reported the same way as a tree of the wrong shape:
 * as a {@link MalformedTreeException}, or {@link ConvertStatus#PARSE_ERROR}.
 */
public final class DeltaJson {
	private final DeltaCodec<JsonNode> codec;
	private final ObjectMapper mapper;

	private DeltaJson(DeltaCodec<JsonNode> codec, ObjectMapper mapper) {
		this.codec = codec;
		this.mapper = mapper;
	}

	public static DeltaJson create(TypeRegistry registry) throws InvalidTypeException {
		return create(registry, ConverterSettings.DEFAULT, InstanceAllocator.DEFAULT);
	}

	public static DeltaJson create(TypeRegistry registry, ConverterSettings settings) throws InvalidTypeException {
		return create(registry, settings, InstanceAllocator.DEFAULT);
	}

	public static DeltaJson create(TypeRegistry registry, ConverterSettings settings, InstanceAllocator allocator) throws InvalidTypeException {
		return new DeltaJson(
			DeltaCodec.create(registry, JacksonValueTree.INSTANCE, settings, allocator),
			JsonMapper.builder().build());
	}

	public DeltaCodec<JsonNode> codec() {
		return codec;
	}

	/**
	 * @return null if {@code instance} is null
	 */
	public @Nullable String toJson(String typeName, @Nullable Object instance, @Nullable Object baseline) {
		JsonNode node = codec.converter(typeName).toTree(instance, baseline);
		trace("toJson", typeName, node);
		return (node == null) ? null : mapper.writeValueAsString(node);
	}

	/**
	 * @throws MalformedTreeException if {@code json} can't be parsed or doesn't fit the type
	 */
	public Object fromJson(String typeName, @Nullable String json, @Nullable Object baseline) {
		StructConverter<JsonNode> converter = codec.converter(typeName);
		return converter.deserialize(parse(json), baseline);
	}

	public ConvertStatus fromJson(String typeName, @Nullable String json, @Nullable Object baseline, @Nullable Object out) {
		StructConverter<JsonNode> converter = codec.converter(typeName);
		JsonNode node;
		try {
			node = parse(json);
		} catch (ConversionException e) {
			LOGGER.debug("Unable to parse {} JSON", typeName, e);
			return e.status();
		}
		return converter.fromTree(node, baseline, out);
	}

	public @Nullable String arrayToJson(String typeName, @Nullable ArrayInstance values, @Nullable ArrayInstance baseline) {
		JsonNode node = codec.converter(typeName).arrayToTree(values, baseline);
		trace("arrayToJson", typeName, node);
		return (node == null) ? null : mapper.writeValueAsString(node);
	}

	public ConvertStatus arrayFromJson(String typeName, @Nullable String json, @Nullable ArrayInstance baseline, @Nullable ArrayInstance out) {
		StructConverter<JsonNode> converter = codec.converter(typeName);
		JsonNode node;
		try {
			node = parse(json);
		} catch (ConversionException e) {
			LOGGER.debug("Unable to parse {} array JSON", typeName, e);
			return e.status();
		}
		return converter.treeToArray(node, baseline, out);
	}

	/**
	 * @throws InvalidArgumentException if {@code json} is null
	 * @throws MalformedTreeException if {@code json} isn't valid JSON
	 */
	public JsonNode parse(@Nullable String json) {
		if (json == null) {
			throw new InvalidArgumentException("No JSON to parse");
		}
		try {
			JsonNode result = mapper.readTree(json);
			trace("parse", "input", result);
			return result;
		} catch (JacksonException e) {
			throw new MalformedTreeException("Invalid JSON: " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * Describes which keys the obfuscated fields are written under, for troubleshooting.
	 *
	 * @return a JSON object with {@code encrypted_fields} (type to field to key)
	 * and {@code field_comments} (type to key to field); both empty if obfuscation is off
	 */
	public String fieldMapJson() {
		Map<String, Object> result = new LinkedHashMap<>();
		if (codec.naming() instanceof ObfuscatedFieldNaming naming) {
			result.put("encrypted_fields", naming.fieldMap());
			result.put("field_comments", naming.fieldComments());
		} else {
			result.put("encrypted_fields", Map.of());
			result.put("field_comments", Map.of());
		}
		return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
	}

	private void trace(String operation, String subject, @Nullable JsonNode node) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} {}:\n{}", operation, subject, (node == null) ? "null" : node.toPrettyString());
		}
	}

	@Override
	public String toString() {
		return "DeltaJson(" + codec + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DeltaJson.class);
}
