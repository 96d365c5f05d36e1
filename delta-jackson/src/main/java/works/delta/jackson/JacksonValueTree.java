package works.delta.jackson;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;
import works.delta.tree.NodeKind;
import works.delta.tree.ValueTree;

/**
 * A {@link ValueTree} made of Jackson {@link JsonNode}s.
 * Stateless; one instance can serve any number of codecs.
 */
public final class JacksonValueTree implements ValueTree<JsonNode> {
	public static final JacksonValueTree INSTANCE = new JacksonValueTree(JsonNodeFactory.instance);

	private final JsonNodeFactory factory;

	public JacksonValueTree(JsonNodeFactory factory) {
		this.factory = factory;
	}

	@Override
	public JsonNode newObject() {
		return factory.objectNode();
	}

	@Override
	public JsonNode newArray() {
		return factory.arrayNode();
	}

	@Override
	public JsonNode newNumber(long value) {
		return factory.numberNode(value);
	}

	@Override
	public JsonNode newNumber(double value) {
		return factory.numberNode(value);
	}

	@Override
	public JsonNode newString(String value) {
		return factory.stringNode(value);
	}

	@Override
	public JsonNode newBoolean(boolean value) {
		return factory.booleanNode(value);
	}

	@Override
	public JsonNode newNull() {
		return factory.nullNode();
	}

	@Override
	public NodeKind kindOf(JsonNode node) {
		if (node.isObject()) {
			return NodeKind.OBJECT;
		} else if (node.isArray()) {
			return NodeKind.ARRAY;
		} else if (node.isNumber()) {
			return NodeKind.NUMBER;
		} else if (node instanceof StringNode) {
			return NodeKind.STRING;
		} else if (node.isBoolean()) {
			return NodeKind.BOOLEAN;
		} else if (node.isNull() || node.isMissingNode()) {
			return NodeKind.NULL;
		} else {
			throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
		}
	}

	@Override
	public boolean isIntegral(JsonNode node) {
		return node.isIntegralNumber();
	}

	@Override
	public @Nullable JsonNode getMember(JsonNode object, String name) {
		return object.get(name);
	}

	@Override
	public void setMember(JsonNode object, String name, JsonNode value) {
		((ObjectNode) object).set(name, value);
	}

	@Override
	public List<String> memberNames(JsonNode object) {
		List<String> result = new ArrayList<>();
		for (Map.Entry<String, JsonNode> entry : object.properties()) {
			result.add(entry.getKey());
		}
		return result;
	}

	@Override
	public int size(JsonNode node) {
		return node.size();
	}

	@Override
	public JsonNode getElement(JsonNode array, int index) {
		return array.get(index);
	}

	@Override
	public void addElement(JsonNode array, JsonNode value) {
		((ArrayNode) array).add(value);
	}

	/**
	 * Integers too big for a {@code long} keep their low 64 bits,
	 * and fractional numbers are truncated toward zero.
	 */
	@Override
	public long longValue(JsonNode number) {
		Number value = number.numberValue();
		if (value instanceof BigInteger big) {
			return big.longValue();
		} else if (number.isIntegralNumber()) {
			return value.longValue();
		} else {
			return (long) value.doubleValue();
		}
	}

	@Override
	public double doubleValue(JsonNode number) {
		return number.numberValue().doubleValue();
	}

	@Override
	public String stringValue(JsonNode string) {
		return string.asString();
	}

	@Override
	public boolean booleanValue(JsonNode bool) {
		return bool.booleanValue();
	}

	@Override
	public String toString() {
		return "JacksonValueTree";
	}
}
