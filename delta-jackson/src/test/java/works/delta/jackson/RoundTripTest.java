package works.delta.jackson;

import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import tools.jackson.databind.JsonNode;
import works.delta.TypeRegistry;
import works.delta.instances.ArrayInstance;
import works.delta.instances.Instances;
import works.delta.instances.StructInstance;
import works.delta.instances.UnionInstance;
import works.delta.types.FixedArrayType;
import works.delta.types.TypeDescriptor;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Properties that hold for any instance and baseline,
 * as long as the instance has no null pointer or union where the baseline has one.
 */
class RoundTripTest extends AbstractDeltaTest {
	static final TypeRegistry REGISTRY = SampleTypes.registry();

	record Sample(String description, String typeName, Object instance, Object baseline) {
		@Override
		public String toString() {
			return description;
		}
	}

	static Stream<Sample> samples() {
		return Stream.of(
			new Sample("point", "Point", pointOf(5, 5), pointOf(5, 0)),
			new Sample("complex vs defaults", "ComplexData", complexData(), struct("ComplexData")),
			new Sample("complex vs other", "ComplexData", complexData(), otherComplexData()),
			new Sample("nested", "NestedStruct", nestedStruct(), struct("NestedStruct")),
			new Sample("ring buffer", "RingBuffer", ringBuffer(17), ringBuffer(3)),
			new Sample("config", "Config", config(), struct("Config")),
			new Sample("list", "Node", nodeList(1, 2, 3), nodeList(1, 5))
		);
	}

	@ParameterizedTest
	@MethodSource("samples")
	void unchangedInstance_writesNothing(Sample sample) {
		Object copy = Instances.deepCopy(type(sample), sample.instance(), REGISTRY);
		assertJson("{}", converter(sample.typeName()).toTree(sample.instance(), copy));
	}

	@ParameterizedTest
	@MethodSource("samples")
	void fullTree_reproducesInstance(Sample sample) {
		JsonNode tree = converter(sample.typeName()).toTree(sample.instance(), null);
		Object result = converter(sample.typeName()).deserialize(tree, null);
		assertEqualContents(sample, sample.instance(), result);
	}

	@ParameterizedTest
	@MethodSource("samples")
	void diffOverBaseline_reproducesInstance(Sample sample) {
		JsonNode tree = converter(sample.typeName()).toTree(sample.instance(), sample.baseline());
		Object result = converter(sample.typeName()).deserialize(tree, sample.baseline());
		assertEqualContents(sample, sample.instance(), result);
	}

	@ParameterizedTest
	@MethodSource("samples")
	void conversionLeavesInputsAlone(Sample sample) {
		Object instanceCopy = Instances.deepCopy(type(sample), sample.instance(), REGISTRY);
		Object baselineCopy = Instances.deepCopy(type(sample), sample.baseline(), REGISTRY);
		JsonNode tree = converter(sample.typeName()).toTree(sample.instance(), sample.baseline());
		converter(sample.typeName()).deserialize(tree, sample.baseline());
		assertEqualContents(sample, instanceCopy, sample.instance());
		assertEqualContents(sample, baselineCopy, sample.baseline());
	}

	TypeDescriptor type(Sample sample) {
		return REGISTRY.get(sample.typeName());
	}

	void assertEqualContents(Sample sample, Object expected, Object actual) {
		assertTrue(Instances.structurallyEqual(type(sample), expected, actual, REGISTRY),
			() -> "Expected " + expected + " but was " + actual);
	}

	static StructInstance struct(String typeName) {
		return Instances.newStruct(typeName, REGISTRY);
	}

	static StructInstance pointOf(long x, long y) {
		return struct("Point").set("x", x).set("y", y);
	}

	static StructInstance nodeList(long... values) {
		StructInstance head = null;
		StructInstance tail = null;
		for (long value : values) {
			StructInstance node = struct("Node").set("value", value);
			if (head == null) {
				head = node;
			} else {
				tail.set("next", node);
				node.set("prev", tail);
			}
			tail = node;
		}
		return head;
	}

	static StructInstance vector(float scale, long count) {
		StructInstance vector = struct("Vector").set("count", count);
		ArrayInstance components = vector.array("components");
		for (int i = 0; i < components.length(); i++) {
			components.set(i, scale * (i + 1));
		}
		ArrayInstance points = vector.array("points");
		for (int i = 0; i < points.length(); i++) {
			points.struct(i).set("x", i).set("y", -i * count);
		}
		return vector;
	}

	static StructInstance complexData() {
		StructInstance data = struct("ComplexData")
			.set("id", 7)
			.set("name", "widget")
			.set("movement", vector(0.1F, 4))
			.set("head", nodeList(10, 20, 30))
			.set("flags", 0xDEADBEEFL);
		data.struct("position").set("x", 1).set("y", -1);
		ArrayInstance matrix = data.array("matrix");
		for (int i = 0; i < 4; i++) {
			((ArrayInstance) matrix.get(i)).set(i, 1.0F);
		}
		return data;
	}

	static StructInstance otherComplexData() {
		return struct("ComplexData")
			.set("id", 8)
			.set("name", "gadget")
			.set("movement", vector(2.5F, 3))
			.set("head", nodeList(10, 21));
	}

	static StructInstance nestedStruct() {
		StructInstance nested = struct("NestedStruct");
		nested.struct("origin").set("x", 3);
		ArrayInstance row = (ArrayInstance) nested.array("vectors").get(1);
		row.set(2, vector(-1.0F, 9));
		ArrayInstance bytes = Instances.newArray(
			(FixedArrayType) SampleTypes.DATA_VALUE.alternative("as_bytes"), REGISTRY);
		((ArrayInstance) bytes.get(1)).set(0, 255);
		nested.array("values")
			.set(0, UnionInstance.of("as_int", 1L))
			.set(1, UnionInstance.of("as_float", 2.5F))
			.set(2, UnionInstance.of("as_bytes", bytes))
			.set(3, UnionInstance.of("as_int", -4L));
		nested.set("flags", BitfieldTest.word(1, 0, 33, 1000));
		nested.struct("date").set("year", 2024).set("month", 2).set("day", 29);
		return nested;
	}

	static StructInstance ringBuffer(long buffer) {
		return struct("RingBuffer")
			.set("buffer", buffer)
			.set("size", 64)
			.set("read_pos", buffer)
			.set("status", 2L);
	}

	static StructInstance config() {
		StructInstance config = struct("Config");
		config.struct("limits").set("max_items", 100).set("max_depth", 8).set("threshold", 0.75F);
		config.struct("network").set("host", "localhost").set("port", 5432).set("timeout_ms", 30000);
		config.struct("logging").set("level", 3).set("enabled", true).set("file", "/var/log/app.log");
		return config;
	}
}
