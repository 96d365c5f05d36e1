package works.delta.jackson;

import java.util.LinkedHashMap;
import java.util.Map;
import works.delta.TypeRegistry;
import works.delta.exceptions.InvalidTypeException;
import works.delta.types.AggregateType;
import works.delta.types.BackReferenceType;
import works.delta.types.BitfieldGroupType;
import works.delta.types.FixedArrayType;
import works.delta.types.OwnedPointerType;
import works.delta.types.ScalarType;
import works.delta.types.TaggedUnionType;
import works.delta.types.TypeDescriptor;
import works.delta.types.TypeRef;

/**
 * Descriptors for a small zoo of structures exercising every kind of type.
 */
final class SampleTypes {
	private SampleTypes() {}

	static final AggregateType POINT = AggregateType.builder("Point")
		.field("x", ScalarType.I32)
		.field("y", ScalarType.I32)
		.build();

	static final AggregateType VECTOR = AggregateType.builder("Vector")
		.field("components", FixedArrayType.of(ScalarType.F32, 3))
		.field("points", FixedArrayType.of(TypeRef.to("Point"), 4))
		.field("count", ScalarType.U32)
		.build();

	static final AggregateType NODE = AggregateType.builder("Node")
		.field("value", ScalarType.I32)
		.field("next", OwnedPointerType.to(TypeRef.to("Node")))
		.field("prev", new BackReferenceType("Node", "next"))
		.build();

	static final AggregateType COMPLEX_DATA = AggregateType.builder("ComplexData")
		.field("id", ScalarType.U8)
		.field("name", ScalarType.text(32))
		.field("position", TypeRef.to("Point"))
		.field("movement", OwnedPointerType.to(TypeRef.to("Vector")))
		.field("head", OwnedPointerType.to(TypeRef.to("Node")))
		.field("matrix", FixedArrayType.of(FixedArrayType.of(ScalarType.F32, 4), 4))
		.field("flags", ScalarType.U32)
		.build();

	static final BitfieldGroupType BIT_FIELDS = BitfieldGroupType.packed("BitFields",
		"flag1", 1,
		"flag2", 1,
		"value", 6,
		"reserved", 24);

	static final TaggedUnionType DATA_VALUE = new TaggedUnionType("DataValue", alternatives(
		"as_int", ScalarType.I32,
		"as_float", ScalarType.F32,
		"as_bytes", FixedArrayType.of(FixedArrayType.of(ScalarType.U8, 2), 2)));

	static final AggregateType NESTED_STRUCT = AggregateType.builder("NestedStruct")
		.field("origin", TypeRef.to("Point"))
		.field("vectors", FixedArrayType.of(FixedArrayType.of(TypeRef.to("Vector"), 4), 2))
		.field("values", FixedArrayType.of(TypeRef.to("DataValue"), 4))
		.field("flags", TypeRef.to("BitFields"))
		.field("date", AggregateType.builder("date")
			.field("year", ScalarType.U16)
			.field("month", ScalarType.U8)
			.field("day", ScalarType.U8)
			.build())
		.build();

	static final AggregateType RING_BUFFER = AggregateType.builder("RingBuffer")
		.field("buffer", OwnedPointerType.to(ScalarType.U8))
		.field("size", ScalarType.U32)
		.field("read_pos", ScalarType.U32)
		.field("write_pos", ScalarType.U32)
		.field("status", BitfieldGroupType.packed("status",
			"is_full", 1,
			"is_empty", 1,
			"reserved", 30))
		.build();

	static final AggregateType CONFIG = AggregateType.builder("Config")
		.field("limits", AggregateType.builder("limits")
			.field("max_items", ScalarType.U32)
			.field("max_depth", ScalarType.U32)
			.field("threshold", ScalarType.F32)
			.build())
		.field("network", AggregateType.builder("network")
			.field("host", ScalarType.text(64))
			.field("port", ScalarType.U16)
			.field("timeout_ms", ScalarType.U32)
			.build())
		.field("logging", AggregateType.builder("logging")
			.field("level", ScalarType.U8)
			.field("enabled", ScalarType.BOOL)
			.field("file", ScalarType.text(256))
			.build())
		.build();

	/**
	 * Three independently owned pointees, for exercising allocation failures.
	 */
	static final AggregateType TRIPLE = AggregateType.builder("Triple")
		.field("first", OwnedPointerType.to(TypeRef.to("Point")))
		.field("second", OwnedPointerType.to(TypeRef.to("Point")))
		.field("third", OwnedPointerType.to(TypeRef.to("Point")))
		.build();

	static TypeRegistry registry() {
		try {
			return TypeRegistry.builder()
				.define(POINT)
				.define(VECTOR)
				.define(NODE)
				.define(COMPLEX_DATA)
				.define("BitFields", BIT_FIELDS)
				.define("DataValue", DATA_VALUE)
				.define(NESTED_STRUCT)
				.define(RING_BUFFER)
				.define(CONFIG)
				.define(TRIPLE)
				.build();
		} catch (InvalidTypeException e) {
			throw new AssertionError(e);
		}
	}

	private static Map<String, TypeDescriptor> alternatives(Object... tagsAndTypes) {
		Map<String, TypeDescriptor> result = new LinkedHashMap<>();
		for (int i = 0; i < tagsAndTypes.length; i += 2) {
			result.put((String) tagsAndTypes[i], (TypeDescriptor) tagsAndTypes[i + 1]);
		}
		return result;
	}
}
