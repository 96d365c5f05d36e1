package works.delta.jackson;

import org.junit.jupiter.api.Test;
import works.delta.exceptions.MalformedTreeException;
import works.delta.instances.ArrayInstance;
import works.delta.instances.Instances;
import works.delta.instances.StructInstance;
import works.delta.instances.UnionInstance;
import works.delta.types.FixedArrayType;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UnionTest extends AbstractDeltaTest {

	ArrayInstance bytes(int a, int b, int c, int d) {
		FixedArrayType type = (FixedArrayType) SampleTypes.DATA_VALUE.alternative("as_bytes");
		ArrayInstance result = Instances.newArray(type, registry);
		((ArrayInstance) result.get(0)).set(0, a).set(1, b);
		((ArrayInstance) result.get(1)).set(0, c).set(1, d);
		return result;
	}

	@Test
	void writtenAsSingleMemberObject() {
		assertJson("{'as_int':5}", converter("DataValue").toTree(UnionInstance.of("as_int", 5L), null));
	}

	@Test
	void unchanged_writesNothing() {
		assertNull(converter("DataValue").toTree(UnionInstance.of("as_int", 5L), UnionInstance.of("as_int", 5L)));
	}

	@Test
	void changedPayload() {
		assertJson("{'as_int':5}", converter("DataValue").toTree(UnionInstance.of("as_int", 5L), UnionInstance.of("as_int", 4L)));
	}

	@Test
	void changedAlternative_writtenInFull() {
		assertJson("{'as_int':0}", converter("DataValue").toTree(UnionInstance.of("as_int", 0L), UnionInstance.of("as_float", 0.0F)));
	}

	@Test
	void arrayPayload_writtenWhole() {
		assertJson("{'as_bytes':[[1,2],[3,9]]}",
			converter("DataValue").toTree(UnionInstance.of("as_bytes", bytes(1, 2, 3, 9)), UnionInstance.of("as_bytes", bytes(1, 2, 3, 4))));
	}

	@Test
	void unionsInArrayField() {
		StructInstance nested = newStruct("NestedStruct");
		nested.array("values").set(0, UnionInstance.of("as_int", 5L));
		assertJson("{'values':[{'as_int':5},null,null,null]}", converter("NestedStruct").toTree(nested, newStruct("NestedStruct")));
	}

	@Test
	void read() {
		assertEquals(UnionInstance.of("as_float", 1.5F), converter("DataValue").deserialize(tree("{'as_float':1.5}"), null));
	}

	@Test
	void emptyObject_keepsBaseline() {
		assertEquals(UnionInstance.of("as_int", 3L), converter("DataValue").deserialize(tree("{}"), UnionInstance.of("as_int", 3L)));
		assertNull(converter("DataValue").deserialize(tree("{}"), null));
	}

	@Test
	void sameAlternative_payloadOverlaid() {
		UnionInstance baseline = UnionInstance.of("as_bytes", bytes(1, 2, 3, 4));
		UnionInstance result = (UnionInstance) converter("DataValue").deserialize(tree("{'as_bytes':[[9]]}"), baseline);
		assertEquals("as_bytes", result.tag());
		ArrayInstance payload = (ArrayInstance) result.payload();
		assertEquals(9L, ((ArrayInstance) payload.get(0)).get(0));
		assertEquals(2L, ((ArrayInstance) payload.get(0)).get(1));
		assertEquals(4L, ((ArrayInstance) payload.get(1)).get(1));
		assertEquals(1L, ((ArrayInstance) ((ArrayInstance) baseline.payload()).get(0)).get(0));
	}

	@Test
	void otherAlternative_startsFresh() {
		UnionInstance result = (UnionInstance) converter("DataValue").deserialize(tree("{'as_bytes':[[9]]}"), UnionInstance.of("as_int", 3L));
		assertEquals("as_bytes", result.tag());
		ArrayInstance payload = (ArrayInstance) result.payload();
		assertEquals(9L, ((ArrayInstance) payload.get(0)).get(0));
		assertEquals(0L, ((ArrayInstance) payload.get(0)).get(1));
		assertEquals(0L, ((ArrayInstance) payload.get(1)).get(0));
	}

	@Test
	void moreThanOneMember_rejected() {
		MalformedTreeException e = assertThrows(MalformedTreeException.class, () ->
			converter("DataValue").deserialize(tree("{'as_int':1,'as_float':2.0}"), null));
		assertThat(e.getMessage(), containsString("exactly one member"));
	}

	@Test
	void unknownAlternative_rejected() {
		MalformedTreeException e = assertThrows(MalformedTreeException.class, () ->
			converter("DataValue").deserialize(tree("{'as_text':'hi'}"), null));
		assertThat(e.getMessage(), containsString("as_text"));
	}

	@Test
	void nonObject_rejected() {
		assertThrows(MalformedTreeException.class, () -> converter("DataValue").deserialize(tree("5"), null));
	}
}
