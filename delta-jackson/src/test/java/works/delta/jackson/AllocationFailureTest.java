package works.delta.jackson;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import works.delta.ConvertStatus;
import works.delta.ConverterSettings;
import works.delta.StructConverter;
import works.delta.exceptions.AllocationException;
import works.delta.instances.InstanceAllocator;
import works.delta.instances.Instances;
import works.delta.instances.StructInstance;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AllocationFailureTest extends AbstractDeltaTest {
	static final String ALL_THREE = "{'first':{'x':1},'second':{'x':2},'third':{'x':3}}";

	final AtomicInteger calls = new AtomicInteger();

	InstanceAllocator failingOnCall(int failingCall) {
		return (type, registry) -> {
			if (calls.incrementAndGet() == failingCall) {
				throw new AllocationException("Out of memory");
			}
			return Instances.defaultValue(type, registry);
		};
	}

	StructConverter<JsonNode> tripleConverter(InstanceAllocator allocator) {
		return codec(ConverterSettings.DEFAULT, allocator).converter("Triple");
	}

	@Test
	void secondPointerFails_firstKeptRestUntouched() {
		StructInstance out = newStruct("Triple");
		assertEquals(ConvertStatus.ALLOCATION_ERROR, tripleConverter(failingOnCall(2)).fromTree(tree(ALL_THREE), null, out));
		assertEquals(2, calls.get());
		assertEquals(1L, out.struct("first").get("x"));
		assertNull(out.get("second"));
		assertNull(out.get("third"));
	}

	@Test
	void failure_namesPath() {
		StructInstance out = newStruct("Triple");
		AllocationException e = assertThrows(AllocationException.class, () ->
			tripleConverter(failingOnCall(2)).deserializeInto(tree(ALL_THREE), null, out));
		assertThat(e.getMessage(), startsWith("Triple.second: Out of memory"));
	}

	@Test
	void existingPointeesNeedNoAllocation() {
		StructInstance out = newStruct("Triple");
		out.set("second", point(0, 0));
		assertEquals(ConvertStatus.SUCCESS, tripleConverter(failingOnCall(2)).fromTree(tree("{'second':{'x':2},'third':{'x':3}}"), null, out));
		assertEquals(1, calls.get());
		assertEquals(2L, out.struct("second").get("x"));
		assertEquals(3L, out.struct("third").get("x"));
	}

	@Test
	void rootAllocationFails() {
		assertThrows(AllocationException.class, () ->
			tripleConverter(failingOnCall(1)).deserialize(tree("{}"), null));
	}

	@Test
	void allocatorReturningNull_isAllocationError() {
		StructInstance out = newStruct("Triple");
		assertEquals(ConvertStatus.ALLOCATION_ERROR, tripleConverter((type, registry) -> null).fromTree(tree(ALL_THREE), null, out));
		assertNull(out.get("first"));
	}
}
