package works.delta.types;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class ScalarTypeTest {

	@ParameterizedTest
	@MethodSource("wrapCases")
	void integer_wrapsToWidth(ScalarKind kind, long input, long expected) {
		assertEquals(expected, kind.wrap(input));
	}

	static Stream<Arguments> wrapCases() {
		return Stream.of(
			arguments(ScalarKind.I8, 127L, 127L),
			arguments(ScalarKind.I8, 128L, -128L),
			arguments(ScalarKind.I8, 200L, -56L),
			arguments(ScalarKind.U8, -1L, 255L),
			arguments(ScalarKind.U8, 256L, 0L),
			arguments(ScalarKind.I16, 40_000L, -25_536L),
			arguments(ScalarKind.U16, 70_000L, 4_464L),
			arguments(ScalarKind.I32, 2_147_483_648L, -2_147_483_648L),
			arguments(ScalarKind.U32, -1L, 4_294_967_295L),
			arguments(ScalarKind.U32, 4_294_967_296L, 0L),
			arguments(ScalarKind.I64, Long.MIN_VALUE, Long.MIN_VALUE)
		);
	}

	@Test
	void wrap_nonInteger_throws() {
		assertThrows(IllegalStateException.class, () -> ScalarKind.F64.wrap(1));
	}

	@Test
	void normalize_integer_givesLong() {
		assertEquals(5L, ScalarType.I32.normalize(5));
		assertEquals(255L, ScalarType.U8.normalize((byte) -1));
	}

	@Test
	void normalize_float_narrows() {
		assertEquals(0.1F, ScalarType.F32.normalize(0.1D));
		assertEquals(2.5D, ScalarType.F64.normalize(2.5F));
	}

	@Test
	void normalize_text_stopsAtTerminatorAndCapacity() {
		ScalarType text = ScalarType.text(6);
		assertEquals("hello", text.normalize("hello, world"));
		assertEquals("ab", text.normalize("ab\0cd"));
		assertEquals("", ScalarType.text(1).normalize("anything"));
	}

	@Test
	void normalize_text_countsUtf8BytesAndKeepsCharactersWhole() {
		// "😀" is one four-byte character; "€" and "é" take three and two bytes
		assertEquals("ab", ScalarType.text(4).normalize("ab😀"));
		assertEquals("ab", ScalarType.text(6).normalize("ab😀"));
		assertEquals("ab😀", ScalarType.text(7).normalize("ab😀"));
		assertEquals("ab€", ScalarType.text(6).normalize("ab€"));
		assertEquals("aé", ScalarType.text(5).normalize("aé😀"));
		assertEquals("", ScalarType.text(2).normalize("é"));
	}

	@Test
	void text_withoutRoomForTerminator_throws() {
		assertThrows(IllegalArgumentException.class, () -> ScalarType.text(0));
	}

	@Test
	void capacity_onNonText_throws() {
		assertThrows(IllegalArgumentException.class, () -> new ScalarType(ScalarKind.I32, 4));
	}

	@Test
	void valuesEqual_comparesNumerically() {
		assertTrue(ScalarType.I32.valuesEqual(5L, 5));
		assertTrue(ScalarType.U8.valuesEqual(255L, -1L));
		assertFalse(ScalarType.I32.valuesEqual(5L, 0L));
		assertTrue(ScalarType.F32.valuesEqual(1.5F, 1.5D));
		assertTrue(ScalarType.text(8).valuesEqual("abc", "abc\0junk"));
	}

	@Test
	void defaultValues() {
		assertThat(ScalarType.I16.defaultValue(), equalTo(0L));
		assertThat(ScalarType.F32.defaultValue(), equalTo(0.0F));
		assertThat(ScalarType.F64.defaultValue(), equalTo(0.0D));
		assertThat(ScalarType.BOOL.defaultValue(), equalTo(false));
		assertThat(ScalarType.text(4).defaultValue(), equalTo(""));
	}
}
