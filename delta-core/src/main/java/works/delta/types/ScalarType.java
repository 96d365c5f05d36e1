package works.delta.types;

import java.util.Objects;

/**
 * A single value held directly in its owner.
 *
 * @param capacity for {@link ScalarKind#TEXT}, the size of the text buffer in bytes including its terminator,
 *                 so at most {@code capacity - 1} bytes of UTF-8 are stored; zero for every other kind.
 */
public record ScalarType(ScalarKind kind, int capacity) implements TypeDescriptor {
	public ScalarType {
		Objects.requireNonNull(kind);
		if (kind == ScalarKind.TEXT) {
			if (capacity < 1) {
				throw new IllegalArgumentException("Text buffer needs room for its terminator; capacity " + capacity);
			}
		} else if (capacity != 0) {
			throw new IllegalArgumentException("Only TEXT scalars have a capacity");
		}
	}

	public static final ScalarType I8 = new ScalarType(ScalarKind.I8, 0);
	public static final ScalarType U8 = new ScalarType(ScalarKind.U8, 0);
	public static final ScalarType I16 = new ScalarType(ScalarKind.I16, 0);
	public static final ScalarType U16 = new ScalarType(ScalarKind.U16, 0);
	public static final ScalarType I32 = new ScalarType(ScalarKind.I32, 0);
	public static final ScalarType U32 = new ScalarType(ScalarKind.U32, 0);
	public static final ScalarType I64 = new ScalarType(ScalarKind.I64, 0);
	public static final ScalarType F32 = new ScalarType(ScalarKind.F32, 0);
	public static final ScalarType F64 = new ScalarType(ScalarKind.F64, 0);
	public static final ScalarType BOOL = new ScalarType(ScalarKind.BOOL, 0);

	public static ScalarType text(int capacity) {
		return new ScalarType(ScalarKind.TEXT, capacity);
	}

	/**
	 * Brings an arbitrary in-memory value into this type's canonical form:
	 * integers wrapped to width, floats narrowed, text cut at the terminator and the capacity.
	 */
	public Object normalize(Object value) {
		Objects.requireNonNull(value, "scalar value");
		switch (kind) {
			case F32:
				return ((Number) value).floatValue();
			case F64:
				return ((Number) value).doubleValue();
			case BOOL:
				return (Boolean) value;
			case TEXT: {
				String s = value.toString();
				int terminator = s.indexOf('\0');
				if (terminator >= 0) {
					s = s.substring(0, terminator);
				}
				return truncateToUtf8(s, capacity - 1);
			}
			default:
				return kind.wrap(((Number) value).longValue());
		}
	}

	/**
	 * @return the longest prefix of {@code s} whose UTF-8 encoding fits in {@code maxBytes},
	 * never splitting a code point
	 */
	private static String truncateToUtf8(String s, int maxBytes) {
		int bytes = 0;
		int end = 0;
		while (end < s.length()) {
			int codePoint = s.codePointAt(end);
			int size = (codePoint < 0x80) ? 1 : (codePoint < 0x800) ? 2 : (codePoint < 0x10000) ? 3 : 4;
			if (bytes + size > maxBytes) {
				break;
			}
			bytes += size;
			end += Character.charCount(codePoint);
		}
		return s.substring(0, end);
	}

	/**
	 * Numeric equality for numbers, character equality up to the terminator for text.
	 */
	public boolean valuesEqual(Object a, Object b) {
		if (a == null || b == null) {
			return a == b;
		}
		Object na = normalize(a);
		Object nb = normalize(b);
		switch (kind) {
			case F32:
				return ((Float) na).floatValue() == ((Float) nb).floatValue();
			case F64:
				return ((Double) na).doubleValue() == ((Double) nb).doubleValue();
			default:
				return na.equals(nb);
		}
	}

	public Object defaultValue() {
		switch (kind) {
			case F32:
				return 0.0F;
			case F64:
				return 0.0D;
			case BOOL:
				return Boolean.FALSE;
			case TEXT:
				return "";
			default:
				return 0L;
		}
	}

	@Override
	public String briefIdentifier() {
		return (kind == ScalarKind.TEXT) ? "char[" + capacity + "]" : kind.name().toLowerCase();
	}

	@Override
	public String toString() {
		return briefIdentifier();
	}
}
