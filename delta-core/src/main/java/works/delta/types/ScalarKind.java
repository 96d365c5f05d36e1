package works.delta.types;

/**
 * The primitive storage kinds a {@link ScalarType} can have.
 * <p>
 * Integer kinds are held in memory as {@link Long}, wrapped to the kind's width
 * the way a C assignment would.
 */
public enum ScalarKind {
	I8(8, true),
	U8(8, false),
	I16(16, true),
	U16(16, false),
	I32(32, true),
	U32(32, false),
	I64(64, true),
	F32,
	F64,
	BOOL,
	TEXT;

	private final int bits;
	private final boolean signed;

	ScalarKind() {
		this(0, false);
	}

	ScalarKind(int bits, boolean signed) {
		this.bits = bits;
		this.signed = signed;
	}

	public boolean isInteger() {
		return bits != 0;
	}

	public boolean isFloatingPoint() {
		return this == F32 || this == F64;
	}

	public boolean isNumeric() {
		return isInteger() || isFloatingPoint();
	}

	/**
	 * @return {@code value} reduced to this kind's width and signedness
	 */
	public long wrap(long value) {
		if (!isInteger()) {
			throw new IllegalStateException(this + " is not an integer kind");
		}
		if (bits == 64) {
			return value;
		}
		long mask = (1L << bits) - 1;
		long truncated = value & mask;
		if (signed && (truncated & (1L << (bits - 1))) != 0) {
			return truncated | ~mask;
		} else {
			return truncated;
		}
	}
}
