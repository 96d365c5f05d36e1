package works.delta.types;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * One named sub-field of a {@link BitfieldGroupType}.
 *
 * @param offset position of the least significant bit within the storage word
 */
public record BitfieldMember(String name, int width, int offset) {
	public BitfieldMember {
		requireNonNull(name);
		if (!IDENTIFIER.matcher(name).matches()) {
			throw new IllegalArgumentException("Invalid bitfield name \"" + name + "\"");
		}
		if (width < 1 || width > 64) {
			throw new IllegalArgumentException("Bitfield " + name + " has invalid width " + width);
		}
		if (offset < 0 || offset + width > 64) {
			throw new IllegalArgumentException("Bitfield " + name + " doesn't fit in a 64-bit word");
		}
	}

	public long mask() {
		return (width == 64) ? -1L : ((1L << width) - 1) << offset;
	}

	/**
	 * @return the unsigned value of this sub-field within {@code word}
	 */
	public long extract(long word) {
		return (word & mask()) >>> offset;
	}

	/**
	 * @return {@code word} with this sub-field's bits replaced by the low {@code width} bits of {@code value};
	 * all other bits are unchanged
	 */
	public long insert(long word, long value) {
		return (word & ~mask()) | ((value << offset) & mask());
	}

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
}
