package works.delta.types;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A group of narrow unsigned integers packed into one storage word,
 * held in memory as a {@link Long}.
 * <p>
 * Diffing and overlaying work one sub-field at a time through {@link BitfieldMember#extract}
 * and {@link BitfieldMember#insert}, so sub-fields never clobber their neighbours.
 */
public record BitfieldGroupType(
	String name,
	List<BitfieldMember> members
) implements TypeDescriptor {
	public BitfieldGroupType {
		requireNonNull(name);
		members = List.copyOf(members);
		if (members.isEmpty()) {
			throw new IllegalArgumentException("Bitfield group " + name + " has no members");
		}
		Set<String> names = new HashSet<>();
		long used = 0;
		for (BitfieldMember member : members) {
			if (!names.add(member.name())) {
				throw new IllegalArgumentException("Duplicate bitfield \"" + member.name() + "\" in " + name);
			}
			if ((used & member.mask()) != 0) {
				throw new IllegalArgumentException("Bitfield \"" + member.name() + "\" overlaps another member of " + name);
			}
			used |= member.mask();
		}
	}

	/**
	 * Packs members least-significant-bit first, in the order given.
	 *
	 * @param namesAndWidths alternating names and widths, like {@code "flag1", 1, "flag2", 1, "value", 6}
	 */
	public static BitfieldGroupType packed(String name, Object... namesAndWidths) {
		if (namesAndWidths.length % 2 != 0) {
			throw new IllegalArgumentException("Expected name/width pairs");
		}
		List<BitfieldMember> members = new ArrayList<>();
		int offset = 0;
		for (int i = 0; i < namesAndWidths.length; i += 2) {
			String memberName = (String) namesAndWidths[i];
			int width = (Integer) namesAndWidths[i + 1];
			members.add(new BitfieldMember(memberName, width, offset));
			offset += width;
		}
		return new BitfieldGroupType(name, members);
	}

	public BitfieldMember member(String memberName) {
		for (BitfieldMember member : members) {
			if (member.name().equals(memberName)) {
				return member;
			}
		}
		throw new IllegalArgumentException("No bitfield \"" + memberName + "\" in " + name);
	}

	@Override
	public String briefIdentifier() {
		return name;
	}
}
