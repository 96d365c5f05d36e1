package works.delta.tree;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * The conversion engine's only view of the JSON representation.
 * <p>
 * Nodes are opaque values of type {@code N}. Object and array nodes created here are mutable
 * until the engine hands them back to the caller.
 * Implementations must be stateless or thread-safe, since one instance is shared
 * by every conversion of a {@link works.delta.DeltaCodec DeltaCodec}.
 *
 * @param <N> the node type
 */
public interface ValueTree<N> {
	N newObject();
	N newArray();
	N newNumber(long value);
	N newNumber(double value);
	N newString(String value);
	N newBoolean(boolean value);
	N newNull();

	NodeKind kindOf(N node);

	/**
	 * @return true if {@code node} is a number with no fractional part in its representation
	 */
	boolean isIntegral(N node);

	/**
	 * @return the member of an object node, or null if it has no such member
	 */
	@Nullable N getMember(N object, String name);

	void setMember(N object, String name, N value);

	/**
	 * @return member names of an object node, in the node's order
	 */
	List<String> memberNames(N object);

	/**
	 * @return the number of members of an object node or elements of an array node
	 */
	int size(N node);

	N getElement(N array, int index);

	void addElement(N array, N value);

	/**
	 * @return the value of a number node, truncated toward zero if it has a fractional part
	 */
	long longValue(N number);

	double doubleValue(N number);

	String stringValue(N string);

	boolean booleanValue(N bool);

	default boolean isEmptyObject(N node) {
		return kindOf(node) == NodeKind.OBJECT && size(node) == 0;
	}
}
