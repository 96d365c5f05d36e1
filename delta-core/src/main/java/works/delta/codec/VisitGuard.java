package works.delta.codec;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Tracks the instances on the current traversal path of one top-level conversion call,
 * so that self-referential structures are visited at most once per path.
 * <p>
 * Instances are compared by identity. An instance may legitimately appear more than once
 * in a structure as long as it is not its own ancestor; only actual cycles are caught.
 * <p>
 * Also counts owned pointers followed from the root, to bound the depth of acyclic chains.
 * Not thread-safe; each call gets its own guard.
 */
public final class VisitGuard {
	private final Set<Object> onPath = Collections.newSetFromMap(new IdentityHashMap<>());
	private final int maxDepth;
	private int pointerDepth = 0;

	public VisitGuard(int maxDepth) {
		if (maxDepth < 0) {
			throw new IllegalArgumentException("maxDepth can't be negative: " + maxDepth);
		}
		this.maxDepth = maxDepth;
	}

	/**
	 * @return true if {@code instance} is an ancestor of the current position
	 */
	public boolean isOnPath(Object instance) {
		return onPath.contains(instance);
	}

	/**
	 * @return true if following one more pointer would exceed the depth limit
	 */
	public boolean atDepthLimit() {
		return pointerDepth >= maxDepth;
	}

	public int pointerDepth() {
		return pointerDepth;
	}

	/**
	 * @throws IllegalStateException if {@code instance} is already on the path
	 */
	public void enter(Object instance) {
		if (!onPath.add(instance)) {
			throw new IllegalStateException("Instance is already being visited");
		}
	}

	public void exit(Object instance) {
		onPath.remove(instance);
	}

	public void enterPointer() {
		pointerDepth++;
	}

	public void exitPointer() {
		pointerDepth--;
	}
}
