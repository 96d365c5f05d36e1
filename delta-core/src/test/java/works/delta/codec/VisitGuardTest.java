package works.delta.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VisitGuardTest {

	@Test
	void tracksIdentityNotEquality() {
		VisitGuard guard = new VisitGuard(8);
		String a = new String("same");
		String b = new String("same");
		guard.enter(a);
		assertTrue(guard.isOnPath(a));
		assertFalse(guard.isOnPath(b));
		guard.exit(a);
		assertFalse(guard.isOnPath(a));
	}

	@Test
	void reenteringSameInstance_throws() {
		VisitGuard guard = new VisitGuard(8);
		Object instance = new Object();
		guard.enter(instance);
		assertThrows(IllegalStateException.class, () -> guard.enter(instance));
	}

	@Test
	void depthLimit() {
		VisitGuard guard = new VisitGuard(2);
		assertFalse(guard.atDepthLimit());
		guard.enterPointer();
		guard.enterPointer();
		assertTrue(guard.atDepthLimit());
		assertEquals(2, guard.pointerDepth());
		guard.exitPointer();
		assertFalse(guard.atDepthLimit());
		assertEquals(1, guard.pointerDepth());
	}

	@Test
	void negativeDepth_throws() {
		assertThrows(IllegalArgumentException.class, () -> new VisitGuard(-1));
	}
}
