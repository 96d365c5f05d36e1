/**
 * The conversion engine.
 * <p>
 * One generic, descriptor-driven implementation serves every registered type:
 * {@link works.delta.codec.DiffingSerializer} walks an instance (and optional baseline) to produce a value tree,
 * {@link works.delta.codec.OverlayDeserializer} walks a value tree to update a destination instance,
 * and {@link works.delta.codec.ArrayConverter} applies both element by element to whole arrays.
 * Each top-level call creates its own session, with its own {@link works.delta.codec.VisitGuard},
 * so the engine objects themselves are immutable and can be shared across threads.
 */
package works.delta.codec;
