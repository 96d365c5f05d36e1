/**
 * The abstract JSON value tree the engine reads and writes.
 * A concrete implementation lives in the {@code delta-jackson} module.
 */
package works.delta.tree;
