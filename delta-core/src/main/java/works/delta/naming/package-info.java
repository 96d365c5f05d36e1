/**
 * Mapping between aggregate field names and the member names used in the value tree.
 */
package works.delta.naming;
