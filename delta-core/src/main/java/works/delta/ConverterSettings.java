package works.delta;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.delta.naming.ObfuscationSettings;

@Value
@Builder(toBuilder = true)
public class ConverterSettings {
	public static final ConverterSettings DEFAULT = ConverterSettings.builder().build();

	/**
	 * How many owned pointers may be followed below the top-level instance.
	 * Deeper branches are dropped when serializing, and rejected when deserializing.
	 * <p>
	 * Cycles are caught separately, so this only matters for very long acyclic chains
	 * such as linked lists.
	 */
	@Default int maxDepth = 64;

	/**
	 * When true, a scalar member whose node has the wrong kind is a
	 * {@link works.delta.exceptions.MalformedTreeException MalformedTreeException}.
	 * When false, such members are skipped and the destination keeps its baseline value.
	 */
	@Default boolean strictScalars = true;

	@Default CycleMarker cycleMarker = CycleMarker.OMIT;

	@Default ObfuscationSettings obfuscation = ObfuscationSettings.DISABLED;
}
