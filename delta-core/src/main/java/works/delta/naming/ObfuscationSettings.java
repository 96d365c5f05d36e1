package works.delta.naming;

import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * Controls which aggregate fields are written under short opaque keys instead of their names.
 *
 * @see ObfuscatedFieldNaming
 */
@Value
@Builder(toBuilder = true)
public class ObfuscationSettings {
	public static final ObfuscationSettings DISABLED = ObfuscationSettings.builder().build();

	@Default boolean enabled = false;

	/**
	 * Mixed into every key hash. Changing it changes every key.
	 */
	@Default String salt = "struct_converter";

	/**
	 * Obfuscate every field of every enabled aggregate, except those {@link #excluded}.
	 */
	@Default boolean obfuscateAll = false;

	/**
	 * Type name to the names of its fields to obfuscate. Ignored when {@link #obfuscateAll} is set.
	 */
	@Default Map<String, Set<String>> included = Map.of();

	/**
	 * Type name to the names of its fields that are always written by name.
	 */
	@Default Map<String, Set<String>> excluded = Map.of();

	public boolean shouldObfuscate(String typeName, String fieldName) {
		if (!enabled) {
			return false;
		}
		if (excluded.getOrDefault(typeName, Set.of()).contains(fieldName)) {
			return false;
		}
		return obfuscateAll || included.getOrDefault(typeName, Set.of()).contains(fieldName);
	}
}
