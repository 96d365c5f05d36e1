package works.delta.naming;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.delta.TypeRegistry;
import works.delta.exceptions.InvalidFieldTypeException;
import works.delta.exceptions.InvalidTypeException;
import works.delta.types.AggregateType;
import works.delta.types.BitfieldGroupType;
import works.delta.types.FieldDescriptor;

/**
 * Writes selected fields under four-character keys derived from a salted hash,
 * so the value tree doesn't reveal field names.
 * <p>
 * A key is the first two letters of the type name, upper-cased,
 * followed by the first two Base32 characters of
 * {@code MD5(salt + ":" + typeName + ":" + fieldName)}.
 * If that key is already taken, the key itself is hashed again until a free one turns up.
 * Keys are assigned in registration order, so the same registry and salt always give the same keys.
 * <p>
 * Bitfield groups are always written by name.
 */
public final class ObfuscatedFieldNaming implements FieldNaming {
	private final Map<String, Map<String, String>> keysByField;
	private final Map<String, Map<String, String>> fieldsByKey;

	private ObfuscatedFieldNaming(Map<String, Map<String, String>> keysByField, Map<String, Map<String, String>> fieldsByKey) {
		this.keysByField = keysByField;
		this.fieldsByKey = fieldsByKey;
	}

	/**
	 * @return {@link FieldNaming#PLAIN} if obfuscation is disabled
	 * @throws InvalidFieldTypeException if a selected field can't be obfuscated
	 * @throws InvalidTypeException if no unique key can be found
	 */
	public static FieldNaming forSettings(TypeRegistry registry, ObfuscationSettings settings) throws InvalidTypeException {
		if (settings.isEnabled()) {
			return compile(registry, settings);
		} else {
			return PLAIN;
		}
	}

	public static ObfuscatedFieldNaming compile(TypeRegistry registry, ObfuscationSettings settings) throws InvalidTypeException {
		Map<String, Map<String, String>> keysByField = new LinkedHashMap<>();
		Map<String, Map<String, String>> fieldsByKey = new LinkedHashMap<>();
		Set<String> usedKeys = new HashSet<>();
		for (AggregateType type : registry.enabledAggregates()) {
			String prefix = prefixFor(type.name());
			for (FieldDescriptor field : type.fields()) {
				if (registry.resolve(field.type()) instanceof BitfieldGroupType) {
					continue;
				}
				if (!settings.shouldObfuscate(type.name(), field.name())) {
					continue;
				}
				if (field.name().startsWith("_")) {
					throw new InvalidFieldTypeException(type.name(), field.name(), "names starting with an underscore can't be obfuscated");
				}
				String key = prefix + hashChars(settings.getSalt() + ":" + type.name() + ":" + field.name());
				int attempts = 0;
				while (usedKeys.contains(key)) {
					if (++attempts > MAX_REHASH_ATTEMPTS) {
						throw new InvalidTypeException("Unable to find a unique obfuscated key for " + type.name() + "." + field.name());
					}
					key = prefix + hashChars(key);
				}
				if (!KEY_FORMAT.matcher(key).matches()) {
					throw new InvalidFieldTypeException(type.name(), field.name(), "generated invalid key \"" + key + "\"");
				}
				usedKeys.add(key);
				keysByField.computeIfAbsent(type.name(), k -> new LinkedHashMap<>()).put(field.name(), key);
				fieldsByKey.computeIfAbsent(type.name(), k -> new LinkedHashMap<>()).put(key, field.name());
				LOGGER.trace("Obfuscated {}.{} as {}", type.name(), field.name(), key);
			}
		}
		LOGGER.debug("Obfuscated {} fields across {} types", usedKeys.size(), keysByField.size());
		return new ObfuscatedFieldNaming(keysByField, fieldsByKey);
	}

	@Override
	public String keyFor(AggregateType type, FieldDescriptor field) {
		Map<String, String> keys = keysByField.get(type.name());
		if (keys == null) {
			return field.name();
		}
		return keys.getOrDefault(field.name(), field.name());
	}

	@Override
	public @Nullable String originalName(AggregateType type, String key) {
		Map<String, String> fields = fieldsByKey.get(type.name());
		if (fields != null && fields.containsKey(key)) {
			return fields.get(key);
		}
		int index = type.indexOf(key);
		if (index >= 0 && keyFor(type, type.fields().get(index)).equals(key)) {
			return key;
		}
		return null;
	}

	/**
	 * @return type name to (field name to key), for the obfuscated fields only, in assignment order
	 */
	public Map<String, Map<String, String>> fieldMap() {
		return unmodifiable(keysByField);
	}

	/**
	 * @return type name to (key to field name); the inverse of {@link #fieldMap()}
	 */
	public Map<String, Map<String, String>> fieldComments() {
		return unmodifiable(fieldsByKey);
	}

	private static Map<String, Map<String, String>> unmodifiable(Map<String, Map<String, String>> map) {
		Map<String, Map<String, String>> result = new LinkedHashMap<>();
		map.forEach((k, v) -> result.put(k, Collections.unmodifiableMap(v)));
		return Collections.unmodifiableMap(result);
	}

	static String prefixFor(String typeName) {
		StringBuilder sb = new StringBuilder(2);
		for (int i = 0; i < 2; i++) {
			char c = (i < typeName.length()) ? Character.toUpperCase(typeName.charAt(i)) : 'X';
			sb.append((c >= 'A' && c <= 'Z') ? c : 'X');
		}
		return sb.toString();
	}

	/**
	 * @return the first two Base32 characters of the MD5 digest of {@code input}
	 */
	static String hashChars(String input) {
		byte[] digest = md5().digest(input.getBytes(StandardCharsets.UTF_8));
		int b0 = digest[0] & 0xFF;
		int b1 = digest[1] & 0xFF;
		return new String(new char[] {
			BASE32_ALPHABET.charAt(b0 >>> 3),
			BASE32_ALPHABET.charAt(((b0 & 0x07) << 2) | (b1 >>> 6))
		});
	}

	private static MessageDigest md5() {
		try {
			return MessageDigest.getInstance("MD5");
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("MD5 is required on every Java platform", e);
		}
	}

	@Override
	public String toString() {
		return "ObfuscatedFieldNaming" + keysByField;
	}

	private static final String BASE32_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";
	private static final Pattern KEY_FORMAT = Pattern.compile("^[A-Z]{2}[A-Z2-7]{2}$");
	private static final int MAX_REHASH_ATTEMPTS = 1024;
	private static final Logger LOGGER = LoggerFactory.getLogger(ObfuscatedFieldNaming.class);
}
