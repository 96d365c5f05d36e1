package works.delta.naming;

import org.jetbrains.annotations.Nullable;
import works.delta.types.AggregateType;
import works.delta.types.FieldDescriptor;

/**
 * Chooses the value tree member name under which each aggregate field is written and read.
 */
public interface FieldNaming {
	String keyFor(AggregateType type, FieldDescriptor field);

	/**
	 * @return the field written under {@code key}, or null if there isn't one
	 */
	@Nullable String originalName(AggregateType type, String key);

	/**
	 * Fields are keyed by their own names.
	 */
	FieldNaming PLAIN = new FieldNaming() {
		@Override
		public String keyFor(AggregateType type, FieldDescriptor field) {
			return field.name();
		}

		@Override
		public @Nullable String originalName(AggregateType type, String key) {
			return (type.indexOf(key) >= 0) ? key : null;
		}

		@Override
		public String toString() {
			return "PLAIN";
		}
	};
}
