package works.delta.instances;

import works.delta.TypeRegistry;
import works.delta.exceptions.AllocationException;
import works.delta.types.TypeDescriptor;

/**
 * The single point through which deserialization materializes new instances,
 * such as the pointee of an owned pointer that was null before decoding.
 */
@FunctionalInterface
public interface InstanceAllocator {
	/**
	 * @return a new instance of {@code type} holding default values
	 * @throws AllocationException if the instance can't be created
	 */
	Object allocate(TypeDescriptor type, TypeRegistry registry);

	InstanceAllocator DEFAULT = Instances::defaultValue;
}
