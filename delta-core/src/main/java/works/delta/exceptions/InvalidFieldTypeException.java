package works.delta.exceptions;

public class InvalidFieldTypeException extends InvalidTypeException {
	private final String containingType;
	private final String fieldName;

	public String containingType() {
		return this.containingType;
	}

	public String fieldName() {
		return this.fieldName;
	}

	public InvalidFieldTypeException(String containingType, String fieldName, String message) {
		super(fullMessage(containingType, fieldName, message));
		this.containingType = containingType;
		this.fieldName = fieldName;
	}

	public InvalidFieldTypeException(String containingType, String fieldName, String message, Throwable cause) {
		super(fullMessage(containingType, fieldName, message), cause);
		this.containingType = containingType;
		this.fieldName = fieldName;
	}

	private static String fullMessage(String containingType, String fieldName, String message) {
		return "Invalid field " + containingType + "." + fieldName + ": " + message;
	}
}
