package works.sqljson.exceptions;

/**
 * The input text is valid JSON, but we refuse to accept it;
 * for example, because it is nested too deeply.
 */
public final class JsonContentException extends JsonFormatException {
	public JsonContentException(String message) {
		super(message);
	}

	public JsonContentException(String message, Throwable cause) {
		super(message, cause);
	}
}
