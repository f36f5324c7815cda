package works.sqljson.exceptions;

/**
 * The bytes handed to a {@link works.sqljson.JsonValueParser JsonValueParser}
 * are not a single well-formed JSON text.
 */
public final class JsonSyntaxException extends JsonFormatException {
	public JsonSyntaxException(String message) {
		super(message);
	}

	public JsonSyntaxException(String message, Throwable cause) {
		super(message, cause);
	}
}
