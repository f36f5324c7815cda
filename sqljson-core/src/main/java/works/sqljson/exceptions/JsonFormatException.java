package works.sqljson.exceptions;

/**
 * The JSON input could not be turned into a {@link works.sqljson.JsonValue JsonValue}.
 * <p>
 * Callers that don't care why can catch this;
 * parsers always throw one of the subclasses.
 */
public sealed abstract class JsonFormatException extends JsonException permits
	JsonContentException,
	JsonSyntaxException
{
	protected JsonFormatException(String message) {
		super(message);
	}

	protected JsonFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
