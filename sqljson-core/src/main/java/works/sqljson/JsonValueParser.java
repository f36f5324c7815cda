package works.sqljson;

import works.sqljson.exceptions.JsonFormatException;

/**
 * Creates {@link JsonValue} trees from JSON text.
 */
public interface JsonValueParser {
	/**
	 * @param utf8Bytes a complete JSON document
	 * @throws JsonFormatException if the input can't be parsed
	 */
	JsonValue parse(byte[] utf8Bytes);
}
