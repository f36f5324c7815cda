package works.sqljson;

import static java.util.Objects.requireNonNull;

/**
 * @param raw true if the text arrived pre-escaped from its producer.
 *            Consumers in this library treat raw and ordinary strings identically.
 */
public record JsonString(String value, boolean raw) implements JsonValue {
	public JsonString {
		requireNonNull(value);
	}

	public static JsonString of(String value) {
		return new JsonString(value, false);
	}

	public static JsonString raw(String value) {
		return new JsonString(value, true);
	}

	@Override
	public JsonType type() {
		return raw ? JsonType.RAW_STRING : JsonType.STRING;
	}
}
