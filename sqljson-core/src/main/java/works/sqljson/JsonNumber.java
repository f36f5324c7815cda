package works.sqljson;

import static java.util.Objects.requireNonNull;

/**
 * A number kept as its decimal text.
 * <p>
 * The text is stored verbatim and never re-parsed or canonicalized,
 * so {@code 1.0} and {@code 1} remain distinct.
 */
public record JsonNumber(String text) implements JsonValue {
	public JsonNumber {
		requireNonNull(text);
		if (text.isEmpty()) {
			throw new IllegalArgumentException("Number text can't be empty");
		}
	}

	public static JsonNumber of(String text) {
		return new JsonNumber(text);
	}

	public static JsonNumber of(long value) {
		return new JsonNumber(Long.toString(value));
	}

	@Override
	public JsonType type() {
		return JsonType.NUMBER;
	}

	@Override
	public String toString() {
		return text;
	}
}
