package works.sqljson;

import java.util.List;

public record JsonArray(List<JsonValue> elements) implements JsonValue {
	public JsonArray {
		elements = List.copyOf(elements);
	}

	public static JsonArray of(JsonValue... elements) {
		return new JsonArray(List.of(elements));
	}

	public static JsonArray of(List<JsonValue> elements) {
		return new JsonArray(elements);
	}

	@Override
	public JsonType type() {
		return JsonType.ARRAY;
	}
}
