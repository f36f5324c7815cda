package works.sqljson;

public enum JsonNull implements JsonValue {
	NULL;

	@Override
	public JsonType type() {
		return JsonType.NULL;
	}
}
