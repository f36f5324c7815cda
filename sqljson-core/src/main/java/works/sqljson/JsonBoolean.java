package works.sqljson;

public enum JsonBoolean implements JsonValue {
	TRUE,
	FALSE;

	public static JsonBoolean of(boolean value) {
		return value ? TRUE : FALSE;
	}

	public boolean booleanValue() {
		return this == TRUE;
	}

	@Override
	public JsonType type() {
		return JsonType.BOOLEAN;
	}
}
