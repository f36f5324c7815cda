package works.sqljson;

/**
 * The tag of a {@link JsonValue}.
 * <p>
 * Code that dispatches on the kind of value should switch on this
 * rather than using {@code instanceof} chains.
 */
public enum JsonType {
	OBJECT,
	ARRAY,
	STRING,

	/**
	 * A string whose contents arrived pre-escaped.
	 * Rendered exactly like {@link #STRING}.
	 */
	RAW_STRING,

	DATE,
	DATETIME,
	TIME,
	BLOB,
	BIT,
	NUMBER,
	BOOLEAN,
	NULL,
}
