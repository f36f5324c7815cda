package works.sqljson;

/**
 * One node of a JSON value tree.
 * <p>
 * Besides the standard JSON types, this covers the extended scalar types
 * MySQL allows inside a JSON document: {@link JsonDate DATE}, {@link JsonDateTime DATETIME},
 * {@link JsonTime TIME}, {@link JsonBlob BLOB} and {@link JsonBit BIT}.
 * <p>
 * Instances are immutable and thread safe.
 */
public sealed interface JsonValue permits
	JsonObject,
	JsonArray,
	JsonString,
	JsonDate,
	JsonDateTime,
	JsonTime,
	JsonBlob,
	JsonBit,
	JsonNumber,
	JsonBoolean,
	JsonNull
{
	JsonType type();
}
