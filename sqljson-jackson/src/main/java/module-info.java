/**
 * JSON text parsing and generation for {@link works.sqljson.JsonValue} trees, using the Jackson library.
 * <p>
 * See {@link works.sqljson.jackson.JacksonValueParser} for the main entry point.
 */
module works.sqljson.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.sqljson.core;

	exports works.sqljson.jackson;
}
