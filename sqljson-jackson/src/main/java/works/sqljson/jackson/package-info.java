/**
 * Jackson-based JSON text support:
 * {@link works.sqljson.jackson.JacksonValueParser} reads JSON text into value trees,
 * and {@link works.sqljson.jackson.JacksonValueGenerator} writes them back out.
 */
package works.sqljson.jackson;
