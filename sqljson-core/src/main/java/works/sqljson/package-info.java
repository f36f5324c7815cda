/**
 * The JSON value tree.
 * <p>
 * {@link works.sqljson.JsonValue} is the root of a sealed hierarchy covering
 * standard JSON plus MySQL's extended scalar types.
 * Trees are produced by a {@link works.sqljson.JsonValueParser}
 * and rendered as SQL by {@link works.sqljson.sql.SqlMarshaler}.
 */
package works.sqljson;
