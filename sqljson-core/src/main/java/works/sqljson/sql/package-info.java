/**
 * Rendering JSON value trees as MySQL SQL expressions.
 * <p>
 * {@link works.sqljson.sql.SqlMarshaler} does the rendering;
 * {@link works.sqljson.sql.SqlValueConverter} adds parsing in front of it
 * and wraps the result as a {@link works.sqljson.sql.SqlValue}.
 */
package works.sqljson.sql;
