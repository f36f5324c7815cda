/**
 * Renders type-tagged JSON value trees as SQL expressions that MySQL
 * evaluates back to the same JSON value, extended types included.
 * <p>
 * The value tree lives in {@link works.sqljson the root package};
 * rendering and database values are in {@link works.sqljson.sql},
 * and parse failures in {@link works.sqljson.exceptions}.
 */
module works.sqljson.core {
	requires transitive org.jetbrains.annotations;
	requires org.slf4j;

	requires static lombok;

	exports works.sqljson;
	exports works.sqljson.exceptions;
	exports works.sqljson.sql;
}
