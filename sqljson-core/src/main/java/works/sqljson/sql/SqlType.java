package works.sqljson.sql;

/**
 * Wire types a {@link SqlValue} can be tagged with.
 */
public enum SqlType {
	NULL_TYPE,
	INT64,
	DECIMAL,
	VARCHAR,
	VARBINARY,
	DATE,
	DATETIME,
	TIME,
	BIT,
	BLOB,
	JSON,
}
