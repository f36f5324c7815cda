package works.sqljson.sql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.sqljson.JsonValue;
import works.sqljson.JsonValueParser;
import works.sqljson.exceptions.JsonFormatException;

import static java.util.Objects.requireNonNull;

/**
 * Turns the raw bytes of a JSON column into a {@link SqlValue}
 * whose text is a SQL expression reproducing that JSON value.
 */
public final class SqlValueConverter {
	private final JsonValueParser parser;
	private final SqlMarshaler marshaler;

	public SqlValueConverter(JsonValueParser parser, SqlMarshaler marshaler) {
		this.parser = requireNonNull(parser);
		this.marshaler = requireNonNull(marshaler);
	}

	/**
	 * Empty input is treated as JSON {@code null}, so an empty column value
	 * becomes {@code CAST(null as JSON)} rather than a parse failure.
	 * A missing ({@code null}) array counts as empty.
	 *
	 * @return a trusted value of type {@link SqlType#JSON JSON}
	 * @throws JsonFormatException if {@code raw} can't be parsed; thrown unchanged from the parser
	 */
	public SqlValue marshalSqlValue(byte[] raw) {
		if (raw == null || raw.length == 0) {
			LOGGER.debug("No input; substituting JSON null");
			raw = SqlValue.NULL_BYTES;
		}
		JsonValue value;
		try {
			value = parser.parse(raw);
		} catch (JsonFormatException e) {
			LOGGER.debug("Unable to parse JSON column value", e);
			throw e;
		}
		SqlValue result = SqlValue.makeTrusted(SqlType.JSON, marshaler.marshalSql(value));
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Marshaled JSON value as: {}", result.toText());
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SqlValueConverter.class);
}
