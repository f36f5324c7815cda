package works.sqljson.sql;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import works.sqljson.JsonArray;
import works.sqljson.JsonBit;
import works.sqljson.JsonBlob;
import works.sqljson.JsonBoolean;
import works.sqljson.JsonDate;
import works.sqljson.JsonDateTime;
import works.sqljson.JsonNumber;
import works.sqljson.JsonObject;
import works.sqljson.JsonString;
import works.sqljson.JsonTime;
import works.sqljson.JsonValue;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Renders a {@link JsonValue} tree as a SQL expression that MySQL evaluates
 * to an equal value of type JSON.
 * <p>
 * Objects and arrays become {@code JSON_OBJECT(...)} and {@code JSON_ARRAY(...)} calls,
 * inside which MySQL infers JSON-ness for each argument by itself.
 * A scalar standing alone at the top level has no such context,
 * so it is wrapped in {@code CAST(... as JSON)};
 * a string gets {@code JSON_QUOTE} inside the cast, since casting a bare string
 * would parse it as JSON text instead of producing a JSON string.
 * <p>
 * Extended types keep their identity: a {@link JsonDate} renders as a {@code date} literal,
 * not as a string that happens to look like a date.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public final class SqlMarshaler {
	private final Clock clock;
	private final String charsetIntroducer;

	public SqlMarshaler(SqlJsonSettings settings) {
		settings.validate();
		this.clock = settings.clock();
		this.charsetIntroducer = settings.charsetIntroducer();
	}

	public static SqlMarshaler withDefaults() {
		return new SqlMarshaler(SqlJsonSettings.defaults());
	}

	/**
	 * @return the UTF-8 bytes of the top-level SQL rendering of {@code value}
	 */
	public byte[] marshalSql(JsonValue value) {
		return marshalSqlText(value).getBytes(UTF_8);
	}

	public String marshalSqlText(JsonValue value) {
		return appendSql(value, true, new StringBuilder()).toString();
	}

	/**
	 * Appends the SQL rendering of {@code value} to {@code out}.
	 *
	 * @param top true if the result will stand alone as an expression,
	 *            rather than being an argument of an enclosing
	 *            {@code JSON_OBJECT} or {@code JSON_ARRAY}
	 * @return {@code out}
	 */
	public StringBuilder appendSql(JsonValue value, boolean top, StringBuilder out) {
		switch (value.type()) {
			case OBJECT -> appendObject((JsonObject) value, out);
			case ARRAY -> appendArray((JsonArray) value, out);
			case STRING, RAW_STRING -> appendString((JsonString) value, top, out);
			case DATE -> {
				openCast(top, out);
				out.append("date '").append(((JsonDate) value).format()).append('\'');
				closeCast(top, out);
			}
			case DATETIME -> {
				openCast(top, out);
				out.append("timestamp '").append(((JsonDateTime) value).format()).append('\'');
				closeCast(top, out);
			}
			case TIME -> {
				openCast(top, out);
				out.append("time '");
				appendTimeOfDay((JsonTime) value, out);
				out.append('\'');
				closeCast(top, out);
			}
			case BLOB -> {
				openCast(top, out);
				out.append("x'").append(HexFormat.of().formatHex(((JsonBlob) value).bytes())).append('\'');
				closeCast(top, out);
			}
			case BIT -> {
				openCast(top, out);
				out.append("b'").append(((JsonBit) value).unsignedValue().toString(2)).append('\'');
				closeCast(top, out);
			}
			case NUMBER -> {
				openCast(top, out);
				out.append(((JsonNumber) value).text());
				closeCast(top, out);
			}
			case BOOLEAN -> {
				openCast(top, out);
				out.append(value == JsonBoolean.TRUE ? "true" : "false");
				closeCast(top, out);
			}
			case NULL -> {
				openCast(top, out);
				out.append("null");
				closeCast(top, out);
			}
			default -> throw new AssertionError("Unexpected JSON value type: " + value.type());
		}
		return out;
	}

	private void appendObject(JsonObject object, StringBuilder out) {
		out.append("JSON_OBJECT(");
		List<JsonObject.Member> members = object.members();
		for (int i = 0; i < members.size(); i++) {
			if (i != 0) {
				out.append(", ");
			}
			JsonObject.Member member = members.get(i);
			appendStringLiteral(member.key(), out);
			out.append(", ");
			appendSql(member.value(), false, out);
		}
		out.append(')');
	}

	private void appendArray(JsonArray array, StringBuilder out) {
		out.append("JSON_ARRAY(");
		List<JsonValue> elements = array.elements();
		for (int i = 0; i < elements.size(); i++) {
			if (i != 0) {
				out.append(", ");
			}
			appendSql(elements.get(i), false, out);
		}
		out.append(')');
	}

	private void appendString(JsonString string, boolean top, StringBuilder out) {
		if (top) {
			out.append("CAST(JSON_QUOTE(");
		}
		appendStringLiteral(string.value(), out);
		if (top) {
			out.append(") as JSON)");
		}
	}

	private void appendStringLiteral(String text, StringBuilder out) {
		out.append(charsetIntroducer);
		SqlStrings.appendStringSql(text, out);
	}

	/**
	 * The time is measured from midnight of today's date.
	 * Hours wrap at 32, matching what MySQL does with a TIME inside a JSON value.
	 */
	private void appendTimeOfDay(JsonTime time, StringBuilder out) {
		LocalDate today = LocalDate.now(clock);
		LocalDateTime midnight = today.atStartOfDay();
		Duration diff = Duration.between(midnight, time.atDay(today));
		if (diff.isNegative()) {
			out.append('-');
			diff = diff.negated();
		}
		out.append(String.format(Locale.ROOT, "%02d:%02d:%02d.%06d",
			diff.toHours() % TIME_HOUR_WRAP,
			diff.toMinutesPart(),
			diff.toSecondsPart(),
			diff.toNanosPart() / 1000));
	}

	private static void openCast(boolean top, StringBuilder out) {
		if (top) {
			out.append("CAST(");
		}
	}

	private static void closeCast(boolean top, StringBuilder out) {
		if (top) {
			out.append(" as JSON)");
		}
	}

	private static final long TIME_HOUR_WRAP = 32;
}
