package works.sqljson;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;

import static java.time.format.ResolverStyle.STRICT;
import static java.time.temporal.ChronoField.MICRO_OF_SECOND;
import static java.time.temporal.ChronoUnit.MICROS;
import static java.util.Objects.requireNonNull;

/**
 * A date and time of day with microsecond precision.
 * Anything finer is truncated on construction, since MySQL can't store it.
 */
public record JsonDateTime(LocalDateTime dateTime) implements JsonValue {
	/**
	 * Always emits six fractional digits.
	 */
	public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS")
		.withResolverStyle(STRICT);

	private static final DateTimeFormatter PARSE_FORMAT = new DateTimeFormatterBuilder()
		.appendPattern("uuuu-MM-dd HH:mm:ss")
		.optionalStart()
		.appendFraction(MICRO_OF_SECOND, 0, 6, true)
		.optionalEnd()
		.toFormatter()
		.withResolverStyle(STRICT);

	public JsonDateTime {
		dateTime = requireNonNull(dateTime).truncatedTo(MICROS);
	}

	public static JsonDateTime of(LocalDateTime dateTime) {
		return new JsonDateTime(dateTime);
	}

	/**
	 * @param text in the form {@code YYYY-MM-DD HH:MM:SS}, optionally followed by up to six fractional digits
	 * @throws IllegalArgumentException if the text isn't a valid date and time
	 */
	public static JsonDateTime parse(String text) {
		try {
			return new JsonDateTime(LocalDateTime.parse(text, PARSE_FORMAT));
		} catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid datetime: \"" + text + "\"", e);
		}
	}

	public String format() {
		return FORMAT.format(dateTime);
	}

	@Override
	public JsonType type() {
		return JsonType.DATETIME;
	}
}
