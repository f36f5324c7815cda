package works.sqljson;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import static java.time.format.ResolverStyle.STRICT;
import static java.util.Objects.requireNonNull;

/**
 * A calendar date with no time component, as stored by MySQL in a JSON document.
 */
public record JsonDate(LocalDate date) implements JsonValue {
	public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
		.withResolverStyle(STRICT);

	public JsonDate {
		requireNonNull(date);
	}

	public static JsonDate of(LocalDate date) {
		return new JsonDate(date);
	}

	/**
	 * @param text in the form {@code YYYY-MM-DD}
	 * @throws IllegalArgumentException if the text isn't a valid date
	 */
	public static JsonDate parse(String text) {
		try {
			return new JsonDate(LocalDate.parse(text, FORMAT));
		} catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid date: \"" + text + "\"", e);
		}
	}

	public String format() {
		return FORMAT.format(date);
	}

	@Override
	public JsonType type() {
		return JsonType.DATE;
	}
}
