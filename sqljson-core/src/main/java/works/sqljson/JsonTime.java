package works.sqljson;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.time.temporal.ChronoUnit.MICROS;
import static java.util.Objects.requireNonNull;

/**
 * A MySQL TIME: a signed duration that is usually, but not necessarily,
 * a time of day. It can be negative and can exceed 24 hours,
 * up to MySQL's limit of {@code 838:59:59.999999} either way.
 */
public record JsonTime(Duration duration) implements JsonValue {
	public JsonTime {
		duration = requireNonNull(duration).truncatedTo(MICROS);
		if (duration.compareTo(MAX_MAGNITUDE) > 0 || duration.compareTo(MAX_MAGNITUDE.negated()) < 0) {
			throw new IllegalArgumentException("Time out of range: " + duration);
		}
	}

	public static JsonTime of(Duration duration) {
		return new JsonTime(duration);
	}

	/**
	 * @param text in the form {@code [-]H+:MM:SS[.ffffff]}; the sign applies to the whole duration
	 * @throws IllegalArgumentException if the text isn't a valid time, or is out of range
	 */
	public static JsonTime parse(String text) {
		Matcher m = TIME_PATTERN.matcher(text);
		if (!m.matches()) {
			throw new IllegalArgumentException("Invalid time: \"" + text + "\"");
		}
		long hours = Long.parseLong(m.group(2));
		int minutes = Integer.parseInt(m.group(3));
		int seconds = Integer.parseInt(m.group(4));
		if (minutes >= 60 || seconds >= 60) {
			throw new IllegalArgumentException("Invalid time: \"" + text + "\"");
		}
		long micros = 0;
		String fraction = m.group(5);
		if (fraction != null) {
			micros = Long.parseLong((fraction + "00000").substring(0, 6));
		}
		Duration result = Duration.ofHours(hours)
			.plusMinutes(minutes)
			.plusSeconds(seconds)
			.plus(micros, MICROS);
		return new JsonTime(m.group(1) == null ? result : result.negated());
	}

	/**
	 * @return the instant this duration reaches when counted from midnight of the given day
	 */
	public LocalDateTime atDay(LocalDate day) {
		return day.atStartOfDay().plus(duration);
	}

	/**
	 * @return the text form {@code [-]HH:MM:SS.ffffff}, with no limit on the hours
	 */
	public String format() {
		Duration magnitude = duration.abs();
		return String.format(Locale.ROOT, "%s%02d:%02d:%02d.%06d",
			duration.isNegative() ? "-" : "",
			magnitude.toHours(),
			magnitude.toMinutesPart(),
			magnitude.toSecondsPart(),
			magnitude.toNanosPart() / 1000);
	}

	@Override
	public JsonType type() {
		return JsonType.TIME;
	}

	public static final Duration MAX_MAGNITUDE = Duration.ofHours(838).plusMinutes(59).plusSeconds(59).plus(999_999, MICROS);

	private static final Pattern TIME_PATTERN = Pattern.compile("(-)?(\\d{1,9}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,6}))?");
}
