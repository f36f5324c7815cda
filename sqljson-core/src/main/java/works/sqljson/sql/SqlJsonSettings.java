package works.sqljson.sql;

import java.time.Clock;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SqlJsonSettings {
	/**
	 * Supplies the current date when rendering {@link works.sqljson.JsonTime TIME} values.
	 * Tests that need reproducible output should use {@link Clock#fixed}.
	 */
	@Default Clock clock = Clock.systemUTC();

	/**
	 * Prefixed to every string literal, including object keys,
	 * so MySQL knows its character set.
	 */
	@Default String charsetIntroducer = "_utf8mb4";

	/**
	 * The deepest nesting of arrays and objects a parser will accept.
	 * The default matches MySQL's own limit on JSON documents.
	 */
	@Default int maxNestingDepth = 100;

	public static SqlJsonSettings defaults() {
		return builder().build();
	}

	public void validate() {
		if (clock == null) {
			throw new IllegalArgumentException("Clock is required");
		}
		if (charsetIntroducer == null || charsetIntroducer.isBlank()) {
			throw new IllegalArgumentException("Charset introducer can't be blank");
		}
		if (maxNestingDepth <= 0) {
			throw new IllegalArgumentException("Maximum nesting depth must be positive, got " + maxNestingDepth);
		}
	}
}
