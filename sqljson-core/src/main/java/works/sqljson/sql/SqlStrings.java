package works.sqljson.sql;

/**
 * Quoting and escaping for MySQL string literals.
 */
public final class SqlStrings {
	private SqlStrings() { }

	/**
	 * @return {@code text} as a single-quoted SQL string literal, quotes included
	 */
	public static String encodeStringSql(String text) {
		StringBuilder sb = new StringBuilder(text.length() + 2);
		appendStringSql(text, sb);
		return sb.toString();
	}

	/**
	 * Appends {@code text} as a single-quoted SQL string literal.
	 * @return {@code out}
	 */
	public static StringBuilder appendStringSql(String text, StringBuilder out) {
		out.append('\'');
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			char escaped = escapeFor(c);
			if (escaped == NO_ESCAPE) {
				out.append(c);
			} else {
				out.append('\\').append(escaped);
			}
		}
		return out.append('\'');
	}

	private static char escapeFor(char c) {
		return switch (c) {
			case '\0' -> '0';
			case '\'' -> '\'';
			case '"' -> '"';
			case '\b' -> 'b';
			case '\n' -> 'n';
			case '\r' -> 'r';
			case '\t' -> 't';
			case CTRL_Z -> 'Z';
			case '\\' -> '\\';
			default -> NO_ESCAPE;
		};
	}

	private static final char CTRL_Z = 0x1A;
	private static final char NO_ESCAPE = 0;
}
