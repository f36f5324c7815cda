package works.sqljson.sql;

import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A database value: raw bytes tagged with the {@link SqlType} they represent.
 */
public final class SqlValue {
	/**
	 * The bytes of the JSON literal {@code null}, used wherever
	 * an absent column value must still parse as JSON.
	 */
	public static final byte[] NULL_BYTES = "null".getBytes(UTF_8);

	public static final SqlValue NULL = new SqlValue(SqlType.NULL_TYPE, new byte[0]);

	@NotNull final SqlType type;
	final byte[] raw;

	private SqlValue(SqlType type, byte[] raw) {
		this.type = requireNonNull(type);
		this.raw = requireNonNull(raw);
	}

	/**
	 * Tags {@code raw} as a value of the given type without checking
	 * that the bytes are valid for that type.
	 * Use this only for bytes you produced yourself.
	 */
	public static SqlValue makeTrusted(SqlType type, byte[] raw) {
		if (type == SqlType.NULL_TYPE) {
			return NULL;
		}
		return new SqlValue(type, raw.clone());
	}

	public SqlType type() {
		return type;
	}

	public byte[] raw() {
		return raw.clone();
	}

	public String toText() {
		return new String(raw, UTF_8);
	}

	public boolean isNull() {
		return type == SqlType.NULL_TYPE;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		SqlValue that = (SqlValue) o;
		return type == that.type && Arrays.equals(raw, that.raw);
	}

	@Override
	public int hashCode() {
		return 31 * type.hashCode() + Arrays.hashCode(raw);
	}

	@Override
	public String toString() {
		return isNull() ? "NULL" : type + "(" + toText() + ")";
	}
}
