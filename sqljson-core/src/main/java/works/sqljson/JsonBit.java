package works.sqljson;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * A MySQL BIT value: a bit string stored big-endian.
 */
public record JsonBit(byte[] bytes) implements JsonValue {
	public JsonBit {
		bytes = bytes.clone();
	}

	public static JsonBit of(byte... bytes) {
		return new JsonBit(bytes);
	}

	@Override
	public byte[] bytes() {
		return bytes.clone();
	}

	/**
	 * @return the bits interpreted as an unsigned integer
	 */
	public BigInteger unsignedValue() {
		return new BigInteger(1, bytes);
	}

	@Override
	public JsonType type() {
		return JsonType.BIT;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof JsonBit other && Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "JsonBit[" + unsignedValue().toString(2) + "]";
	}
}
