package works.sqljson;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Opaque binary data stored in a JSON document.
 */
public record JsonBlob(byte[] bytes) implements JsonValue {
	public JsonBlob {
		bytes = bytes.clone();
	}

	public static JsonBlob of(byte... bytes) {
		return new JsonBlob(bytes);
	}

	@Override
	public byte[] bytes() {
		return bytes.clone();
	}

	@Override
	public JsonType type() {
		return JsonType.BLOB;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof JsonBlob other && Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "JsonBlob[" + HexFormat.of().formatHex(bytes) + "]";
	}
}
