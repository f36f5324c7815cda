package works.sqljson;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonValueTest {

	@Test
	void types() {
		assertEquals(JsonType.OBJECT, JsonObject.empty().type());
		assertEquals(JsonType.ARRAY, JsonArray.of().type());
		assertEquals(JsonType.STRING, JsonString.of("x").type());
		assertEquals(JsonType.RAW_STRING, JsonString.raw("x").type());
		assertEquals(JsonType.NUMBER, JsonNumber.of(1).type());
		assertEquals(JsonType.BOOLEAN, JsonBoolean.TRUE.type());
		assertEquals(JsonType.NULL, JsonNull.NULL.type());
		assertEquals(JsonType.BLOB, JsonBlob.of().type());
		assertEquals(JsonType.BIT, JsonBit.of().type());
	}

	@Test
	void booleans() {
		assertSame(JsonBoolean.TRUE, JsonBoolean.of(true));
		assertSame(JsonBoolean.FALSE, JsonBoolean.of(false));
		assertTrue(JsonBoolean.TRUE.booleanValue());
		assertFalse(JsonBoolean.FALSE.booleanValue());
	}

	@Test
	void containers_areImmutableCopies() {
		List<JsonValue> elements = new ArrayList<>(List.of(JsonNull.NULL));
		JsonArray array = JsonArray.of(elements);
		elements.add(JsonBoolean.TRUE);
		assertEquals(List.of(JsonNull.NULL), array.elements());
		assertThrows(UnsupportedOperationException.class, () -> array.elements().add(JsonNull.NULL));

		JsonObject.Builder builder = JsonObject.builder().add("a", JsonNull.NULL);
		JsonObject object = builder.build();
		builder.add("b", JsonNull.NULL);
		assertEquals(1, object.members().size());
	}

	@Test
	void containers_rejectNullChildren() {
		assertThrows(NullPointerException.class, () -> JsonArray.of((JsonValue) null));
		assertThrows(NullPointerException.class, () -> JsonObject.builder().add("a", null));
		assertThrows(NullPointerException.class, () -> JsonObject.builder().add(null, JsonNull.NULL));
	}

	@Test
	void number_keepsTextVerbatim() {
		assertEquals("1.0", JsonNumber.of("1.0").text());
		assertNotEquals(JsonNumber.of("1.0"), JsonNumber.of("1"));
		assertThrows(IllegalArgumentException.class, () -> JsonNumber.of(""));
	}

	@Test
	void rawString_isDistinctFromPlainString() {
		assertNotEquals(JsonString.of("x"), JsonString.raw("x"));
		assertEquals(JsonString.of("x").value(), JsonString.raw("x").value());
	}

	@Test
	void blob_equalityAndCopying() {
		byte[] bytes = { 1, 2, 3 };
		JsonBlob blob = new JsonBlob(bytes);
		bytes[0] = 9;
		assertArrayEquals(new byte[] { 1, 2, 3 }, blob.bytes());
		blob.bytes()[1] = 9;
		assertArrayEquals(new byte[] { 1, 2, 3 }, blob.bytes());
		assertEquals(JsonBlob.of((byte) 1, (byte) 2, (byte) 3), blob);
		assertEquals(JsonBlob.of((byte) 1, (byte) 2, (byte) 3).hashCode(), blob.hashCode());
		assertEquals("JsonBlob[010203]", blob.toString());
	}

	@Test
	void bit_unsignedValue() {
		assertEquals(BigInteger.valueOf(255), JsonBit.of((byte) 0xFF).unsignedValue());
		assertEquals(BigInteger.ZERO, JsonBit.of().unsignedValue());
		assertEquals("JsonBit[101]", JsonBit.of((byte) 5).toString());
		assertNotEquals(JsonBit.of((byte) 5), JsonBlob.of((byte) 5));
	}
}
