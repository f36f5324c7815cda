package works.sqljson.sql;

import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlValueTest {

	@Test
	void makeTrusted_keepsBytesAndType() {
		SqlValue value = SqlValue.makeTrusted(SqlType.JSON, "CAST(1 as JSON)".getBytes(UTF_8));
		assertEquals(SqlType.JSON, value.type());
		assertEquals("CAST(1 as JSON)", value.toText());
		assertFalse(value.isNull());
		assertEquals("JSON(CAST(1 as JSON))", value.toString());
	}

	@Test
	void makeTrusted_copiesInput() {
		byte[] bytes = "1".getBytes(UTF_8);
		SqlValue value = SqlValue.makeTrusted(SqlType.INT64, bytes);
		bytes[0] = '2';
		assertEquals("1", value.toText());
		value.raw()[0] = '3';
		assertArrayEquals("1".getBytes(UTF_8), value.raw());
	}

	@Test
	void nullType_isTheNullValue() {
		assertSame(SqlValue.NULL, SqlValue.makeTrusted(SqlType.NULL_TYPE, new byte[] { 'x' }));
		assertTrue(SqlValue.NULL.isNull());
		assertEquals("NULL", SqlValue.NULL.toString());
	}

	@Test
	void equality_comparesTypeAndBytes() {
		byte[] bytes = "1".getBytes(UTF_8);
		assertEquals(SqlValue.makeTrusted(SqlType.JSON, bytes), SqlValue.makeTrusted(SqlType.JSON, bytes));
		assertEquals(SqlValue.makeTrusted(SqlType.JSON, bytes).hashCode(), SqlValue.makeTrusted(SqlType.JSON, bytes).hashCode());
		assertNotEquals(SqlValue.makeTrusted(SqlType.JSON, bytes), SqlValue.makeTrusted(SqlType.VARCHAR, bytes));
	}

	@Test
	void nullBytes_spellNull() {
		assertEquals("null", new String(SqlValue.NULL_BYTES, UTF_8));
	}
}
