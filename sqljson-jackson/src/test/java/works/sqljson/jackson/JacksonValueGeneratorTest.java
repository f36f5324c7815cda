package works.sqljson.jackson;

import java.io.StringWriter;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;
import works.sqljson.JsonArray;
import works.sqljson.JsonBit;
import works.sqljson.JsonBlob;
import works.sqljson.JsonBoolean;
import works.sqljson.JsonDate;
import works.sqljson.JsonDateTime;
import works.sqljson.JsonNull;
import works.sqljson.JsonNumber;
import works.sqljson.JsonObject;
import works.sqljson.JsonString;
import works.sqljson.JsonTime;
import works.sqljson.JsonValue;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;

class JacksonValueGeneratorTest {
	final JacksonValueGenerator generator = new JacksonValueGenerator();

	@Test
	void standardTypes() {
		JsonValue value = JsonObject.builder()
			.add("n", JsonNumber.of("1.50"))
			.add("s", JsonString.of("a\"b"))
			.add("list", JsonArray.of(JsonBoolean.TRUE, JsonBoolean.FALSE, JsonNull.NULL))
			.add("raw", JsonString.raw("r"))
			.build();
		assertEquals("{\"n\":1.50,\"s\":\"a\\\"b\",\"list\":[true,false,null],\"raw\":\"r\"}", generator.toJson(value));
	}

	@Test
	void temporalTypes_areQuoted() {
		JsonValue value = JsonArray.of(
			JsonDate.of(LocalDate.of(2020, 1, 1)),
			JsonDateTime.of(LocalDateTime.of(2020, 1, 2, 3, 4, 5)),
			JsonTime.of(Duration.ofHours(-33)));
		assertEquals("[\"2020-01-01\",\"2020-01-02 03:04:05.000000\",\"-33:00:00.000000\"]", generator.toJson(value));
	}

	@Test
	void opaqueTypes_areBase64WithTypeNumber() {
		JsonValue value = JsonArray.of(
			JsonBlob.of((byte) 1, (byte) 2),
			JsonBit.of((byte) 5));
		assertEquals("[\"base64:type15:AQI=\",\"base64:type16:BQ==\"]", generator.toJson(value));
	}

	@Test
	void generate_writesToWriter() {
		StringWriter out = new StringWriter();
		generator.generate(out, JsonNumber.of(7));
		assertEquals("7", out.toString());
	}

	@Test
	void generatedText_parsesBackForStandardTypes() {
		JsonValue value = JsonObject.builder()
			.add("a", JsonArray.of(JsonNumber.of("-2.5E-10"), JsonString.of("日本")))
			.add("b", JsonObject.empty())
			.build();
		JacksonValueParser parser = JacksonValueParser.withDefaults();
		assertEquals(value, parser.parse(generator.toJson(value).getBytes(UTF_8)));
	}
}
