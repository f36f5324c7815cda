package works.sqljson.jackson;

import java.io.StringWriter;
import java.io.Writer;
import java.util.Base64;
import tools.jackson.core.JsonGenerator;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.sqljson.JsonArray;
import works.sqljson.JsonBit;
import works.sqljson.JsonBlob;
import works.sqljson.JsonBoolean;
import works.sqljson.JsonDate;
import works.sqljson.JsonDateTime;
import works.sqljson.JsonNumber;
import works.sqljson.JsonObject;
import works.sqljson.JsonString;
import works.sqljson.JsonTime;
import works.sqljson.JsonValue;

/**
 * Emits JSON text for a {@link JsonValue} tree, writing extended types
 * the way MySQL prints them:
 * temporal values as quoted strings, and opaque values as
 * {@code "base64:typeNN:..."} strings tagged with the MySQL column type number.
 * <p>
 * This is lossy: the output parses back as plain strings.
 * Use {@link works.sqljson.sql.SqlMarshaler SqlMarshaler} when the types matter.
 */
public final class JacksonValueGenerator {
	private final ObjectMapper mapper;

	public JacksonValueGenerator() {
		this(JsonMapper.builder().build());
	}

	public JacksonValueGenerator(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public String toJson(JsonValue value) {
		StringWriter out = new StringWriter();
		generate(out, value);
		return out.toString();
	}

	/**
	 * {@code out} is closed afterward.
	 */
	public void generate(Writer out, JsonValue value) {
		try (JsonGenerator gen = mapper.createGenerator(out)) {
			write(value, gen);
		}
	}

	private void write(JsonValue value, JsonGenerator gen) {
		switch (value.type()) {
			case OBJECT -> {
				gen.writeStartObject();
				for (JsonObject.Member member : ((JsonObject) value).members()) {
					gen.writeName(member.key());
					write(member.value(), gen);
				}
				gen.writeEndObject();
			}
			case ARRAY -> {
				gen.writeStartArray();
				for (JsonValue element : ((JsonArray) value).elements()) {
					write(element, gen);
				}
				gen.writeEndArray();
			}
			case STRING, RAW_STRING -> gen.writeString(((JsonString) value).value());
			case DATE -> gen.writeString(((JsonDate) value).format());
			case DATETIME -> gen.writeString(((JsonDateTime) value).format());
			case TIME -> gen.writeString(((JsonTime) value).format());
			case BLOB -> gen.writeString(opaque(MYSQL_TYPE_VARCHAR, ((JsonBlob) value).bytes()));
			case BIT -> gen.writeString(opaque(MYSQL_TYPE_BIT, ((JsonBit) value).bytes()));
			case NUMBER -> gen.writeNumber(((JsonNumber) value).text());
			case BOOLEAN -> gen.writeBoolean(value == JsonBoolean.TRUE);
			case NULL -> gen.writeNull();
			default -> throw new AssertionError("Unexpected JSON value type: " + value.type());
		}
	}

	private static String opaque(int mysqlType, byte[] bytes) {
		return "base64:type" + mysqlType + ":" + Base64.getEncoder().encodeToString(bytes);
	}

	// Column type numbers from the MySQL protocol
	private static final int MYSQL_TYPE_VARCHAR = 15;
	private static final int MYSQL_TYPE_BIT = 16;
}
