package works.sqljson.jackson;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.StreamReadConstraints;
import tools.jackson.core.exc.StreamConstraintsException;
import tools.jackson.core.json.JsonFactory;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.sqljson.JsonArray;
import works.sqljson.JsonBoolean;
import works.sqljson.JsonNull;
import works.sqljson.JsonNumber;
import works.sqljson.JsonObject;
import works.sqljson.JsonString;
import works.sqljson.JsonValue;
import works.sqljson.JsonValueParser;
import works.sqljson.exceptions.JsonContentException;
import works.sqljson.exceptions.JsonSyntaxException;
import works.sqljson.sql.SqlJsonSettings;

/**
 * Parses JSON text into a {@link JsonValue} tree using Jackson's streaming API.
 * <p>
 * Unlike {@link ObjectMapper#readTree}, this keeps every number's source text
 * exactly as written, and keeps duplicate member names in their original order.
 * JSON text can only express the standard JSON types,
 * so the extended types never come out of this parser.
 */
public final class JacksonValueParser implements JsonValueParser {
	private final ObjectMapper mapper;

	public JacksonValueParser(SqlJsonSettings settings) {
		settings.validate();
		JsonFactory factory = JsonFactory.builder()
			.streamReadConstraints(StreamReadConstraints.builder()
				.maxNestingDepth(settings.maxNestingDepth())
				.build())
			.build();
		this.mapper = JsonMapper.builder(factory).build();
	}

	public static JacksonValueParser withDefaults() {
		return new JacksonValueParser(SqlJsonSettings.defaults());
	}

	@Override
	public JsonValue parse(byte[] utf8Bytes) {
		try (JsonParser parser = mapper.createParser(utf8Bytes)) {
			JsonToken first = parser.nextToken();
			if (first == null) {
				throw new JsonSyntaxException("No JSON value in input");
			}
			JsonValue result = parseValue(parser, first);
			JsonToken trailing = parser.nextToken();
			if (trailing != null) {
				throw new JsonSyntaxException("Unexpected " + trailing + " after end of JSON value");
			}
			return result;
		} catch (StreamConstraintsException e) {
			LOGGER.debug("JSON text exceeds parser limits", e);
			throw new JsonContentException(e.getMessage(), e);
		} catch (JacksonException e) {
			LOGGER.debug("Invalid JSON text", e);
			throw new JsonSyntaxException(e.getMessage(), e);
		}
	}

	private JsonValue parseValue(JsonParser parser, JsonToken token) {
		if (token == null) {
			throw new JsonSyntaxException("Unexpected end of input");
		}
		return switch (token) {
			case START_OBJECT -> parseObject(parser);
			case START_ARRAY -> parseArray(parser);
			case VALUE_STRING -> JsonString.of(parser.getString());
			case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> JsonNumber.of(parser.getString());
			case VALUE_TRUE -> JsonBoolean.TRUE;
			case VALUE_FALSE -> JsonBoolean.FALSE;
			case VALUE_NULL -> JsonNull.NULL;
			default -> throw new JsonSyntaxException("Unexpected token " + token + " at " + parser.currentLocation());
		};
	}

	private JsonObject parseObject(JsonParser parser) {
		JsonObject.Builder builder = JsonObject.builder();
		JsonToken token;
		while ((token = parser.nextToken()) == JsonToken.PROPERTY_NAME) {
			String key = parser.currentName();
			builder.add(key, parseValue(parser, parser.nextToken()));
		}
		if (token != JsonToken.END_OBJECT) {
			throw new JsonSyntaxException("Expected member name or end of object; got " + token);
		}
		return builder.build();
	}

	private JsonArray parseArray(JsonParser parser) {
		List<JsonValue> elements = new ArrayList<>();
		JsonToken token;
		while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
			if (token == null) {
				throw new JsonSyntaxException("Unexpected end of input inside array");
			}
			elements.add(parseValue(parser, token));
		}
		return JsonArray.of(elements);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonValueParser.class);
}
