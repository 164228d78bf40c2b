package ca.gc.cra.subhunt.infrastructure.json;

import ca.gc.cra.subhunt.domain.json.JsonTree;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming JSON reader that builds {@link JsonTree} nodes with jackson-core.
 *
 * <p>Thread-safe; the {@link JsonFactory} is shared and each call uses its own parser.</p>
 *
 * @since 0.1.0
 */
public final class JsonTreeParser {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a complete JSON document.
   *
   * @param json document text; never {@code null}
   * @return parsed tree
   * @throws IllegalArgumentException when the text is empty, malformed or has trailing content
   */
  public JsonTree parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException("Empty JSON document");
      }
      JsonTree value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload: " + ex.getMessage(), ex);
    }
  }

  private JsonTree readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of JSON document");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> new JsonTree.Text(parser.getText());
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> new JsonTree.Scalar(parser.getNumberValue());
      case VALUE_TRUE -> new JsonTree.Scalar(Boolean.TRUE);
      case VALUE_FALSE -> new JsonTree.Scalar(Boolean.FALSE);
      case VALUE_NULL -> JsonTree.Scalar.NULL;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private JsonTree.Mapping readObject(JsonParser parser) throws IOException {
    Map<String, JsonTree> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return new JsonTree.Mapping(map);
  }

  private JsonTree.Sequence readArray(JsonParser parser) throws IOException {
    List<JsonTree> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return new JsonTree.Sequence(list);
  }
}
