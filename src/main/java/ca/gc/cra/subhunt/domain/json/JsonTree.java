package ca.gc.cra.subhunt.domain.json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed JSON document as a closed set of node shapes.
 *
 * <p>Upstream lookup services share no schema, so extraction walks these nodes heuristically
 * instead of binding to classes. Numbers, booleans and {@code null} collapse into
 * {@link Scalar}.</p>
 *
 * @since 0.1.0
 */
public sealed interface JsonTree permits JsonTree.Text, JsonTree.Sequence, JsonTree.Mapping, JsonTree.Scalar {

  /** JSON string. */
  record Text(String value) implements JsonTree {
    public Text {
      Objects.requireNonNull(value, "value");
    }
  }

  /** JSON array; element order is document order. */
  record Sequence(List<JsonTree> elements) implements JsonTree {
    public Sequence {
      elements = List.copyOf(elements);
    }
  }

  /** JSON object; field order is document order. */
  record Mapping(Map<String, JsonTree> fields) implements JsonTree {
    public Mapping {
      Objects.requireNonNull(fields, "fields");
      fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public JsonTree get(String key) {
      return fields.get(key);
    }
  }

  /** Number, boolean or {@code null}; {@code value} is {@code null} for JSON null. */
  record Scalar(Object value) implements JsonTree {
    public static final Scalar NULL = new Scalar(null);
  }

  static Text text(String value) {
    return new Text(value);
  }

  static Sequence sequence(JsonTree... elements) {
    return new Sequence(List.of(elements));
  }
}
