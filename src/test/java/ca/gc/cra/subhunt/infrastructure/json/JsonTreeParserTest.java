package ca.gc.cra.subhunt.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.subhunt.domain.json.JsonTree;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonTreeParserTest {
  private final JsonTreeParser parser = new JsonTreeParser();

  @Test
  void parsesNestedDocumentPreservingFieldOrder() {
    JsonTree tree = parser.parse(
        "{\"page_state\":\"abc\",\"results\":[{\"domain\":\"a.example.com\"},\"b.example.com\"],\"n\":3}");

    JsonTree.Mapping root = assertInstanceOf(JsonTree.Mapping.class, tree);
    assertEquals(List.of("page_state", "results", "n"), List.copyOf(root.fields().keySet()));
    assertEquals(new JsonTree.Text("abc"), root.get("page_state"));
    JsonTree.Sequence results = assertInstanceOf(JsonTree.Sequence.class, root.get("results"));
    assertEquals(2, results.elements().size());
    assertEquals(new JsonTree.Text("b.example.com"), results.elements().get(1));
    JsonTree.Scalar n = assertInstanceOf(JsonTree.Scalar.class, root.get("n"));
    assertEquals(3, ((Number) n.value()).intValue());
  }

  @Test
  void mapsLiteralsToScalars() {
    JsonTree.Sequence values = assertInstanceOf(JsonTree.Sequence.class, parser.parse("[true, false, null]"));
    assertEquals(new JsonTree.Scalar(Boolean.TRUE), values.elements().get(0));
    assertEquals(new JsonTree.Scalar(Boolean.FALSE), values.elements().get(1));
    assertSame(JsonTree.Scalar.NULL, values.elements().get(2));
  }

  @Test
  void rejectsEmptyMalformedAndTrailingInput() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse(""));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("<html>rate limited</html>"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"domain\":"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("{} {}"));
  }
}
