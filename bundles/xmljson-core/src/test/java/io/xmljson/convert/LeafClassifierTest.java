package io.xmljson.convert;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.xmljson.exception.NodeLevelException;
import io.xmljson.exception.UnsupportedNodeKindException;
import io.xmljson.node.CommentNode;
import io.xmljson.node.ElementNode;
import io.xmljson.node.PINode;
import io.xmljson.node.TextNode;
import io.xmljson.node.XmlNodeKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

public final class LeafClassifierTest {

  private final LeafClassifier classifier = new LeafClassifier(new TextExtractor());

  private static JsonObject json(final String json) {
    return JsonParser.parseString(json).getAsJsonObject();
  }

  @Test
  public void testVerboseInstruction() {
    final PINode pi = new PINode("xml-stylesheet", "href=\"a.css\"");

    assertEquals(json("{\"type\":\"instruction\",\"name\":\"xml-stylesheet\",\"instruction\":\"\","
                          + "\"attributes\":{\"href\":\"a.css\"}}"),
                 classifier.classifyLeaf(pi, false, false, true));
  }

  @Test
  public void testInstructionBodyWithoutPseudoAttributes() {
    final PINode pi = new PINode("app", "mode=\"fast\" run  now");

    assertEquals(json("{\"type\":\"instruction\",\"name\":\"app\",\"instruction\":\"run now\","
                          + "\"attributes\":{\"mode\":\"fast\"}}"),
                 classifier.classifyLeaf(pi, false, false, true));
    assertEquals(json("{\"_instruction\":{\"name\":\"run now\",\"_attributes\":{\"mode\":\"fast\"}}}"),
                 classifier.classifyLeaf(pi, false, true, true));
  }

  @Test
  public void testCompactInstructionStoresBodyUnderName() {
    assertEquals(json("{\"_instruction\":{\"name\":\"run fast\"}}"),
                 classifier.classifyLeaf(new PINode("app", "run fast"), false, true, true));
  }

  @Test
  public void testEmptyInstruction() {
    assertEquals(json("{\"type\":\"instruction\",\"name\":\"app\",\"instruction\":\"\"}"),
                 classifier.classifyLeaf(new PINode("app", ""), false, false, true));
  }

  @Test
  public void testComment() {
    final CommentNode comment = new CommentNode(" keep spaces ");

    assertEquals(json("{\"type\":\"comment\",\"comment\":\" keep spaces \"}"),
                 classifier.classifyLeaf(comment, false, false, true));
    assertEquals(json("{\"_comment\":\" keep spaces \"}"), classifier.classifyLeaf(comment, false, true, true));
  }

  @Test
  public void testLeafElement() {
    final ElementNode element = ElementNode.builder("a").attribute("id", "1").text("x").build();

    assertEquals(json("{\"type\":\"element\",\"name\":\"a\",\"attributes\":{\"id\":\"1\"},"
                          + "\"elements\":[{\"type\":\"text\",\"text\":\"x\"}]}"),
                 classifier.classifyLeaf(element, false, false, true));
    assertEquals(json("{\"a\":{\"_attributes\":{\"id\":\"1\"},\"_text\":\"x\"}}"),
                 classifier.classifyLeaf(element, false, true, true));
  }

  @Test
  public void testBareLeafElementHasNoOptionalKeys() {
    final ElementNode element = ElementNode.builder("a").text("   ").build();

    final JsonObject verbose = classifier.classifyLeaf(element, false, false, true);
    assertFalse(verbose.has("attributes"));
    assertFalse(verbose.has("elements"));
    assertEquals(json("{\"a\":{}}"), classifier.classifyLeaf(element, false, true, true));
  }

  @Test
  public void testNodeWithChildren() {
    final ElementNode element = ElementNode.builder("a").add(new CommentNode("c")).build();

    final NodeLevelException e =
        assertThrows(NodeLevelException.class, () -> classifier.classifyLeaf(element, false, false, true));
    assertEquals("The element is not at the lowest level.", e.getMessage());
  }

  @Test
  public void testTextNodeIsNotSupported() {
    final UnsupportedNodeKindException e = assertThrows(UnsupportedNodeKindException.class,
                                                        () -> classifier.classifyLeaf(TextNode.cdata("x"), false, true, true));
    assertEquals(XmlNodeKind.CDATA, e.getKind());
  }
}
