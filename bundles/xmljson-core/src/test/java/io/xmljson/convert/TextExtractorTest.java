package io.xmljson.convert;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import io.xmljson.node.ElementNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class TextExtractorTest {

  private final TextExtractor extractor = new TextExtractor();

  private static JsonElement json(final String json) {
    return JsonParser.parseString(json);
  }

  @Test
  public void testCompactSingleRuns() {
    final ElementNode element = ElementNode.builder("a").text("  hi  ").cdata(" raw ").build();

    assertEquals(json("{\"_cdata\":\"raw\",\"_text\":\"hi\"}"), extractor.extractText(element, false, true, true));
  }

  @Test
  public void testCompactMultipleRuns() {
    final ElementNode element = ElementNode.builder("a")
                                           .text("x")
                                           .add(ElementNode.builder("b").build())
                                           .text("y")
                                           .build();

    assertEquals(json("{\"_text\":[\"x\",\"y\"]}"), extractor.extractText(element, false, true, true));
  }

  @Test
  public void testVerboseKeepsRunOrder() {
    final ElementNode element = ElementNode.builder("a").text("x").cdata("y").text("z").build();

    assertEquals(json("[{\"type\":\"text\",\"text\":\"x\"},{\"type\":\"cdata\",\"cdata\":\"y\"},"
                          + "{\"type\":\"text\",\"text\":\"z\"}]"),
                 extractor.extractText(element, false, false, true));
  }

  @Test
  public void testStripCdata() {
    final ElementNode element = ElementNode.builder("a").cdata("x").build();

    assertEquals(json("{\"_text\":\"x\"}"), extractor.extractText(element, true, true, true));
    assertEquals(json("[{\"type\":\"text\",\"text\":\"x\"}]"), extractor.extractText(element, true, false, true));
  }

  @Test
  public void testBlankRuns() {
    final ElementNode element = ElementNode.builder("a").text(" \n\t ").build();

    assertNull(extractor.extractText(element, false, true, true));
    assertNull(extractor.extractText(element, false, false, true));
    assertEquals(json("{\"_text\":\"\"}"), extractor.extractText(element, false, true, false));
    assertEquals(json("[{\"type\":\"text\",\"text\":\"\"}]"), extractor.extractText(element, false, false, false));
  }

  @Test
  public void testNoText() {
    final ElementNode element = ElementNode.builder("a").add(ElementNode.builder("b").text("nested").build()).build();

    assertNull(extractor.extractText(element, false, true, true));
    assertTrue(extractor.extract(element, false, true).isEmpty());
  }

  @Test
  public void testNullElement() {
    assertThrows(NullPointerException.class, () -> extractor.extractText(null, false, false, true));
  }
}
