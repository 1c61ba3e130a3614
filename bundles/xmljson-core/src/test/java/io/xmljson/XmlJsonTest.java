package io.xmljson;

import com.google.gson.JsonObject;
import io.xmljson.exception.XmlParseException;
import io.xmljson.node.ElementNode;
import io.xmljson.parse.XmlTreeParser;
import io.xmljson.settings.ConversionOptions;
import org.json.JSONException;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONAssert;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class XmlJsonTest {

  private static final Path XML = Paths.get("src", "test", "resources", "xml");

  private static final Path JSON = Paths.get("src", "test", "resources", "json");

  private static final ConversionOptions COMPACT = ConversionOptions.builder().compact(true).header(false).build();

  @Test
  public void testCompactWithAttributes() {
    final JsonObject value = XmlJson.xml2json("<root attr=\"1\"><child>hi</child></root>", COMPACT);

    assertEquals("{\"root\":{\"_attributes\":{\"attr\":\"1\"},\"child\":{\"_text\":\"hi\"}}}",
                 XmlJson.toJson(value, false));
  }

  @Test
  public void testCompactRepeatedChildren() {
    final JsonObject value = XmlJson.xml2json("<root><a>x</a><a>y</a></root>", COMPACT);

    assertEquals("{\"root\":{\"a\":[{\"_text\":\"x\"},{\"_text\":\"y\"}]}}", XmlJson.toJson(value, false));
  }

  @Test
  public void testVerboseEmptyRootWithHeader() {
    final JsonObject value = XmlJson.xml2json("<root/>");

    assertEquals("{\"declaration\":{\"attributes\":{\"version\":\"1.0\",\"encoding\":\"ISO-8859-1\"}},"
                     + "\"elements\":[{\"type\":\"element\",\"name\":\"root\"}]}", XmlJson.toJson(value, false));
  }

  @Test
  public void testDeclarationIsNotReadFromDocument() {
    final JsonObject value = XmlJson.xml2json("<?xml version=\"1.1\" encoding=\"UTF-8\"?><root/>");

    assertEquals("{\"attributes\":{\"version\":\"1.0\",\"encoding\":\"ISO-8859-1\"}}",
                 XmlJson.toJson(value.get("declaration"), false));
  }

  @Test
  public void testCatalogCompact() throws IOException, JSONException {
    final JsonObject value = XmlJson.xml2json(XML.resolve("catalog.xml"), ConversionOptions.builder().compact(true).build());

    final String expected = Files.readString(JSON.resolve("catalog-compact.json"), StandardCharsets.UTF_8);
    JSONAssert.assertEquals(expected, XmlJson.toJson(value, true), true);
  }

  @Test
  public void testCatalogVerbose() throws IOException, JSONException {
    final JsonObject value = XmlJson.xml2json(XML.resolve("catalog.xml"));

    final String expected = Files.readString(JSON.resolve("catalog-verbose.json"), StandardCharsets.UTF_8);
    JSONAssert.assertEquals(expected, XmlJson.toJson(value, false), true);
  }

  @Test
  public void testRemoveBlankText() {
    assertEquals("{\"elements\":[{\"type\":\"element\",\"name\":\"a\"}]}",
                 XmlJson.toJson(XmlJson.xml2json("<a>  </a>", ConversionOptions.builder().header(false).build()), false));

    final JsonObject kept =
        XmlJson.xml2json("<a>  </a>", ConversionOptions.builder().header(false).removeBlankText(false).build());
    assertEquals("{\"elements\":[{\"type\":\"element\",\"name\":\"a\",\"elements\":[{\"type\":\"text\",\"text\":\"\"}]}]}",
                 XmlJson.toJson(kept, false));
  }

  @Test
  public void testStripCdata() {
    final ConversionOptions strip = ConversionOptions.builder().header(false).stripCdata(true).build();

    assertEquals("{\"a\":{\"_text\":\"x\"}}",
                 XmlJson.toJson(XmlJson.xml2json("<a><![CDATA[x]]></a>", strip.toBuilder().compact(true).build()), false));
    assertEquals("{\"elements\":[{\"type\":\"element\",\"name\":\"a\",\"elements\":[{\"type\":\"text\",\"text\":\"x\"}]}]}",
                 XmlJson.toJson(XmlJson.xml2json("<a><![CDATA[x]]></a>", strip), false));
  }

  @Test
  public void testCdataIsKeptByDefault() {
    assertEquals("{\"a\":{\"_cdata\":\"<x>\"}}", XmlJson.toJson(XmlJson.xml2json("<a><![CDATA[<x>]]></a>", COMPACT), false));
  }

  @Test
  public void testAdjacentCdataSections() {
    final String xml = "<a><![CDATA[x]]><![CDATA[y]]></a>";

    assertEquals("{\"a\":{\"_cdata\":[\"x\",\"y\"]}}", XmlJson.toJson(XmlJson.xml2json(xml, COMPACT), false));
    assertEquals("{\"elements\":[{\"type\":\"element\",\"name\":\"a\",\"elements\":["
                     + "{\"type\":\"cdata\",\"cdata\":\"x\"},{\"type\":\"cdata\",\"cdata\":\"y\"}]}]}",
                 XmlJson.toJson(XmlJson.xml2json(xml, ConversionOptions.builder().header(false).build()), false));
  }

  @Test
  public void testCdataIsClassifiedStructurally() {
    // The parent's text equals the CDATA content of its child, but is plain text.
    final JsonObject value = XmlJson.xml2json("<a>x<b><![CDATA[x]]></b></a>", COMPACT);

    assertEquals("{\"a\":{\"_text\":\"x\",\"b\":{\"_cdata\":\"x\"}}}", XmlJson.toJson(value, false));
  }

  @Test
  public void testRemoveCommentsAndPis() {
    final String xml = "<a><!--c--><?p d?><b/></a>";

    final JsonObject kept = XmlJson.xml2json(xml, COMPACT);
    assertEquals("{\"a\":{\"_comment\":\"c\",\"_instruction\":{\"name\":\"d\"},\"b\":{}}}", XmlJson.toJson(kept, false));

    final JsonObject removed =
        XmlJson.xml2json(xml, COMPACT.toBuilder().removeComments(true).removePis(true).build());
    assertEquals("{\"a\":{\"b\":{}}}", XmlJson.toJson(removed, false));
  }

  @Test
  public void testNoOptionalKeysWhenEmpty() {
    final JsonObject verbose = XmlJson.xml2json("<a><b/></a>", ConversionOptions.builder().header(false).build());
    final JsonObject b = verbose.getAsJsonArray("elements").get(0).getAsJsonObject()
                                .getAsJsonArray("elements").get(0).getAsJsonObject();
    assertFalse(b.has("attributes"));
    assertFalse(b.has("elements"));

    final JsonObject compact = XmlJson.xml2json("<a><b/></a>", COMPACT);
    assertTrue(compact.getAsJsonObject("a").getAsJsonObject("b").entrySet().isEmpty());
    assertFalse(compact.getAsJsonObject("a").has("_attributes"));
  }

  @Test
  public void testBytesInput() {
    final byte[] xml = "<a>b</a>".getBytes(StandardCharsets.UTF_8);

    assertEquals("{\"a\":{\"_text\":\"b\"}}", XmlJson.toJson(XmlJson.xml2json(xml, COMPACT), false));
  }

  @Test
  public void testInvalidInputType() {
    assertThrows(IllegalArgumentException.class, () -> XmlJson.xml2json(3.14));
    assertThrows(NullPointerException.class, () -> XmlJson.xml2json(null));
  }

  @Test
  public void testMalformedInput() {
    assertThrows(XmlParseException.class, () -> XmlJson.xml2json("<a><b></a>"));
  }

  @Test
  public void testCustomParser() {
    final XmlTreeParser parser = (source, options) -> ElementNode.builder("fixed").text("value").build();

    final JsonObject value = new XmlJson(parser).xmlToStructuredValue("<ignored/>", COMPACT);

    assertEquals("{\"fixed\":{\"_text\":\"value\"}}", XmlJson.toJson(value, false));
  }

  @Test
  public void testToJsonDoesNotEscapeHtml() {
    assertEquals("{\"a\":{\"_text\":\"<&>\"}}", XmlJson.toJson(XmlJson.xml2json("<a>&lt;&amp;&gt;</a>", COMPACT), false));
  }
}
