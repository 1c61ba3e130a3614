package io.xmljson.parse;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.xmljson.exception.XmlParseException;
import io.xmljson.node.CommentNode;
import io.xmljson.node.ElementNode;
import io.xmljson.node.PINode;
import io.xmljson.node.TextNode;
import io.xmljson.node.XmlNodeKind;
import io.xmljson.settings.ConversionOptions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class StaxXmlTreeParserTest {

  private static final Path XML = Paths.get("src", "test", "resources", "xml");

  private final StaxXmlTreeParser parser = new StaxXmlTreeParser();

  private ElementNode parse(final String xml) {
    return parser.parse(XmlSource.of(xml), ConversionOptions.defaults());
  }

  @Test
  public void testCDataRunsAreSeparated() {
    final ElementNode root = parse("<a>x<![CDATA[y]]>z</a>");

    assertEquals(ImmutableList.of(TextNode.text("x"), TextNode.cdata("y"), TextNode.text("z")), root.getTextRuns());
  }

  @Test
  public void testAdjacentCDataSectionsAreSeparateRuns() {
    final ElementNode root = parse("<a><![CDATA[x]]><![CDATA[y]]>z</a>");

    assertEquals(ImmutableList.of(TextNode.cdata("x"), TextNode.cdata("y"), TextNode.text("z")), root.getTextRuns());
  }

  @Test
  public void testStripCdataMergesAdjacentSections() {
    final ElementNode root = parser.parse(XmlSource.of("<a><![CDATA[x]]><![CDATA[y]]></a>"),
                                          ConversionOptions.builder().stripCdata(true).build());

    assertEquals(ImmutableList.of(TextNode.text("xy")), root.getTextRuns());
  }

  @Test
  public void testStripCdataMergesRuns() {
    final ElementNode root = parser.parse(XmlSource.of("<a>x<![CDATA[y]]>z</a>"),
                                          ConversionOptions.builder().stripCdata(true).build());

    assertEquals(ImmutableList.of(TextNode.text("xyz")), root.getTextRuns());
  }

  @Test
  public void testEntitiesAreReplaced() {
    final ElementNode root = parse("<a>1 &lt; 2 &amp;&amp; &#x41;</a>");

    assertEquals(ImmutableList.of(TextNode.text("1 < 2 && A")), root.getTextRuns());
  }

  @Test
  public void testCommentsAndInstructions() {
    final ElementNode root = parse("<a>x<!--c-->y<?t d?></a>");

    assertEquals(ImmutableList.of(TextNode.text("x"), new CommentNode("c"), TextNode.text("y"), new PINode("t", "d")),
                 root.getContent());
    assertEquals(ImmutableList.of(new CommentNode("c"), new PINode("t", "d")), root.getChildren());
  }

  @Test
  public void testRemovedCommentsDoNotSplitText() {
    final ElementNode root = parser.parse(XmlSource.of("<a>x<!--c-->y<?t d?>z</a>"),
                                          ConversionOptions.builder().removeComments(true).removePis(true).build());

    assertEquals(ImmutableList.of(TextNode.text("xyz")), root.getContent());
  }

  @Test
  public void testNodesOutsideOfRootAreIgnored() {
    final ElementNode root = parse("<?xml version=\"1.0\"?>\n<!-- before -->\n<?pi before?>\n<a/>\n<!-- after -->\n");

    assertEquals("a", root.getName());
    assertTrue(root.getContent().isEmpty());
  }

  @Test
  public void testNamesAndNamespaces() {
    final ElementNode root = parse("<p:a xmlns:p=\"urn:p\" xmlns=\"urn:d\" p:x=\"1\" y=\"2\"><p:b/></p:a>");

    assertEquals("p:a", root.getName());
    assertEquals(ImmutableMap.of("xmlns:p", "urn:p", "xmlns", "urn:d", "p:x", "1", "y", "2"), root.getAttributes());
    assertEquals("p:b", ((ElementNode) root.getChildren().get(0)).getName());
  }

  @Test
  public void testNestedStructure() {
    final ElementNode root = parser.parse(XmlSource.of(XML.resolve("library.xml")), ConversionOptions.defaults());

    assertEquals("library", root.getName());
    assertEquals(3, root.getChildren().size());
    final ElementNode shelf = (ElementNode) root.getChildren().get(0);
    assertEquals(ImmutableMap.of("floor", "1"), shelf.getAttributes());
    final ElementNode book = (ElementNode) shelf.getChildren().get(1);
    final ElementNode title = (ElementNode) book.getChildren().get(0);
    assertEquals(XmlNodeKind.CDATA, title.getTextRuns().get(0).getKind());
    assertEquals("Two & <more>", title.getTextRuns().get(0).getValue());
  }

  @Test
  public void testDeclaredEncodingOfBytes() {
    final byte[] xml = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><a>été</a>".getBytes(StandardCharsets.ISO_8859_1);
    final ElementNode root = parser.parse(XmlSource.of(xml), ConversionOptions.defaults());

    assertEquals("été", root.getTextRuns().get(0).getValue());
  }

  @Test
  public void testDeepNesting() {
    final int depth = 10_000;
    final StringBuilder xml = new StringBuilder();
    xml.append("<e>".repeat(depth)).append("deep").append("</e>".repeat(depth));

    ElementNode node = parse(xml.toString());
    int level = 1;
    while (node.hasChildren()) {
      node = (ElementNode) node.getChildren().get(0);
      level++;
    }
    assertEquals(depth, level);
    assertEquals("deep", node.getTextRuns().get(0).getValue());
  }

  @Test
  public void testMalformed() {
    final XmlParseException e = assertThrows(XmlParseException.class, () -> parse("<a><b></a>"));

    assertEquals(1, e.getLineNumber());
    assertTrue(e.getColumnNumber() > 0);
  }

  @Test
  public void testNoRootElement() {
    assertThrows(XmlParseException.class, () -> parse(""));
    assertThrows(XmlParseException.class, () -> parse("<?xml version=\"1.0\"?>"));
  }

  @Test
  public void testTextInProlog() {
    assertThrows(XmlParseException.class, () -> parse("text<a/>"));
  }
}
