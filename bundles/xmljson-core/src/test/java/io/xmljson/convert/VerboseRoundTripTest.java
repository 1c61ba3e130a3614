package io.xmljson.convert;

import com.google.gson.JsonObject;
import io.xmljson.node.ElementNode;
import io.xmljson.parse.StaxXmlTreeParser;
import io.xmljson.parse.XmlSource;
import io.xmljson.settings.ConversionOptions;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Writes verbose conversions back to XML and checks that the rebuilt document converts to the same
 * value, that is the documents are isomorphic up to whitespace trimming.
 */
public final class VerboseRoundTripTest {

  private static final Path XML = Paths.get("src", "test", "resources", "xml");

  private final StaxXmlTreeParser parser = new StaxXmlTreeParser();

  private final TreeConverter converter = new TreeConverter();

  private JsonObject convert(final XmlSource source) {
    final ElementNode root = parser.parse(source, ConversionOptions.defaults());
    return converter.convert(root, false, false, false, true);
  }

  @ParameterizedTest
  @ValueSource(strings = { "library.xml", "catalog.xml" })
  public void testDocumentRoundTrip(final String file) {
    final JsonObject converted = convert(XmlSource.of(XML.resolve(file)));
    final String rebuilt = VerboseXmlWriter.write(converted);

    assertEquals(converted, convert(XmlSource.of(rebuilt)));
  }

  @ParameterizedTest
  @ValueSource(strings = { "<a/>", "<a x=\"1\" y=\"&quot;2&quot;\"/>", "<a><b>1</b><b>2</b><c><d>&lt;&amp;</d></c></a>",
      "<a><![CDATA[<raw>]]></a>", "<p:a xmlns:p=\"urn:p\"><p:b p:c=\"v\">t</p:b></p:a>" })
  public void testFragmentRoundTrip(final String xml) {
    final JsonObject converted = convert(XmlSource.of(xml));

    assertEquals(converted, convert(XmlSource.of(VerboseXmlWriter.write(converted))));
  }
}
