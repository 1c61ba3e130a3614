package io.xmljson.convert;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Map;

/**
 * Writes the verbose shape back to XML text. Only used to check that conversions round-trip.
 */
final class VerboseXmlWriter {

  private VerboseXmlWriter() {
  }

  static String write(final JsonObject document) {
    final StringBuilder xml = new StringBuilder();
    for (final JsonElement record : document.getAsJsonArray("elements")) {
      writeRecord(record.getAsJsonObject(), xml);
    }
    return xml.toString();
  }

  private static void writeRecord(final JsonObject record, final StringBuilder xml) {
    switch (record.get("type").getAsString()) {
      case "element" -> {
        final String name = record.get("name").getAsString();
        xml.append('<').append(name);
        writeAttributes(record, xml);
        if (!record.has("elements")) {
          xml.append("/>");
          return;
        }
        xml.append('>');
        for (final JsonElement child : record.getAsJsonArray("elements")) {
          writeRecord(child.getAsJsonObject(), xml);
        }
        xml.append("</").append(name).append('>');
      }
      case "text" -> xml.append(escape(record.get("text").getAsString()));
      case "cdata" -> xml.append("<![CDATA[").append(record.get("cdata").getAsString()).append("]]>");
      case "comment" -> xml.append("<!--").append(record.get("comment").getAsString()).append("-->");
      case "instruction" -> {
        xml.append("<?").append(record.get("name").getAsString());
        writeAttributes(record, xml);
        xml.append(' ').append(record.get("instruction").getAsString()).append("?>");
      }
      default -> throw new IllegalStateException("Unknown record type: " + record.get("type"));
    }
  }

  private static void writeAttributes(final JsonObject record, final StringBuilder xml) {
    if (record.has("attributes")) {
      for (final Map.Entry<String, JsonElement> attribute : record.getAsJsonObject("attributes").entrySet()) {
        xml.append(' ').append(attribute.getKey()).append("=\"").append(escape(attribute.getValue().getAsString()))
           .append('"');
      }
    }
  }

  private static String escape(final String value) {
    return value.replace("&", "&amp;").replace("<", "&lt;").replace("\"", "&quot;");
  }
}
