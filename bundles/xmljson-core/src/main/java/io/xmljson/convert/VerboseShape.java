/*
 * Copyright (c) 2023, Sirix Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.xmljson.convert;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.xmljson.node.CommentNode;
import io.xmljson.node.ElementNode;
import io.xmljson.node.PINode;
import io.xmljson.node.TextNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import static io.xmljson.settings.Constants.ATTRIBUTES;
import static io.xmljson.settings.Constants.CDATA;
import static io.xmljson.settings.Constants.COMMENT;
import static io.xmljson.settings.Constants.DECLARATION;
import static io.xmljson.settings.Constants.DECLARATION_ENCODING;
import static io.xmljson.settings.Constants.DECLARATION_VERSION;
import static io.xmljson.settings.Constants.ELEMENTS;
import static io.xmljson.settings.Constants.ENCODING;
import static io.xmljson.settings.Constants.INSTRUCTION;
import static io.xmljson.settings.Constants.NAME;
import static io.xmljson.settings.Constants.TEXT;
import static io.xmljson.settings.Constants.TYPE;
import static io.xmljson.settings.Constants.TYPE_CDATA;
import static io.xmljson.settings.Constants.TYPE_COMMENT;
import static io.xmljson.settings.Constants.TYPE_ELEMENT;
import static io.xmljson.settings.Constants.TYPE_INSTRUCTION;
import static io.xmljson.settings.Constants.TYPE_TEXT;
import static io.xmljson.settings.Constants.VERSION;

/**
 * Verbose shape: every node is a record with an explicit {@code type}, elements list their content
 * under {@code elements}.
 *
 * <pre>
 * {"declaration": {"attributes": {"version": "1.0", "encoding": "ISO-8859-1"}},
 *  "elements": [{"type": "element", "name": "a", "elements": [{"type": "text", "text": "x"}]}]}
 * </pre>
 */
final class VerboseShape implements NodeShape {

  static final VerboseShape INSTANCE = new VerboseShape();

  private VerboseShape() {
  }

  @Override
  public JsonObject document(final boolean header) {
    final JsonObject output = new JsonObject();
    if (header) {
      final JsonObject attributes = new JsonObject();
      attributes.addProperty(VERSION, DECLARATION_VERSION);
      attributes.addProperty(ENCODING, DECLARATION_ENCODING);
      final JsonObject declaration = new JsonObject();
      declaration.add(ATTRIBUTES, attributes);
      output.add(DECLARATION, declaration);
    }
    return output;
  }

  @Override
  public @Nullable JsonArray text(final TextRuns runs) {
    if (runs.isEmpty()) {
      return null;
    }
    final JsonArray records = new JsonArray(runs.getRuns().size());
    for (final TextNode run : runs.getRuns()) {
      final JsonObject record = new JsonObject();
      if (run.isCData()) {
        record.addProperty(TYPE, TYPE_CDATA);
        record.addProperty(CDATA, run.getValue());
      } else {
        record.addProperty(TYPE, TYPE_TEXT);
        record.addProperty(TEXT, run.getValue());
      }
      records.add(record);
    }
    return records;
  }

  @Override
  public JsonObject leafElement(final ElementNode element, final TextRuns runs) {
    final JsonObject record = elementRecord(element);
    final JsonArray text = text(runs);
    if (text != null) {
      record.add(ELEMENTS, text);
    }
    return record;
  }

  @Override
  public JsonObject comment(final CommentNode comment) {
    final JsonObject record = new JsonObject();
    record.addProperty(TYPE, TYPE_COMMENT);
    record.addProperty(COMMENT, comment.getText());
    return record;
  }

  @Override
  public JsonObject instruction(final PINode instruction) {
    final JsonObject record = new JsonObject();
    record.addProperty(TYPE, TYPE_INSTRUCTION);
    record.addProperty(NAME, instruction.getTarget());
    record.addProperty(INSTRUCTION, instruction.getInstruction());
    JsonValues.addIfNotEmpty(record, ATTRIBUTES, instruction.getAttributes());
    return record;
  }

  @Override
  public void addLeaf(final JsonObject output, final JsonObject leaf) {
    final JsonArray elements = new JsonArray(1);
    elements.add(leaf);
    output.add(ELEMENTS, elements);
  }

  @Override
  public JsonObject container(final JsonObject output, final ElementNode element, final TextRuns runs) {
    final JsonObject record = elementRecord(element);
    final JsonArray content = new JsonArray();
    final JsonArray text = text(runs);
    if (text != null) {
      content.addAll(text);
    }
    record.add(ELEMENTS, content);
    addLeaf(output, record);
    return record;
  }

  /**
   * The records of the child are appended to the parent's {@code elements}, the envelope of the
   * child's conversion is dropped.
   */
  @Override
  public void mergeChild(final JsonObject container, final JsonObject child) {
    container.getAsJsonArray(ELEMENTS).addAll(child.getAsJsonArray(ELEMENTS));
  }

  private static JsonObject elementRecord(final ElementNode element) {
    final JsonObject record = new JsonObject();
    record.addProperty(TYPE, TYPE_ELEMENT);
    record.addProperty(NAME, element.getName());
    JsonValues.addIfNotEmpty(record, ATTRIBUTES, element.getAttributes());
    return record;
  }
}
