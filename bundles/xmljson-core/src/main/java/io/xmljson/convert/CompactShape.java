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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.xmljson.node.CommentNode;
import io.xmljson.node.ElementNode;
import io.xmljson.node.PINode;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

import static io.xmljson.settings.Constants.COMPACT_ATTRIBUTES;
import static io.xmljson.settings.Constants.COMPACT_CDATA;
import static io.xmljson.settings.Constants.COMPACT_COMMENT;
import static io.xmljson.settings.Constants.COMPACT_DECLARATION;
import static io.xmljson.settings.Constants.COMPACT_INSTRUCTION;
import static io.xmljson.settings.Constants.COMPACT_TEXT;
import static io.xmljson.settings.Constants.DECLARATION_ENCODING;
import static io.xmljson.settings.Constants.DECLARATION_VERSION;
import static io.xmljson.settings.Constants.ENCODING;
import static io.xmljson.settings.Constants.NAME;
import static io.xmljson.settings.Constants.VERSION;

/**
 * Compact shape: elements are keyed by their name, metadata uses {@code _}-prefixed keys and
 * same-named siblings are folded into an array.
 *
 * <pre>
 * {"_declaration": {"_attributes": {"version": "1.0", "encoding": "ISO-8859-1"}},
 *  "a": {"_attributes": {"id": "1"}, "b": [{"_text": "x"}, {"_text": "y"}]}}
 * </pre>
 */
final class CompactShape implements NodeShape {

  static final CompactShape INSTANCE = new CompactShape();

  private CompactShape() {
  }

  @Override
  public JsonObject document(final boolean header) {
    final JsonObject output = new JsonObject();
    if (header) {
      final JsonObject attributes = new JsonObject();
      attributes.addProperty(VERSION, DECLARATION_VERSION);
      attributes.addProperty(ENCODING, DECLARATION_ENCODING);
      final JsonObject declaration = new JsonObject();
      declaration.add(COMPACT_ATTRIBUTES, attributes);
      output.add(COMPACT_DECLARATION, declaration);
    }
    return output;
  }

  @Override
  public @Nullable JsonObject text(final TextRuns runs) {
    if (runs.isEmpty()) {
      return null;
    }
    final JsonObject text = new JsonObject();
    addValues(text, COMPACT_CDATA, runs.cdataValues());
    addValues(text, COMPACT_TEXT, runs.textValues());
    return text;
  }

  @Override
  public JsonObject leafElement(final ElementNode element, final TextRuns runs) {
    final JsonObject output = new JsonObject();
    output.add(element.getName(), content(element, runs));
    return output;
  }

  @Override
  public JsonObject comment(final CommentNode comment) {
    final JsonObject output = new JsonObject();
    output.addProperty(COMPACT_COMMENT, comment.getText());
    return output;
  }

  /**
   * The instruction body is stored under {@code name}, the target is not part of the compact shape.
   * Pseudo-attributes are nested so that the result keeps a single key.
   */
  @Override
  public JsonObject instruction(final PINode instruction) {
    final JsonObject body = new JsonObject();
    body.addProperty(NAME, instruction.getInstruction());
    JsonValues.addIfNotEmpty(body, COMPACT_ATTRIBUTES, instruction.getAttributes());
    final JsonObject output = new JsonObject();
    output.add(COMPACT_INSTRUCTION, body);
    return output;
  }

  @Override
  public void addLeaf(final JsonObject output, final JsonObject leaf) {
    for (final Map.Entry<String, JsonElement> entry : leaf.entrySet()) {
      output.add(entry.getKey(), entry.getValue());
    }
  }

  @Override
  public JsonObject container(final JsonObject output, final ElementNode element, final TextRuns runs) {
    final JsonObject container = content(element, runs);
    output.add(element.getName(), container);
    return container;
  }

  /**
   * A key seen for the first time is inserted, a repeated key turns the existing value into an
   * array (if it is not one already) and appends to it.
   */
  @Override
  public void mergeChild(final JsonObject container, final JsonObject child) {
    final Map.Entry<String, JsonElement> entry = Iterables.getOnlyElement(child.entrySet());
    final String key = entry.getKey();
    final JsonElement existing = container.get(key);

    if (existing == null) {
      container.add(key, entry.getValue());
    } else if (existing.isJsonArray()) {
      existing.getAsJsonArray().add(entry.getValue());
    } else {
      final JsonArray values = new JsonArray();
      values.add(existing);
      values.add(entry.getValue());
      container.add(key, values);
    }
  }

  private JsonObject content(final ElementNode element, final TextRuns runs) {
    final JsonObject content = new JsonObject();
    JsonValues.addIfNotEmpty(content, COMPACT_ATTRIBUTES, element.getAttributes());
    final JsonObject text = text(runs);
    if (text != null) {
      addLeaf(content, text);
    }
    return content;
  }

  private static void addValues(final JsonObject target, final String key, final ImmutableList<String> values) {
    if (!values.isEmpty()) {
      target.add(key, JsonValues.scalarOrArray(values));
    }
  }
}
