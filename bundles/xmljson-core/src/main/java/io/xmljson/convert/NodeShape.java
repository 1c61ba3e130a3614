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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.xmljson.node.CommentNode;
import io.xmljson.node.ElementNode;
import io.xmljson.node.PINode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds the JSON shape of converted nodes. Optional fields are only added when they have content,
 * so no empty {@code attributes}, {@code elements}, {@code _attributes}, {@code _text} or
 * {@code _cdata} is ever emitted.
 */
public interface NodeShape {

  /**
   * Get the shape.
   *
   * @param compact {@code true} for the compact, {@code false} for the verbose shape
   * @return the shape
   */
  static NodeShape of(final boolean compact) {
    return compact ? CompactShape.INSTANCE : VerboseShape.INSTANCE;
  }

  /**
   * Create the output object of a converted node, starting with the declaration envelope if
   * requested.
   *
   * @param header {@code true}, if the declaration envelope is emitted
   * @return the new output object
   */
  JsonObject document(boolean header);

  /**
   * Shape the direct text runs of an element.
   *
   * @param runs the text runs
   * @return the shaped text, {@code null} if there are no runs
   */
  @Nullable JsonElement text(TextRuns runs);

  /**
   * Shape an element without children.
   *
   * @param element the element
   * @param runs its direct text runs
   * @return the element
   */
  JsonObject leafElement(ElementNode element, TextRuns runs);

  /**
   * Shape a comment.
   *
   * @param comment the comment
   * @return the comment
   */
  JsonObject comment(CommentNode comment);

  /**
   * Shape a processing instruction.
   *
   * @param instruction the processing instruction
   * @return the processing instruction
   */
  JsonObject instruction(PINode instruction);

  /**
   * Place a classified leaf into the output object of its conversion.
   *
   * @param output the output object created by {@link #document(boolean)}
   * @param leaf the shaped leaf
   */
  void addLeaf(JsonObject output, JsonObject leaf);

  /**
   * Place the container of an element with children into the output object of its conversion.
   *
   * @param output the output object created by {@link #document(boolean)}
   * @param element the element
   * @param runs its direct text runs
   * @return the container the converted children are merged into
   */
  JsonObject container(JsonObject output, ElementNode element, TextRuns runs);

  /**
   * Merge the conversion result of a child into the container of its parent.
   *
   * @param container the container of the parent
   * @param child the conversion result of the child, without declaration envelope
   */
  void mergeChild(JsonObject container, JsonObject child);
}
