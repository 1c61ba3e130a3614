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

import com.google.gson.JsonObject;
import io.xmljson.exception.NodeLevelException;
import io.xmljson.exception.UnsupportedNodeKindException;
import io.xmljson.node.CommentNode;
import io.xmljson.node.ElementNode;
import io.xmljson.node.PINode;
import io.xmljson.node.XmlNode;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Converts nodes at the lowest level of the tree: processing instructions, comments and elements
 * without children.
 */
public final class LeafClassifier {

  /** Extracts the text of leaf elements. */
  private final TextExtractor textExtractor;

  /**
   * Constructor.
   *
   * @param textExtractor extracts the text of leaf elements
   */
  public LeafClassifier(final TextExtractor textExtractor) {
    this.textExtractor = checkNotNull(textExtractor);
  }

  /**
   * Convert a node without children.
   *
   * @param node the node
   * @param stripCdata {@code true}, if CDATA runs are classified as plain text
   * @param compact {@code true} for the compact, {@code false} for the verbose shape
   * @param removeBlank {@code true}, if whitespace-only text is dropped
   * @return the shaped node
   * @throws NodeLevelException if the node has children
   * @throws UnsupportedNodeKindException if the node is neither element, comment nor processing
   *         instruction
   */
  public JsonObject classifyLeaf(final XmlNode node, final boolean stripCdata, final boolean compact,
      final boolean removeBlank) {
    checkNotNull(node);
    if (node.hasChildren()) {
      throw new NodeLevelException("The element is not at the lowest level.");
    }

    final NodeShape shape = NodeShape.of(compact);
    if (node instanceof PINode instruction) {
      return shape.instruction(instruction);
    } else if (node instanceof CommentNode comment) {
      return shape.comment(comment);
    } else if (node instanceof ElementNode element) {
      return shape.leafElement(element, textExtractor.extract(element, stripCdata, removeBlank));
    }
    throw new UnsupportedNodeKindException(node.getKind());
  }
}
