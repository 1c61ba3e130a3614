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
import io.xmljson.exception.UnsupportedNodeKindException;
import io.xmljson.node.ElementNode;
import io.xmljson.node.XmlNode;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Converts a node tree top-down. Nodes without children are handed to the {@link LeafClassifier},
 * elements with children become containers into which the converted children are merged in
 * document order.
 *
 * <p>
 * Verbose shape: the output is {@code {declaration?, elements: [record]}}, the records of the
 * children are appended to the {@code elements} of the parent record after its own text.
 * </p>
 *
 * <p>
 * Compact shape: the output is {@code {_declaration?, name: {...}}}, children are keyed by their
 * name and repeated names are folded into arrays.
 * </p>
 *
 * <p>
 * Instances are stateless and may be shared between threads. The recursion depth equals the
 * element nesting depth.
 * </p>
 */
public final class TreeConverter {

  /** Extracts the direct text of containers. */
  private final TextExtractor textExtractor;

  /** Converts nodes without children. */
  private final LeafClassifier leafClassifier;

  /**
   * Constructor.
   */
  public TreeConverter() {
    this(new TextExtractor());
  }

  private TreeConverter(final TextExtractor textExtractor) {
    this(textExtractor, new LeafClassifier(textExtractor));
  }

  /**
   * Constructor.
   *
   * @param textExtractor extracts the direct text of containers
   * @param leafClassifier converts nodes without children
   */
  public TreeConverter(final TextExtractor textExtractor, final LeafClassifier leafClassifier) {
    this.textExtractor = checkNotNull(textExtractor);
    this.leafClassifier = checkNotNull(leafClassifier);
  }

  /**
   * Convert a node and its subtree.
   *
   * @param node the node to convert
   * @param stripCdata {@code true}, if CDATA runs are classified as plain text
   * @param header {@code true}, if the declaration envelope is emitted (document root only)
   * @param compact {@code true} for the compact, {@code false} for the verbose shape
   * @param removeBlank {@code true}, if whitespace-only text is dropped
   * @return the converted node
   */
  public JsonObject convert(final XmlNode node, final boolean stripCdata, final boolean header, final boolean compact,
      final boolean removeBlank) {
    checkNotNull(node);
    final NodeShape shape = NodeShape.of(compact);
    final JsonObject output = shape.document(header);

    if (!node.hasChildren()) {
      shape.addLeaf(output, leafClassifier.classifyLeaf(node, stripCdata, compact, removeBlank));
      return output;
    }

    if (!(node instanceof ElementNode element)) {
      throw new UnsupportedNodeKindException(node.getKind());
    }

    final JsonObject container =
        shape.container(output, element, textExtractor.extract(element, stripCdata, removeBlank));
    for (final XmlNode child : element.getChildren()) {
      shape.mergeChild(container, convert(child, stripCdata, false, compact, removeBlank));
    }
    return output;
  }
}
