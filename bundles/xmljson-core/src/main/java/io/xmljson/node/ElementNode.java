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

package io.xmljson.node;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Element node. Keeps its content in document order and offers two views on it: the child nodes
 * (elements, comments, processing instructions) and the direct text runs.
 */
public final class ElementNode implements XmlNode {

  /** Qualified name as written in the document. */
  private final String name;

  /** Attributes in source order. */
  private final ImmutableMap<String, String> attributes;

  /** All content in document order. */
  private final ImmutableList<XmlNode> content;

  /** Content without text runs. */
  private final ImmutableList<XmlNode> children;

  /** Direct text runs. */
  private final ImmutableList<TextNode> textRuns;

  private ElementNode(final Builder builder) {
    name = builder.name;
    attributes = ImmutableMap.copyOf(builder.attributes);
    content = builder.content.build();

    final ImmutableList.Builder<XmlNode> childrenBuilder = ImmutableList.builder();
    final ImmutableList.Builder<TextNode> textRunsBuilder = ImmutableList.builder();
    for (final XmlNode node : content) {
      if (node.getKind().isCharacterData()) {
        textRunsBuilder.add((TextNode) node);
      } else {
        childrenBuilder.add(node);
      }
    }
    children = childrenBuilder.build();
    textRuns = textRunsBuilder.build();
  }

  /**
   * Create a builder for an element.
   *
   * @param name the qualified element name
   * @return a new builder
   */
  public static Builder builder(final String name) {
    return new Builder(name);
  }

  @Override
  public XmlNodeKind getKind() {
    return XmlNodeKind.ELEMENT;
  }

  public String getName() {
    return name;
  }

  public ImmutableMap<String, String> getAttributes() {
    return attributes;
  }

  public ImmutableList<XmlNode> getContent() {
    return content;
  }

  @Override
  public ImmutableList<XmlNode> getChildren() {
    return children;
  }

  public ImmutableList<TextNode> getTextRuns() {
    return textRuns;
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ElementNode)) {
      return false;
    }
    final ElementNode otherNode = (ElementNode) other;
    return name.equals(otherNode.name) && attributes.equals(otherNode.attributes)
        && content.equals(otherNode.content);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, attributes, content);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("name", name)
                      .add("attributes", attributes)
                      .add("content", content)
                      .toString();
  }

  /**
   * Builder to build an {@link ElementNode} instance.
   */
  public static final class Builder {

    /** Qualified name. */
    private final String name;

    /** Attributes in insertion order. */
    private final Map<String, String> attributes = new LinkedHashMap<>();

    /** Content in document order. */
    private final ImmutableList.Builder<XmlNode> content = ImmutableList.builder();

    private Builder(final String name) {
      this.name = checkNotNull(name);
      checkArgument(!name.isEmpty(), "The element name must not be empty.");
    }

    /**
     * Add an attribute. A repeated name replaces the value but keeps the first position.
     *
     * @param attributeName qualified attribute name
     * @param value attribute value
     * @return this builder instance
     */
    public Builder attribute(final String attributeName, final String value) {
      attributes.put(checkNotNull(attributeName), checkNotNull(value));
      return this;
    }

    /**
     * Append a node to the content.
     *
     * @param node the node to append
     * @return this builder instance
     */
    public Builder add(final XmlNode node) {
      content.add(checkNotNull(node));
      return this;
    }

    /**
     * Append a plain text run.
     *
     * @param text the text
     * @return this builder instance
     */
    public Builder text(final String text) {
      return add(TextNode.text(text));
    }

    /**
     * Append a CDATA run.
     *
     * @param text the text
     * @return this builder instance
     */
    public Builder cdata(final String text) {
      return add(TextNode.cdata(text));
    }

    /**
     * Build an instance.
     *
     * @return {@link ElementNode} instance
     */
    public ElementNode build() {
      return new ElementNode(this);
    }
  }
}
