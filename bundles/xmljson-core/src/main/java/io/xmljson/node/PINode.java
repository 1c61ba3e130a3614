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

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Processing instruction node, for instance {@code <?xml-stylesheet href="style.css"?>}.
 */
public final class PINode implements XmlNode {

  /** Pseudo-attributes in the instruction data, {@code name="value"} or {@code name='value'}. */
  private static final Pattern PSEUDO_ATTRIBUTE =
      Pattern.compile("([^\\s=\"'<>?]+)\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')");

  /** The target, for instance {@code xml-stylesheet}. */
  private final String target;

  /** The instruction body without the target. */
  private final String data;

  /** Pseudo-attributes found in the body, in source order. */
  private final ImmutableMap<String, String> attributes;

  /** The body without its pseudo-attributes. */
  private final String instruction;

  /**
   * Constructor.
   *
   * @param target the processing instruction target
   * @param data the instruction body, may be empty
   */
  public PINode(final String target, final String data) {
    this.target = checkNotNull(target);
    this.data = checkNotNull(data).strip();
    this.attributes = parsePseudoAttributes(this.data);
    this.instruction = removePseudoAttributes(this.data);
  }

  /**
   * Parse the pseudo-attributes of an instruction body. The first occurrence of a name wins.
   *
   * @param data the instruction body
   * @return the pseudo-attributes in source order, empty if there are none
   */
  static ImmutableMap<String, String> parsePseudoAttributes(final String data) {
    final Map<String, String> pseudoAttributes = new LinkedHashMap<>();
    final Matcher matcher = PSEUDO_ATTRIBUTE.matcher(data);
    while (matcher.find()) {
      final String value = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
      pseudoAttributes.putIfAbsent(matcher.group(1), value);
    }
    return ImmutableMap.copyOf(pseudoAttributes);
  }

  /**
   * Remove the pseudo-attributes from an instruction body.
   *
   * @param data the instruction body
   * @return the remaining tokens separated by single spaces, empty if the body only holds
   *         pseudo-attributes
   */
  static String removePseudoAttributes(final String data) {
    return CharMatcher.whitespace().trimAndCollapseFrom(PSEUDO_ATTRIBUTE.matcher(data).replaceAll(" "), ' ');
  }

  @Override
  public XmlNodeKind getKind() {
    return XmlNodeKind.PROCESSING_INSTRUCTION;
  }

  public String getTarget() {
    return target;
  }

  public String getData() {
    return data;
  }

  public ImmutableMap<String, String> getAttributes() {
    return attributes;
  }

  /**
   * Get the instruction body without the pseudo-attributes, which are reported by
   * {@link #getAttributes()}.
   *
   * @return the remaining body, empty if there is none
   */
  public String getInstruction() {
    return instruction;
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof PINode)) {
      return false;
    }
    final PINode otherNode = (PINode) other;
    return target.equals(otherNode.target) && data.equals(otherNode.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(target, data);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("target", target).add("data", data).toString();
  }
}
