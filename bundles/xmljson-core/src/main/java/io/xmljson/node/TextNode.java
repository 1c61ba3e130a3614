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

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A run of character data which is a direct child of an element. Adjacent character data of the
 * same kind is coalesced into one run by the parser.
 */
public final class TextNode implements XmlNode {

  /** The raw, untrimmed value. */
  private final String value;

  /** Determines if the run stems from CDATA sections. */
  private final boolean cdata;

  private TextNode(final String value, final boolean cdata) {
    this.value = checkNotNull(value);
    this.cdata = cdata;
  }

  /**
   * Create a plain text run.
   *
   * @param value the character data
   * @return the text node
   */
  public static TextNode text(final String value) {
    return new TextNode(value, false);
  }

  /**
   * Create a CDATA run.
   *
   * @param value the character data
   * @return the text node
   */
  public static TextNode cdata(final String value) {
    return new TextNode(value, true);
  }

  @Override
  public XmlNodeKind getKind() {
    return cdata ? XmlNodeKind.CDATA : XmlNodeKind.TEXT;
  }

  public String getValue() {
    return value;
  }

  public boolean isCData() {
    return cdata;
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TextNode)) {
      return false;
    }
    final TextNode otherNode = (TextNode) other;
    return cdata == otherNode.cdata && value.equals(otherNode.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, cdata);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("value", value).add("cdata", cdata).toString();
  }
}
