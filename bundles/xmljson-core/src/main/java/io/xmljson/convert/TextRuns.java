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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.xmljson.node.TextNode;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The trimmed and classified direct text runs of an element, in document order.
 */
public final class TextRuns {

  /** No runs at all. */
  static final TextRuns EMPTY = new TextRuns(ImmutableList.of());

  private final ImmutableList<TextNode> runs;

  TextRuns(final ImmutableList<TextNode> runs) {
    this.runs = checkNotNull(runs);
  }

  public ImmutableList<TextNode> getRuns() {
    return runs;
  }

  public boolean isEmpty() {
    return runs.isEmpty();
  }

  /**
   * Get the values of the CDATA runs.
   *
   * @return the CDATA values in document order
   */
  public ImmutableList<String> cdataValues() {
    return values(true);
  }

  /**
   * Get the values of the plain text runs.
   *
   * @return the text values in document order
   */
  public ImmutableList<String> textValues() {
    return values(false);
  }

  private ImmutableList<String> values(final boolean cdata) {
    final ImmutableList.Builder<String> values = ImmutableList.builder();
    for (final TextNode run : runs) {
      if (run.isCData() == cdata) {
        values.add(run.getValue());
      }
    }
    return values.build();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("runs", runs).toString();
  }
}
