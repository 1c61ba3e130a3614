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
import com.google.gson.JsonElement;
import io.xmljson.node.ElementNode;
import io.xmljson.node.TextNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Extracts the direct text of an element, that is the text runs which are children of the element
 * itself and not of nested elements.
 */
public final class TextExtractor {

  /**
   * Extract and classify the direct text runs. Each run is stripped of leading and trailing
   * whitespace.
   *
   * @param element the element
   * @param stripCdata {@code true}, if CDATA runs are classified as plain text
   * @param removeBlank {@code true}, if runs which are empty after stripping are dropped
   * @return the runs, possibly empty
   * @throws NullPointerException if {@code element} is {@code null}
   */
  public TextRuns extract(final ElementNode element, final boolean stripCdata, final boolean removeBlank) {
    checkNotNull(element);
    final ImmutableList<TextNode> textRuns = element.getTextRuns();
    if (textRuns.isEmpty()) {
      return TextRuns.EMPTY;
    }

    final ImmutableList.Builder<TextNode> runs = ImmutableList.builder();
    for (final TextNode run : textRuns) {
      final String value = run.getValue().strip();
      if (removeBlank && value.isEmpty()) {
        continue;
      }
      runs.add(run.isCData() && !stripCdata ? TextNode.cdata(value) : TextNode.text(value));
    }
    return new TextRuns(runs.build());
  }

  /**
   * Extract the direct text runs and shape them.
   *
   * @param element the element
   * @param stripCdata {@code true}, if CDATA runs are classified as plain text
   * @param compact {@code true} for an object with {@code _cdata} and {@code _text}, {@code false}
   *        for an array of text and CDATA records
   * @param removeBlank {@code true}, if runs which are empty after stripping are dropped
   * @return the shaped text or {@code null}, if no run remains
   * @throws NullPointerException if {@code element} is {@code null}
   */
  public @Nullable JsonElement extractText(final ElementNode element, final boolean stripCdata,
      final boolean compact, final boolean removeBlank) {
    return NodeShape.of(compact).text(extract(element, stripCdata, removeBlank));
  }
}
