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

package io.xmljson.settings;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * Immutable set of options steering parsing and conversion.
 *
 * <ul>
 * <li>{@code stripCdata} (default {@code false}): treat CDATA sections as plain text</li>
 * <li>{@code removeComments} (default {@code false}): drop comments while parsing</li>
 * <li>{@code removePis} (default {@code false}): drop processing instructions while parsing</li>
 * <li>{@code header} (default {@code true}): emit the declaration envelope</li>
 * <li>{@code compact} (default {@code false}): emit the compact instead of the verbose shape</li>
 * <li>{@code removeBlankText} (default {@code true}): drop whitespace-only text</li>
 * </ul>
 */
public final class ConversionOptions {

  /** Options with all defaults. */
  private static final ConversionOptions DEFAULTS = new Builder().build();

  private final boolean stripCdata;

  private final boolean removeComments;

  private final boolean removePis;

  private final boolean header;

  private final boolean compact;

  private final boolean removeBlankText;

  /**
   * Builder to build a {@link ConversionOptions} instance.
   */
  public static final class Builder {

    private boolean stripCdata;

    private boolean removeComments;

    private boolean removePis;

    private boolean header = true;

    private boolean compact;

    private boolean removeBlankText = true;

    /**
     * Parse CDATA as pure text or not (default: no).
     *
     * @param strip strip CDATA markers
     * @return this builder instance
     */
    public Builder stripCdata(final boolean strip) {
      stripCdata = strip;
      return this;
    }

    /**
     * Remove comments or not (default: no).
     *
     * @param remove remove comments
     * @return this builder instance
     */
    public Builder removeComments(final boolean remove) {
      removeComments = remove;
      return this;
    }

    /**
     * Remove processing instructions or not (default: no).
     *
     * @param remove remove processing instructions
     * @return this builder instance
     */
    public Builder removePis(final boolean remove) {
      removePis = remove;
      return this;
    }

    /**
     * Emit the declaration envelope or not (default: yes).
     *
     * @param emit emit the header
     * @return this builder instance
     */
    public Builder header(final boolean emit) {
      header = emit;
      return this;
    }

    /**
     * Emit the compact shape (default: verbose).
     *
     * @param compactShape compact instead of verbose
     * @return this builder instance
     */
    public Builder compact(final boolean compactShape) {
      compact = compactShape;
      return this;
    }

    /**
     * Remove whitespace-only text or not (default: yes).
     *
     * @param remove remove blank text
     * @return this builder instance
     */
    public Builder removeBlankText(final boolean remove) {
      removeBlankText = remove;
      return this;
    }

    /**
     * Build an instance.
     *
     * @return {@link ConversionOptions} instance
     */
    public ConversionOptions build() {
      return new ConversionOptions(this);
    }
  }

  private ConversionOptions(final Builder builder) {
    stripCdata = builder.stripCdata;
    removeComments = builder.removeComments;
    removePis = builder.removePis;
    header = builder.header;
    compact = builder.compact;
    removeBlankText = builder.removeBlankText;
  }

  /**
   * Get the default options.
   *
   * @return the default options
   */
  public static ConversionOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Create a new builder.
   *
   * @return a builder initialized with the defaults
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Create a new builder initialized with the values of this instance.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    return new Builder().stripCdata(stripCdata)
                        .removeComments(removeComments)
                        .removePis(removePis)
                        .header(header)
                        .compact(compact)
                        .removeBlankText(removeBlankText);
  }

  public boolean stripCdata() {
    return stripCdata;
  }

  public boolean removeComments() {
    return removeComments;
  }

  public boolean removePis() {
    return removePis;
  }

  public boolean header() {
    return header;
  }

  public boolean compact() {
    return compact;
  }

  public boolean removeBlankText() {
    return removeBlankText;
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ConversionOptions)) {
      return false;
    }
    final ConversionOptions options = (ConversionOptions) other;
    return stripCdata == options.stripCdata && removeComments == options.removeComments
        && removePis == options.removePis && header == options.header && compact == options.compact
        && removeBlankText == options.removeBlankText;
  }

  @Override
  public int hashCode() {
    return Objects.hash(stripCdata, removeComments, removePis, header, compact, removeBlankText);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("stripCdata", stripCdata)
                      .add("removeComments", removeComments)
                      .add("removePis", removePis)
                      .add("header", header)
                      .add("compact", compact)
                      .add("removeBlankText", removeBlankText)
                      .toString();
  }
}
