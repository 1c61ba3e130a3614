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

/**
 * Holds the keys and fixed values of the produced JSON shapes.
 */
public final class Constants {

  /**
   * Private constructor.
   */
  private Constants() {
    // Cannot be instantiated.
    throw new AssertionError("May not be instantiated!");
  }

  // --- Varia
  // ------------------------------------------------------------------

  /** Version emitted in the declaration envelope, independent of the parsed document. */
  public static final String DECLARATION_VERSION = "1.0";

  /** Encoding emitted in the declaration envelope, independent of the parsed document. */
  public static final String DECLARATION_ENCODING = "ISO-8859-1";

  // --- Verbose shape
  // ----------------------------------------------------------

  public static final String DECLARATION = "declaration";

  public static final String ATTRIBUTES = "attributes";

  public static final String ELEMENTS = "elements";

  public static final String TYPE = "type";

  public static final String NAME = "name";

  public static final String VERSION = "version";

  public static final String ENCODING = "encoding";

  public static final String TYPE_ELEMENT = "element";

  public static final String TYPE_TEXT = "text";

  public static final String TYPE_CDATA = "cdata";

  public static final String TYPE_COMMENT = "comment";

  public static final String TYPE_INSTRUCTION = "instruction";

  /** Key of the text value, equal to its type name. */
  public static final String TEXT = TYPE_TEXT;

  /** Key of the CDATA value, equal to its type name. */
  public static final String CDATA = TYPE_CDATA;

  /** Key of the comment value, equal to its type name. */
  public static final String COMMENT = TYPE_COMMENT;

  /** Key of the instruction body, equal to its type name. */
  public static final String INSTRUCTION = TYPE_INSTRUCTION;

  // --- Compact shape
  // ----------------------------------------------------------

  public static final String COMPACT_DECLARATION = "_declaration";

  public static final String COMPACT_ATTRIBUTES = "_attributes";

  public static final String COMPACT_TEXT = "_text";

  public static final String COMPACT_CDATA = "_cdata";

  public static final String COMPACT_COMMENT = "_comment";

  public static final String COMPACT_INSTRUCTION = "_instruction";
}
