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

package io.xmljson.exception;

import javax.xml.stream.Location;
import javax.xml.stream.XMLStreamException;

/**
 * Thrown if the XML input is malformed or can not be read.
 */
public final class XmlParseException extends XmlJsonException {

  private static final long serialVersionUID = 1L;

  /** Line of the failure or {@code -1} if not known. */
  private final int lineNumber;

  /** Column of the failure or {@code -1} if not known. */
  private final int columnNumber;

  /**
   * Constructor.
   *
   * @param e the StAX failure
   */
  public XmlParseException(final XMLStreamException e) {
    super(e.getMessage(), e);
    final Location location = e.getLocation();
    lineNumber = location == null ? -1 : location.getLineNumber();
    columnNumber = location == null ? -1 : location.getColumnNumber();
  }

  /**
   * Constructor.
   *
   * @param message message
   */
  public XmlParseException(final String message) {
    super(message);
    lineNumber = -1;
    columnNumber = -1;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public int getColumnNumber() {
    return columnNumber;
  }
}
