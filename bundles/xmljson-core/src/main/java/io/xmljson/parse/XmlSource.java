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

package io.xmljson.parse;

import com.google.common.base.MoreObjects;

import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * XML input in textual or byte form. Streams and readers are owned by the caller and are not
 * closed.
 */
public final class XmlSource {

  /**
   * Creates a StAX event reader on the underlying input.
   */
  @FunctionalInterface
  interface EventReaderFactory {
    XMLEventReader create(XMLInputFactory factory) throws XMLStreamException, IOException;
  }

  /** Short description used in log and error messages. */
  private final String description;

  /** Opens the input. */
  private final EventReaderFactory eventReaderFactory;

  private XmlSource(final String description, final EventReaderFactory eventReaderFactory) {
    this.description = description;
    this.eventReaderFactory = eventReaderFactory;
  }

  /**
   * Create a source from a string.
   *
   * @param xml the XML document
   * @return the source
   */
  public static XmlSource of(final CharSequence xml) {
    final String xmlString = checkNotNull(xml).toString();
    return new XmlSource("string", factory -> factory.createXMLEventReader(new StringReader(xmlString)));
  }

  /**
   * Create a source from bytes. The encoding is detected from the XML declaration, UTF-8 otherwise.
   *
   * @param xml the XML document
   * @return the source
   */
  public static XmlSource of(final byte[] xml) {
    final byte[] bytes = checkNotNull(xml).clone();
    return new XmlSource("bytes", factory -> factory.createXMLEventReader(new ByteArrayInputStream(bytes)));
  }

  /**
   * Create a source from a byte stream.
   *
   * @param in the stream
   * @return the source
   */
  public static XmlSource of(final InputStream in) {
    checkNotNull(in);
    return new XmlSource("stream", factory -> factory.createXMLEventReader(in));
  }

  /**
   * Create a source from a character stream.
   *
   * @param reader the reader
   * @return the source
   */
  public static XmlSource of(final Reader reader) {
    checkNotNull(reader);
    return new XmlSource("reader", factory -> factory.createXMLEventReader(reader));
  }

  /**
   * Create a source from a file, which is read completely when the source is opened.
   *
   * @param file the file
   * @return the source
   */
  public static XmlSource of(final Path file) {
    checkNotNull(file);
    return new XmlSource(file.toString(),
                         factory -> factory.createXMLEventReader(new ByteArrayInputStream(Files.readAllBytes(file))));
  }

  /**
   * Create a source from any supported input: {@link CharSequence}, {@code byte[]},
   * {@link InputStream}, {@link Reader}, {@link Path} or {@link File}.
   *
   * @param xml the input
   * @return the source
   * @throws NullPointerException if {@code xml} is {@code null}
   * @throws IllegalArgumentException if {@code xml} is neither textual nor byte content
   */
  public static XmlSource from(final Object xml) {
    checkNotNull(xml, "The input xml must not be null.");
    if (xml instanceof XmlSource source) {
      return source;
    }
    if (xml instanceof CharSequence text) {
      return of(text);
    }
    if (xml instanceof byte[] bytes) {
      return of(bytes);
    }
    if (xml instanceof InputStream in) {
      return of(in);
    }
    if (xml instanceof Reader reader) {
      return of(reader);
    }
    if (xml instanceof Path path) {
      return of(path);
    }
    checkArgument(xml instanceof File, "The input xml is not in string or byte format: %s.", xml.getClass().getName());
    return of(((File) xml).toPath());
  }

  /**
   * Open a StAX event reader on the input.
   *
   * @param factory the configured factory
   * @return the event reader
   * @throws XMLStreamException if the reader can not be created
   * @throws IOException if the input can not be read
   */
  public XMLEventReader createEventReader(final XMLInputFactory factory) throws XMLStreamException, IOException {
    return eventReaderFactory.create(factory);
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("description", description).toString();
  }
}
