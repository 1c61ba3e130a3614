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

package io.xmljson;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.xmljson.convert.TreeConverter;
import io.xmljson.node.ElementNode;
import io.xmljson.parse.StaxXmlTreeParser;
import io.xmljson.parse.XmlSource;
import io.xmljson.parse.XmlTreeParser;
import io.xmljson.settings.ConversionOptions;
import io.xmljson.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Converts XML documents into JSON values following the xml-js conventions.
 *
 * <pre>
 * final JsonObject value = XmlJson.xml2json("&lt;root attr=\"1\"&gt;&lt;child&gt;hi&lt;/child&gt;&lt;/root&gt;",
 *     ConversionOptions.builder().compact(true).header(false).build());
 * // {"root":{"_attributes":{"attr":"1"},"child":{"_text":"hi"}}}
 * </pre>
 *
 * <p>
 * Instances are immutable and may be shared between threads.
 * </p>
 */
public final class XmlJson {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(XmlJson.class));

  /** Instance with the default parser. */
  private static final XmlJson DEFAULT = new XmlJson();

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private static final Gson PRETTY_GSON = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

  /** Parses the input. */
  private final XmlTreeParser parser;

  /** Converts the parsed tree. */
  private final TreeConverter converter;

  /**
   * Constructor using the StAX based parser.
   */
  public XmlJson() {
    this(new StaxXmlTreeParser());
  }

  /**
   * Constructor.
   *
   * @param parser the parser to use instead of the StAX based default
   */
  public XmlJson(final XmlTreeParser parser) {
    this(parser, new TreeConverter());
  }

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param converter the converter
   */
  public XmlJson(final XmlTreeParser parser, final TreeConverter converter) {
    this.parser = checkNotNull(parser);
    this.converter = checkNotNull(converter);
  }

  /**
   * Convert with the default parser.
   *
   * @param xml textual or byte content, see {@link XmlSource#from(Object)}
   * @param options the options
   * @return the structured value
   * @see #xmlToStructuredValue(Object, ConversionOptions)
   */
  public static JsonObject xml2json(final Object xml, final ConversionOptions options) {
    return DEFAULT.xmlToStructuredValue(xml, options);
  }

  /**
   * Convert with the default parser and the default options.
   *
   * @param xml textual or byte content, see {@link XmlSource#from(Object)}
   * @return the structured value
   */
  public static JsonObject xml2json(final Object xml) {
    return DEFAULT.xmlToStructuredValue(xml, ConversionOptions.defaults());
  }

  /**
   * Parse the XML input and convert its root element.
   *
   * @param xml textual or byte content: a {@link CharSequence}, {@code byte[]},
   *        {@link java.io.InputStream}, {@link java.io.Reader}, {@link java.nio.file.Path},
   *        {@link java.io.File} or {@link XmlSource}
   * @param options the options
   * @return the structured value
   * @throws NullPointerException if {@code xml} or {@code options} is {@code null}
   * @throws IllegalArgumentException if {@code xml} is neither textual nor byte content
   * @throws io.xmljson.exception.XmlParseException if the input is not well-formed
   */
  public JsonObject xmlToStructuredValue(final Object xml, final ConversionOptions options) {
    final XmlSource source = XmlSource.from(xml);
    checkNotNull(options);
    LOGWRAPPER.debug("Converting {} with {}.", source.getDescription(), options);

    final ElementNode root = parser.parse(source, options);
    return converter.convert(root, options.stripCdata(), options.header(), options.compact(),
                             options.removeBlankText());
  }

  /**
   * Serialize a structured value to JSON text.
   *
   * @param value the value
   * @param prettyPrint {@code true} for indented output
   * @return the JSON text
   */
  public static String toJson(final JsonElement value, final boolean prettyPrint) {
    checkNotNull(value);
    return prettyPrint ? PRETTY_GSON.toJson(value) : GSON.toJson(value);
  }
}
