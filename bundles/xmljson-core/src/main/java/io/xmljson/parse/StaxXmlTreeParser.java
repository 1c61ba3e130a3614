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

import io.xmljson.exception.XmlJsonException;
import io.xmljson.exception.XmlParseException;
import io.xmljson.node.CommentNode;
import io.xmljson.node.ElementNode;
import io.xmljson.node.PINode;
import io.xmljson.node.TextNode;
import io.xmljson.settings.ConversionOptions;
import io.xmljson.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.Characters;
import javax.xml.stream.events.Comment;
import javax.xml.stream.events.EntityReference;
import javax.xml.stream.events.Namespace;
import javax.xml.stream.events.ProcessingInstruction;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Builds the node tree from StAX events. The tree is built with an explicit stack of open
 * elements, so the nesting depth of the document is not bounded by the call stack.
 *
 * <p>
 * Adjacent character events are coalesced into one text run. Each CDATA section becomes a CDATA
 * run of its own unless {@code stripCdata} is set, in which case it is merged with the surrounding
 * text. Removed comments and processing instructions do not split text runs.
 * </p>
 */
public final class StaxXmlTreeParser implements XmlTreeParser {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(StaxXmlTreeParser.class));

  /** Property of the JDK's StAX implementation to report CDATA sections as separate events. */
  static final String REPORT_CDATA_EVENT = "http://java.sun.com/xml/stream/properties/report-cdata-event";

  /** Creates the factories, one per parse. */
  private final Supplier<XMLInputFactory> factorySupplier;

  /**
   * Constructor using the default {@link XMLInputFactory}.
   */
  public StaxXmlTreeParser() {
    this(XMLInputFactory::newInstance);
  }

  /**
   * Constructor.
   *
   * @param factorySupplier supplies the factory to parse with, which is hardened and configured for
   *        CDATA reporting before use
   */
  public StaxXmlTreeParser(final Supplier<XMLInputFactory> factorySupplier) {
    this.factorySupplier = checkNotNull(factorySupplier);
  }

  @Override
  public ElementNode parse(final XmlSource source, final ConversionOptions options) {
    checkNotNull(source);
    checkNotNull(options);
    final XMLInputFactory factory = checkNotNull(factorySupplier.get(), "The factory supplier returned null.");
    setProperties(factory);

    try {
      final XMLEventReader reader = source.createEventReader(factory);
      final ElementNode root = buildTree(reader, options);
      reader.close();
      LOGWRAPPER.debug("Parsed {} into a tree with root element '{}'.", source.getDescription(), root.getName());
      return root;
    } catch (final XMLStreamException e) {
      throw new XmlParseException(e);
    } catch (final IOException e) {
      throw new XmlJsonException("Failed to read the XML input from " + source.getDescription() + ".", e);
    }
  }

  private static void setProperties(final XMLInputFactory factory) {
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, true);
    factory.setProperty(XMLInputFactory.IS_COALESCING, false);
    if (factory.isPropertySupported(REPORT_CDATA_EVENT)) {
      factory.setProperty(REPORT_CDATA_EVENT, true);
    } else {
      LOGWRAPPER.warn("{} does not report CDATA sections, they are classified as text.", factory.getClass().getName());
    }
  }

  private static ElementNode buildTree(final XMLEventReader reader, final ConversionOptions options)
      throws XMLStreamException {
    final Deque<ElementNode.Builder> parents = new ArrayDeque<>();
    final TextRunBuffer text = new TextRunBuffer(options.stripCdata());
    ElementNode root = null;

    while (reader.hasNext()) {
      final XMLEvent event = reader.nextEvent();

      switch (event.getEventType()) {
        case XMLStreamConstants.START_ELEMENT:
          text.flushTo(parents.peek());
          parents.push(newElement(event.asStartElement()));
          break;
        case XMLStreamConstants.END_ELEMENT:
          text.flushTo(parents.peek());
          final ElementNode element = parents.pop().build();
          if (parents.isEmpty()) {
            root = element;
          } else {
            parents.peek().add(element);
          }
          break;
        case XMLStreamConstants.CHARACTERS:
        case XMLStreamConstants.CDATA:
        case XMLStreamConstants.SPACE:
          // Outside of the root element only whitespace may occur.
          if (!parents.isEmpty()) {
            final Characters characters = event.asCharacters();
            text.append(parents.peek(), characters.getData(),
                        characters.isCData() || event.getEventType() == XMLStreamConstants.CDATA);
          }
          break;
        case XMLStreamConstants.COMMENT:
          if (!parents.isEmpty() && !options.removeComments()) {
            text.flushTo(parents.peek());
            parents.peek().add(new CommentNode(((Comment) event).getText()));
          }
          break;
        case XMLStreamConstants.PROCESSING_INSTRUCTION:
          if (!parents.isEmpty() && !options.removePis()) {
            final ProcessingInstruction pi = (ProcessingInstruction) event;
            text.flushTo(parents.peek());
            parents.peek().add(new PINode(pi.getTarget(), pi.getData() == null ? "" : pi.getData()));
          }
          break;
        case XMLStreamConstants.ENTITY_REFERENCE:
          throw new XmlParseException("Unresolved entity reference '&" + ((EntityReference) event).getName() + ";'.");
        default:
          // Document start and end, DTD: not part of the tree.
      }
    }

    if (root == null) {
      throw new XmlParseException("The document has no root element.");
    }
    return root;
  }

  private static ElementNode.Builder newElement(final StartElement event) {
    final ElementNode.Builder builder = ElementNode.builder(qualifiedName(event.getName()));

    // Namespace declarations first, StAX does not keep their position among the attributes.
    for (final Iterator<?> it = event.getNamespaces(); it.hasNext();) {
      final Namespace namespace = (Namespace) it.next();
      final String prefix = namespace.getPrefix();
      builder.attribute(prefix == null || prefix.isEmpty() ? "xmlns" : "xmlns:" + prefix, namespace.getNamespaceURI());
    }

    for (final Iterator<?> it = event.getAttributes(); it.hasNext();) {
      final Attribute attribute = (Attribute) it.next();
      builder.attribute(qualifiedName(attribute.getName()), attribute.getValue());
    }

    return builder;
  }

  private static String qualifiedName(final QName name) {
    final String prefix = name.getPrefix();
    return prefix == null || prefix.isEmpty() ? name.getLocalPart() : prefix + ':' + name.getLocalPart();
  }

  /**
   * Collects character data until the kind changes or a node interrupts the run.
   */
  private static final class TextRunBuffer {

    private final boolean stripCdata;

    private final StringBuilder buffer = new StringBuilder();

    private boolean cdata;

    private boolean pending;

    TextRunBuffer(final boolean stripCdata) {
      this.stripCdata = stripCdata;
    }

    void append(final ElementNode.Builder parent, final String data, final boolean isCData) {
      final boolean runIsCData = isCData && !stripCdata;
      // Every CDATA section is a run of its own.
      if (pending && (runIsCData || cdata)) {
        flushTo(parent);
      }
      buffer.append(data);
      cdata = runIsCData;
      pending = true;
    }

    void flushTo(final ElementNode.@Nullable Builder parent) {
      if (pending && parent != null) {
        parent.add(cdata ? TextNode.cdata(buffer.toString()) : TextNode.text(buffer.toString()));
      }
      buffer.setLength(0);
      pending = false;
    }
  }
}
