package com.vidnyan.bridge.adapter.out.interchange;

import com.vidnyan.bridge.application.port.out.InterchangeFormatException;
import com.vidnyan.bridge.application.port.out.NodeSerializer.InterchangeDocument;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.vidnyan.bridge.adapter.out.interchange.BlocklyXmlSerializer.CONTENTS;
import static com.vidnyan.bridge.adapter.out.interchange.BlocklyXmlSerializer.FILENAME;
import static com.vidnyan.bridge.adapter.out.interchange.BlocklyXmlSerializer.FILE_CONTAINER;

/**
 * Loads Blockly XML back into nodes with a DOM parser.
 * Accepts a file container document or bare top-level blocks. One instance reads
 * one document.
 */
@Slf4j
class BlocklyXmlReader {

    private int generatedIds;

    InterchangeDocument read(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new InterchangeFormatException("Document is empty");
        }
        Element root = parse(xml).getDocumentElement();
        if (!"xml".equals(root.getTagName())) {
            throw new InterchangeFormatException("Expected <xml> root element but found <" + root.getTagName() + ">");
        }

        List<Element> topBlocks = children(root, "block");
        if (topBlocks.size() == 1 && FILE_CONTAINER.equals(topBlocks.get(0).getAttribute("type"))) {
            Element container = topBlocks.get(0);
            String filename = namedChild(container, "field", FILENAME).map(Element::getTextContent).orElse(null);
            List<Node> nodes = namedChild(container, "statement", CONTENTS)
                    .map(this::readChain)
                    .orElse(List.of());
            return new InterchangeDocument(filename, nodes);
        }

        List<Node> nodes = new ArrayList<>();
        for (Element block : topBlocks) {
            nodes.addAll(readChainFrom(block));
        }
        log.debug("Read {} top-level blocks without a file container", nodes.size());
        return new InterchangeDocument(null, nodes);
    }

    private Document parse(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new InterchangeFormatException("Malformed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new InterchangeFormatException("Cannot read document: " + e.getMessage(), e);
        }
    }

    /**
     * The chain held by a statement element: its first block and every {@code <next>} successor.
     */
    private List<Node> readChain(Element statement) {
        return children(statement, "block").stream()
                .findFirst()
                .map(this::readChainFrom)
                .orElse(List.of());
    }

    private List<Node> readChainFrom(Element first) {
        List<Node> chain = new ArrayList<>();
        Element current = first;
        while (current != null) {
            chain.add(readBlock(current));
            current = children(current, "next").stream()
                    .flatMap(next -> children(next, "block").stream())
                    .findFirst()
                    .orElse(null);
        }
        return chain;
    }

    private Node readBlock(Element block) {
        String tag = block.getAttribute("type");
        NodeType type = NodeType.fromTag(tag)
                .orElseThrow(() -> new InterchangeFormatException("Unknown block type: " + tag));
        String id = block.getAttribute("id");
        try {
            Node.Builder node = Node.builder(type).id(id.isEmpty() ? "imported_" + generatedIds++ : id);
            for (Element field : children(block, "field")) {
                node.field(field.getAttribute("name"), field.getTextContent());
            }
            for (Element value : children(block, "value")) {
                Optional<Element> child = children(value, "block").stream().findFirst();
                if (child.isPresent()) {
                    node.value(value.getAttribute("name"), readBlock(child.get()));
                }
            }
            for (Element statement : children(block, "statement")) {
                node.statements(statement.getAttribute("name"), readChain(statement));
            }
            return node.build();
        } catch (IllegalArgumentException e) {
            throw new InterchangeFormatException("Invalid block " + tag + ": " + e.getMessage(), e);
        }
    }

    private static Optional<Element> namedChild(Element parent, String tag, String name) {
        return children(parent, tag).stream()
                .filter(child -> name.equals(child.getAttribute("name")))
                .findFirst();
    }

    private static List<Element> children(Element parent, String tag) {
        List<Element> elements = new ArrayList<>();
        for (org.w3c.dom.Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && tag.equals(element.getTagName())) {
                elements.add(element);
            }
        }
        return elements;
    }
}
