package com.vidnyan.bridge.adapter.out.interchange;

import com.vidnyan.bridge.application.port.out.NodeSerializer;
import com.vidnyan.bridge.domain.model.Node;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Blockly XML interchange format.
 * Top-level nodes go into the CONTENTS statement of a file container block.
 * Every statement list is written as a chain in which each block nests its
 * successor inside {@code <next>}.
 */
@Component
public class BlocklyXmlSerializer implements NodeSerializer {

    static final String NAMESPACE = "https://developers.google.com/blockly/xml";
    static final String FILE_CONTAINER = "file_container";
    static final String FILENAME = "FILENAME";
    static final String CONTENTS = "CONTENTS";

    private static final int INDENT = 2;

    @Override
    public String serialize(List<Node> nodes, String filename) {
        StringBuilder xml = new StringBuilder();
        xml.append("<xml xmlns=\"").append(NAMESPACE).append("\">\n");
        xml.append("  <block type=\"").append(FILE_CONTAINER).append("\" x=\"20\" y=\"20\">\n");
        xml.append("    <field name=\"").append(FILENAME).append("\">")
                .append(escape(filename == null ? "" : filename)).append("</field>\n");
        if (!nodes.isEmpty()) {
            xml.append("    <statement name=\"").append(CONTENTS).append("\">\n");
            appendChain(xml, nodes, 6);
            xml.append("    </statement>\n");
        }
        xml.append("  </block>\n");
        xml.append("</xml>");
        return xml.toString();
    }

    @Override
    public InterchangeDocument deserialize(String document) {
        return new BlocklyXmlReader().read(document);
    }

    // The chain nests one level per sibling, so close tags are written after the loop.
    private void appendChain(StringBuilder xml, List<Node> chain, int indent) {
        int depth = indent;
        for (int i = 0; i < chain.size(); i++) {
            appendBlockOpen(xml, chain.get(i), depth);
            if (i + 1 < chain.size()) {
                pad(xml, depth + INDENT).append("<next>\n");
                depth += 2 * INDENT;
            }
        }
        for (int i = chain.size() - 1; i >= 0; i--) {
            pad(xml, depth).append("</block>\n");
            if (i > 0) {
                depth -= 2 * INDENT;
                pad(xml, depth + INDENT).append("</next>\n");
            }
        }
    }

    private void appendBlock(StringBuilder xml, Node node, int indent) {
        appendBlockOpen(xml, node, indent);
        pad(xml, indent).append("</block>\n");
    }

    private void appendBlockOpen(StringBuilder xml, Node node, int indent) {
        pad(xml, indent).append("<block type=\"").append(escape(node.type().tag()))
                .append("\" id=\"").append(escape(node.id())).append("\">\n");
        for (Map.Entry<String, String> field : node.fields().entrySet()) {
            pad(xml, indent + INDENT).append("<field name=\"").append(escape(field.getKey())).append("\">")
                    .append(escape(field.getValue())).append("</field>\n");
        }
        for (Map.Entry<String, Node> value : node.values().entrySet()) {
            pad(xml, indent + INDENT).append("<value name=\"").append(escape(value.getKey())).append("\">\n");
            appendBlock(xml, value.getValue(), indent + 2 * INDENT);
            pad(xml, indent + INDENT).append("</value>\n");
        }
        for (Map.Entry<String, List<Node>> statement : node.statements().entrySet()) {
            pad(xml, indent + INDENT).append("<statement name=\"").append(escape(statement.getKey())).append("\">\n");
            appendChain(xml, statement.getValue(), indent + 2 * INDENT);
            pad(xml, indent + INDENT).append("</statement>\n");
        }
    }

    private static StringBuilder pad(StringBuilder xml, int indent) {
        return xml.append(" ".repeat(indent));
    }

    /**
     * Escape the five XML markup characters.
     */
    static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&apos;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
