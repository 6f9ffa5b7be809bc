package net.imadata.imatools.xml;

import org.jdom2.Attribute;
import org.jdom2.Content;
import org.jdom2.Element;
import org.jdom2.Namespace;
import org.jdom2.Text;
import org.jdom2.Verifier;

/**
 * Two-space indentation for a freshly built subtree that is inserted {@code level} levels below the root.
 * Placing the subtree itself inside its parent is up to the caller.
 */
public final class XmlIndenter {
    private static final String INDENT = "  ";

    private XmlIndenter() {
    }

    /**
     * Returns an indented copy of {@code element}; the argument is left unchanged.
     * <ul>
     *     <li>An element with child elements gets {@code "\n" + (level + 1) * INDENT} before each of its children and
     *     {@code "\n" + level * INDENT} before its closing tag. Its own whitespace-only text is dropped, child
     *     elements are indented at {@code level + 1}.</li>
     *     <li>An element without child elements keeps its content as it is.</li>
     * </ul>
     */
    public static Element indent(Element element, int level) {
        Element result = new Element(element.getName(), element.getNamespace());
        for (Namespace namespace : element.getAdditionalNamespaces()) {
            result.addNamespaceDeclaration(namespace);
        }
        for (Attribute attribute : element.getAttributes()) {
            result.setAttribute(attribute.clone());
        }

        if (element.getChildren().isEmpty()) {
            for (Content content : element.getContent()) {
                result.addContent(content.clone());
            }
            return result;
        }

        for (Content content : element.getContent()) {
            if (isIndentation(content)) {
                continue;
            }
            result.addContent(new Text(newline(level + 1)));
            result.addContent(content instanceof Element ? indent((Element) content, level + 1) : content.clone());
        }
        result.addContent(new Text(newline(level)));
        return result;
    }

    /**
     * @return true for plain text that consists of whitespace only
     */
    public static boolean isIndentation(Content content) {
        return content.getCType() == Content.CType.Text && Verifier.isAllXMLWhitespace(content.getValue());
    }

    private static String newline(int level) {
        StringBuilder builder = new StringBuilder(1 + Math.max(level, 0) * INDENT.length());
        builder.append('\n');
        for (int i = 0; i < level; i++) {
            builder.append(INDENT);
        }
        return builder.toString();
    }
}
