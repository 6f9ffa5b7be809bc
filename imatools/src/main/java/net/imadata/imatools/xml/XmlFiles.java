package net.imadata.imatools.xml;

import org.jdom2.Document;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.jdom2.output.Format;
import org.jdom2.output.LineSeparator;
import org.jdom2.output.XMLOutputter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Writer;

/**
 * Reads and writes repository metadata documents with JDOM.
 * <p>
 * Documents are read with all whitespace kept and written back in raw format, so content that is not touched
 * between reading and writing keeps its layout.
 */
public final class XmlFiles {
    public static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    private static final String LINE_SEPARATOR = "\n";

    private XmlFiles() {
    }

    public static Document parse(byte[] content, String systemId) throws IOException {
        try {
            return createBuilder().build(new ByteArrayInputStream(content), systemId);
        } catch (JDOMException e) {
            throw new IOException("Failed to parse " + systemId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes {@code document} in raw format.
     *
     * @param trailingLineSeparator whether the output ends with a line separator after the root element
     */
    public static void write(Document document, Writer writer, boolean trailingLineSeparator) throws IOException {
        String output = new XMLOutputter(createFormat()).outputString(document);
        while (output.endsWith(LINE_SEPARATOR)) {
            output = output.substring(0, output.length() - LINE_SEPARATOR.length());
        }
        writer.write(output);
        if (trailingLineSeparator) {
            writer.write(LINE_SEPARATOR);
        }
    }

    public static String escapeText(String text) {
        return Format.escapeText(createFormat().getEscapeStrategy(), LINE_SEPARATOR, text);
    }

    public static String escapeAttribute(String value) {
        return Format.escapeAttribute(createFormat().getEscapeStrategy(), value);
    }

    private static SAXBuilder createBuilder() {
        SAXBuilder builder = new SAXBuilder();
        builder.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        builder.setFeature("http://xml.org/sax/features/external-general-entities", false);
        builder.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return builder;
    }

    private static Format createFormat() {
        return Format.getRawFormat()
                .setEncoding("UTF-8")
                .setLineSeparator(LineSeparator.UNIX);
    }
}
