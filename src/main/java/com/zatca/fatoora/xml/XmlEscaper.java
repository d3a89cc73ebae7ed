package com.zatca.fatoora.xml;

import org.codehaus.stax2.io.EscapingWriterFactory;

import java.io.FilterWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;

/**
 * Escapes text for XML element content and attribute values.
 */
public final class XmlEscaper {

    private XmlEscaper() {
    }

    /**
     * Replace {@code & < > " '} with their predefined entities. Null becomes
     * the empty string.
     */
    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        StringBuilder escaped = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            appendEscaped(escaped, value.charAt(i));
        }
        return escaped.toString();
    }

    private static void appendEscaped(StringBuilder out, char c) {
        switch (c) {
            case '&':
                out.append("&amp;");
                break;
            case '<':
                out.append("&lt;");
                break;
            case '>':
                out.append("&gt;");
                break;
            case '"':
                out.append("&quot;");
                break;
            case '\'':
                out.append("&apos;");
                break;
            default:
                out.append(c);
        }
    }

    /**
     * Stax2 text escaper that routes element content through {@link #escape}.
     */
    static final class TextEscaperFactory implements EscapingWriterFactory {

        @Override
        public Writer createEscapingWriterFor(Writer out, String encoding) {
            return new EscapingWriter(out);
        }

        @Override
        public Writer createEscapingWriterFor(OutputStream out, String encoding)
                throws UnsupportedEncodingException {
            return new EscapingWriter(new OutputStreamWriter(out, encoding == null ? "UTF-8" : encoding));
        }
    }

    private static final class EscapingWriter extends FilterWriter {

        EscapingWriter(Writer out) {
            super(out);
        }

        @Override
        public void write(int c) throws IOException {
            StringBuilder escaped = new StringBuilder(6);
            appendEscaped(escaped, (char) c);
            out.write(escaped.toString());
        }

        @Override
        public void write(char[] buffer, int offset, int length) throws IOException {
            out.write(escape(new String(buffer, offset, length)));
        }

        @Override
        public void write(String text, int offset, int length) throws IOException {
            out.write(escape(text.substring(offset, offset + length)));
        }
    }
}
