package com.example.polyglot.catalog;

import com.example.polyglot.model.Catalog;
import com.example.polyglot.model.CatalogEntry;
import com.example.polyglot.model.Occurrence;

import java.util.Map;

/**
 * Serializes a {@link Catalog} back to PO text. Output depends only on the catalog content.
 */
public final class PoWriter {

    private static final int REFERENCE_WIDTH = 78;

    public String write(Catalog catalog) {
        StringBuilder out = new StringBuilder();
        boolean first = true;
        for (CatalogEntry entry : catalog) {
            if (!first) {
                out.append('\n');
            }
            first = false;
            writeEntry(out, entry, catalog.pluralFormCount());
        }
        if (!catalog.obsoleteLines().isEmpty()) {
            if (!first) {
                out.append('\n');
            }
            for (String line : catalog.obsoleteLines()) {
                out.append(line).append('\n');
            }
        }
        return out.toString();
    }

    private void writeEntry(StringBuilder out, CatalogEntry entry, int pluralFormCount) {
        for (String comment : entry.getTranslatorComments()) {
            out.append(comment.isEmpty() ? "#" : "# " + comment).append('\n');
        }
        for (String comment : entry.getExtractedComments()) {
            out.append("#. ").append(comment).append('\n');
        }
        writeReferences(out, entry);
        if (!entry.getFlags().isEmpty()) {
            out.append("#, ").append(String.join(", ", entry.getFlags())).append('\n');
        }
        for (String previous : entry.getPreviousLines()) {
            out.append("#| ").append(previous).append('\n');
        }

        if (entry.getMsgctxt() != null) {
            writeString(out, "msgctxt", entry.getMsgctxt());
        }
        writeString(out, "msgid", entry.getMsgid());
        if (entry.isPlural()) {
            writeString(out, "msgid_plural", entry.getMsgidPlural());
            Map<Integer, String> forms = entry.getMsgstrPlural();
            if (forms.isEmpty()) {
                for (int i = 0; i < pluralFormCount; i++) {
                    writeString(out, "msgstr[" + i + "]", "");
                }
            } else {
                forms.forEach((index, form) -> writeString(out, "msgstr[" + index + "]", form));
            }
        } else {
            writeString(out, "msgstr", entry.getMsgstr());
        }
    }

    private void writeReferences(StringBuilder out, CatalogEntry entry) {
        StringBuilder line = new StringBuilder();
        for (Occurrence occurrence : entry.getOccurrences()) {
            String reference = occurrence.toReference();
            if (line.length() > 0 && line.length() + 1 + reference.length() > REFERENCE_WIDTH - 3) {
                out.append("#: ").append(line).append('\n');
                line.setLength(0);
            }
            if (line.length() > 0) {
                line.append(' ');
            }
            line.append(reference);
        }
        if (line.length() > 0) {
            out.append("#: ").append(line).append('\n');
        }
    }

    /** Strings with embedded newlines are split after each {@code \n}, xgettext style. */
    private void writeString(StringBuilder out, String keyword, String value) {
        int firstNewline = value.indexOf('\n');
        if (firstNewline < 0 || firstNewline == value.length() - 1) {
            out.append(keyword).append(" \"").append(escape(value)).append("\"\n");
            return;
        }
        out.append(keyword).append(" \"\"\n");
        int start = 0;
        while (start < value.length()) {
            int end = value.indexOf('\n', start);
            end = end < 0 ? value.length() : end + 1;
            out.append('"').append(escape(value.substring(start, end))).append("\"\n");
            start = end;
        }
    }

    static String escape(String s) {
        StringBuilder out = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
