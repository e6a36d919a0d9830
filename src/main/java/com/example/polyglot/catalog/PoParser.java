package com.example.polyglot.catalog;

import com.example.polyglot.model.Catalog;
import com.example.polyglot.model.CatalogEntry;
import com.example.polyglot.model.CatalogParseException;
import com.example.polyglot.model.Occurrence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Line-oriented parser for gettext PO text.
 * <p>
 * Supported: translator ({@code #}), extracted ({@code #.}), reference ({@code #:}), flag
 * ({@code #,}) and previous ({@code #|}) comments; {@code msgctxt}, {@code msgid},
 * {@code msgid_plural}, {@code msgstr}, {@code msgstr[n]}; continuation strings and C escapes.
 * Obsolete {@code #~} blocks are not interpreted and are kept verbatim on the catalog.
 */
public final class PoParser {

    private final String source;

    public PoParser(String source) {
        this.source = source;
    }

    public Catalog parse(String text) {
        Catalog catalog = new Catalog();
        EntryBuilder builder = new EntryBuilder();
        boolean inObsolete = false;

        String[] lines = text.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();

            if (line.isEmpty()) {
                if (builder.hasMsgid()) {
                    catalog.add(builder.build(lineNumber));
                    builder = new EntryBuilder();
                } else if (inObsolete) {
                    catalog.obsoleteLines().add("");
                }
                continue;
            }

            if (line.startsWith("#~")) {
                if (builder.hasMsgid()) {
                    catalog.add(builder.build(lineNumber));
                    builder = new EntryBuilder();
                }
                // comments directly above an obsolete entry belong to it
                catalog.obsoleteLines().addAll(builder.rawComments);
                builder = new EntryBuilder();
                catalog.obsoleteLines().add(line);
                inObsolete = true;
                continue;
            }
            inObsolete = false;

            if (line.startsWith("#")) {
                if (builder.hasMsgstr()) {
                    catalog.add(builder.build(lineNumber));
                    builder = new EntryBuilder();
                }
                builder.comment(line);
                continue;
            }

            if (line.startsWith("\"")) {
                if (builder.current == null) {
                    throw new CatalogParseException(source, lineNumber, "string continuation without keyword");
                }
                builder.append(unquote(line, lineNumber));
                continue;
            }

            int space = line.indexOf(' ');
            if (space < 0) {
                throw new CatalogParseException(source, lineNumber, "expected keyword and string: " + line);
            }
            String keyword = line.substring(0, space);
            String value = unquote(line.substring(space + 1).strip(), lineNumber);

            if ((keyword.equals("msgctxt") || keyword.equals("msgid")) && builder.hasMsgstr()) {
                catalog.add(builder.build(lineNumber));
                builder = new EntryBuilder();
            }
            builder.keyword(keyword, value, lineNumber);
        }

        if (builder.hasMsgid()) {
            catalog.add(builder.build(lines.length));
        } else if (!builder.rawComments.isEmpty()) {
            catalog.obsoleteLines().addAll(builder.rawComments);
        }
        List<String> obsolete = catalog.obsoleteLines();
        while (!obsolete.isEmpty() && obsolete.get(obsolete.size() - 1).isEmpty()) {
            obsolete.remove(obsolete.size() - 1);
        }
        return catalog;
    }

    private String unquote(String token, int lineNumber) {
        if (token.length() < 2 || !token.startsWith("\"") || !token.endsWith("\"")) {
            throw new CatalogParseException(source, lineNumber, "unterminated string: " + token);
        }
        return unescape(token.substring(1, token.length() - 1));
    }

    static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i == s.length() - 1) {
                out.append(c);
                continue;
            }
            char next = s.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'v' -> out.append('\u000B');
                default -> out.append(next);
            }
        }
        return out.toString();
    }

    private final class EntryBuilder {

        private String msgctxt;
        private String msgid;
        private String msgidPlural;
        private String msgstr;
        private final Map<Integer, String> plural = new TreeMap<>();
        private final List<String> rawComments = new ArrayList<>();
        private final List<String> translatorComments = new ArrayList<>();
        private final List<String> extractedComments = new ArrayList<>();
        private final List<String> previousLines = new ArrayList<>();
        private final List<Occurrence> occurrences = new ArrayList<>();
        private final List<String> flags = new ArrayList<>();

        /** Field receiving continuation strings: msgctxt, msgid, msgid_plural, msgstr or an index. */
        private Object current;

        boolean hasMsgid() {
            return msgid != null;
        }

        boolean hasMsgstr() {
            return msgstr != null || !plural.isEmpty();
        }

        void comment(String line) {
            rawComments.add(line);
            if (line.startsWith("#:")) {
                for (String reference : line.substring(2).trim().split("\\s+")) {
                    if (!reference.isEmpty()) {
                        occurrences.add(Occurrence.parse(reference));
                    }
                }
            } else if (line.startsWith("#,")) {
                for (String flag : line.substring(2).split(",")) {
                    if (!flag.isBlank()) {
                        flags.add(flag.trim());
                    }
                }
            } else if (line.startsWith("#.")) {
                extractedComments.add(stripMarker(line, 2));
            } else if (line.startsWith("#|")) {
                previousLines.add(stripMarker(line, 2));
            } else {
                translatorComments.add(stripMarker(line, 1));
            }
        }

        private String stripMarker(String line, int markerLength) {
            String rest = line.substring(markerLength);
            return rest.startsWith(" ") ? rest.substring(1) : rest;
        }

        void keyword(String keyword, String value, int lineNumber) {
            switch (keyword) {
                case "msgctxt" -> msgctxt = value;
                case "msgid" -> msgid = value;
                case "msgid_plural" -> msgidPlural = value;
                case "msgstr" -> msgstr = value;
                default -> {
                    if (keyword.startsWith("msgstr[") && keyword.endsWith("]")) {
                        try {
                            int index = Integer.parseInt(keyword.substring(7, keyword.length() - 1));
                            plural.put(index, value);
                            current = index;
                            return;
                        } catch (NumberFormatException e) {
                            throw new CatalogParseException(source, lineNumber, "bad plural index: " + keyword);
                        }
                    }
                    throw new CatalogParseException(source, lineNumber, "unknown keyword: " + keyword);
                }
            }
            current = keyword;
        }

        void append(String value) {
            if (current instanceof Integer index) {
                plural.merge(index, value, String::concat);
                return;
            }
            switch ((String) current) {
                case "msgctxt" -> msgctxt += value;
                case "msgid" -> msgid += value;
                case "msgid_plural" -> msgidPlural += value;
                default -> msgstr += value;
            }
        }

        CatalogEntry build(int lineNumber) {
            if (msgidPlural == null && !plural.isEmpty()) {
                throw new CatalogParseException(source, lineNumber, "msgstr[n] without msgid_plural for: " + msgid);
            }
            CatalogEntry entry = new CatalogEntry(msgid, msgctxt, msgidPlural);
            entry.setMsgstr(msgstr);
            plural.forEach(entry::setPluralForm);
            entry.getOccurrences().addAll(occurrences);
            entry.getFlags().addAll(flags);
            entry.getTranslatorComments().addAll(translatorComments);
            entry.getExtractedComments().addAll(extractedComments);
            entry.getPreviousLines().addAll(previousLines);
            return entry;
        }
    }
}
