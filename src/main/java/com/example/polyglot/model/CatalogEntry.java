package com.example.polyglot.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * One translatable unit of a catalog.
 * <p>
 * The {@code msgid} is fixed at construction. Translation fields ({@code msgstr},
 * {@code msgstrPlural}, fuzzy flag) are mutated in place by the merge engine; everything
 * else is carried so the catalog can be written back without losing information.
 */
public class CatalogEntry {

    public static final String FUZZY_FLAG = "fuzzy";

    private final String msgid;
    private final String msgctxt;
    private final String msgidPlural;
    private String msgstr = "";
    private final TreeMap<Integer, String> msgstrPlural = new TreeMap<>();
    private final List<Occurrence> occurrences = new ArrayList<>();
    private final Set<String> flags = new LinkedHashSet<>();
    private final List<String> translatorComments = new ArrayList<>();
    private final List<String> extractedComments = new ArrayList<>();
    private final List<String> previousLines = new ArrayList<>();

    public CatalogEntry(String msgid) {
        this(msgid, null, null);
    }

    public CatalogEntry(String msgid, String msgidPlural) {
        this(msgid, null, msgidPlural);
    }

    public CatalogEntry(String msgid, String msgctxt, String msgidPlural) {
        this.msgid = Objects.requireNonNull(msgid, "msgid cannot be null");
        this.msgctxt = msgctxt;
        this.msgidPlural = msgidPlural == null || msgidPlural.isEmpty() ? null : msgidPlural;
    }

    public String getMsgid() {
        return msgid;
    }

    public String getMsgctxt() {
        return msgctxt;
    }

    public String getMsgidPlural() {
        return msgidPlural;
    }

    public boolean isPlural() {
        return msgidPlural != null;
    }

    /** The header entry carries catalog metadata under the empty msgid. */
    public boolean isHeader() {
        return msgid.isEmpty() && msgctxt == null;
    }

    public String getMsgstr() {
        return msgstr;
    }

    public void setMsgstr(String msgstr) {
        this.msgstr = msgstr == null ? "" : msgstr;
    }

    /** Read-only view, ordered by plural index. */
    public Map<Integer, String> getMsgstrPlural() {
        return Collections.unmodifiableMap(msgstrPlural);
    }

    public void setPluralForm(int index, String translation) {
        if (index < 0) {
            throw new IllegalArgumentException("Plural index must be non-negative: " + index);
        }
        msgstrPlural.put(index, translation == null ? "" : translation);
    }

    public List<Occurrence> getOccurrences() {
        return occurrences;
    }

    public boolean isFuzzy() {
        return flags.contains(FUZZY_FLAG);
    }

    public void setFuzzy(boolean fuzzy) {
        if (fuzzy) {
            flags.add(FUZZY_FLAG);
        } else {
            flags.remove(FUZZY_FLAG);
        }
    }

    /** Flags in declaration order, e.g. {@code fuzzy}, {@code python-format}. */
    public Set<String> getFlags() {
        return flags;
    }

    public List<String> getTranslatorComments() {
        return translatorComments;
    }

    public List<String> getExtractedComments() {
        return extractedComments;
    }

    /** Raw {@code #|} lines (previous msgid), kept verbatim without the marker. */
    public List<String> getPreviousLines() {
        return previousLines;
    }

    /**
     * Whether the entry already has a translation: a non-empty {@code msgstr} for singular
     * entries, or every plural slot filled for plural entries.
     */
    public boolean isTranslated() {
        if (isPlural()) {
            return !msgstrPlural.isEmpty()
                    && msgstrPlural.values().stream().noneMatch(String::isEmpty);
        }
        return !msgstr.isEmpty();
    }

    @Override
    public String toString() {
        return "CatalogEntry{msgid='" + msgid + "'"
                + (msgidPlural != null ? ", msgidPlural='" + msgidPlural + "'" : "")
                + ", translated=" + isTranslated() + "}";
    }
}
