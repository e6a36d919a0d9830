package com.example.polyglot.service;

import com.example.polyglot.config.PolyglotProperties;
import com.example.polyglot.model.Catalog;
import com.example.polyglot.model.CatalogEntry;
import com.example.polyglot.model.MergeResult;
import com.example.polyglot.model.TranslationValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Applies externally produced translations to a catalog in place.
 * <p>
 * Rules per record, in map order:
 * <ul>
 *   <li>unknown msgid: counted as not found</li>
 *   <li>empty or whitespace-only translation: skipped</li>
 *   <li>shape mismatch (plural forms for a singular entry or the reverse), missing
 *       {@code msgstr}: skipped with a warning</li>
 *   <li>value equal to the current translation: no change, not counted</li>
 *   <li>otherwise the translation is written, the fuzzy flag cleared, and the record counted
 *       as updated</li>
 * </ul>
 * A single string offered for a plural entry is not written to its {@code msgstr}: a plural
 * entry is only filled from a list of forms, so such records count as skipped rather than
 * updated.
 * <p>
 * Nothing here touches the filesystem; persisting the catalog is the caller's job.
 */
@Service
public class MergeService {

    private static final Logger log = LoggerFactory.getLogger(MergeService.class);

    private static final int PLURAL_PREVIEW = 30;

    private enum Outcome { UPDATED, SKIPPED, UNCHANGED }

    private final int previewLength;

    public MergeService(PolyglotProperties properties) {
        this.previewLength = properties.extraction().previewLength();
    }

    public MergeResult merge(Catalog catalog, Map<String, TranslationValue> translations) {
        int updated = 0;
        int skipped = 0;
        int notFound = 0;

        for (Map.Entry<String, TranslationValue> item : translations.entrySet()) {
            String msgid = item.getKey();
            Optional<CatalogEntry> entry = catalog.find(msgid);
            if (entry.isEmpty()) {
                notFound++;
                log.warn("msgid not found in catalog: {}", Previews.of(msgid, previewLength));
                continue;
            }

            switch (apply(entry.get(), item.getValue())) {
                case UPDATED -> updated++;
                case SKIPPED -> skipped++;
                case UNCHANGED -> { }
            }
        }

        return new MergeResult(translations.size(), updated, skipped, notFound);
    }

    private Outcome apply(CatalogEntry entry, TranslationValue value) {
        if (value instanceof TranslationValue.LegacyText legacy) {
            return applySingular(entry, legacy.text());
        }
        if (value instanceof TranslationValue.SingularText singular) {
            return applySingular(entry, singular.text());
        }
        if (value instanceof TranslationValue.PluralForms plural) {
            return applyPlural(entry, plural);
        }
        String reason = value instanceof TranslationValue.MissingTranslation missing
                ? missing.reason()
                : "no translation value";
        log.warn("Translation for '{}' has no usable msgstr ({}), skipping",
                Previews.of(entry.getMsgid(), previewLength), reason);
        return Outcome.SKIPPED;
    }

    private Outcome applySingular(CatalogEntry entry, String text) {
        if (text == null || text.isBlank()) {
            return Outcome.SKIPPED;
        }
        if (entry.isPlural()) {
            log.warn("Translation is a single string but catalog entry has plural forms: {}",
                    Previews.of(entry.getMsgid(), previewLength));
            return Outcome.SKIPPED;
        }
        if (text.equals(entry.getMsgstr())) {
            return Outcome.UNCHANGED;
        }

        entry.setMsgstr(text);
        entry.setFuzzy(false);
        log.info("Updated: {} -> {}", Previews.of(entry.getMsgid(), previewLength), Previews.of(text, previewLength));
        return Outcome.UPDATED;
    }

    private Outcome applyPlural(CatalogEntry entry, TranslationValue.PluralForms plural) {
        if (!entry.isPlural()) {
            log.warn("Translation has plural forms but catalog entry doesn't: {}",
                    Previews.of(entry.getMsgid(), previewLength));
            return Outcome.SKIPPED;
        }
        if (plural.allBlank()) {
            return Outcome.SKIPPED;
        }

        List<String> forms = plural.forms();
        Map<Integer, String> existing = entry.getMsgstrPlural();
        boolean needsUpdate = false;
        for (int i = 0; i < forms.size(); i++) {
            if (!forms.get(i).equals(existing.get(i))) {
                needsUpdate = true;
                break;
            }
        }
        if (!needsUpdate) {
            return Outcome.UNCHANGED;
        }

        for (int i = 0; i < forms.size(); i++) {
            entry.setPluralForm(i, forms.get(i));
        }
        entry.setFuzzy(false);
        log.info("Updated plural: {} -> [{}]",
                Previews.of(entry.getMsgid(), PLURAL_PREVIEW),
                forms.stream().map(f -> Previews.of(f, PLURAL_PREVIEW)).collect(Collectors.joining(" / ")));
        return Outcome.UPDATED;
    }
}
