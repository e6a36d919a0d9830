package com.example.polyglot.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * Translation supplied for one msgid in a translation file.
 * <ul>
 *   <li>{@link LegacyText}: a bare JSON string</li>
 *   <li>{@link SingularText}: {@code {"msgstr": "..."}}</li>
 *   <li>{@link PluralForms}: {@code {"msgstr": ["...", "..."]}}</li>
 *   <li>{@link MissingTranslation}: an object without a usable {@code msgstr}</li>
 * </ul>
 */
@JsonDeserialize(using = TranslationValueDeserializer.class)
public interface TranslationValue {

    record LegacyText(String text) implements TranslationValue {}

    record SingularText(String text) implements TranslationValue {}

    /** Plural translations ordered by plural index. */
    record PluralForms(List<String> forms) implements TranslationValue {
        public PluralForms {
            forms = List.copyOf(forms);
        }

        public boolean allBlank() {
            return forms.stream().allMatch(String::isBlank);
        }
    }

    record MissingTranslation(String reason) implements TranslationValue {}
}
