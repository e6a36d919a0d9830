package com.example.polyglot.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Custom deserializer for {@link TranslationValue}.
 * Accepts the legacy bare-string form and the structured {@code msgstr} object form.
 */
public class TranslationValueDeserializer extends JsonDeserializer<TranslationValue> {

    @Override
    public TranslationValue deserialize(JsonParser parser, DeserializationContext context)
            throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        return fromNode(node);
    }

    @Override
    public TranslationValue getNullValue(DeserializationContext context) {
        return new TranslationValue.MissingTranslation("null value");
    }

    public static TranslationValue fromNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return new TranslationValue.MissingTranslation("null value");
        }
        if (node.isTextual()) {
            return new TranslationValue.LegacyText(node.asText());
        }
        if (!node.isObject()) {
            return new TranslationValue.MissingTranslation("unsupported value type " + node.getNodeType());
        }

        JsonNode msgstr = node.get("msgstr");
        if (msgstr == null) {
            return new TranslationValue.MissingTranslation("missing 'msgstr' field");
        }
        if (msgstr.isTextual()) {
            return new TranslationValue.SingularText(msgstr.asText());
        }
        if (msgstr.isArray()) {
            List<String> forms = new ArrayList<>(msgstr.size());
            for (JsonNode form : msgstr) {
                forms.add(form != null && !form.isNull() ? form.asText() : "");
            }
            return new TranslationValue.PluralForms(forms);
        }
        return new TranslationValue.MissingTranslation("unsupported 'msgstr' type " + msgstr.getNodeType());
    }
}
