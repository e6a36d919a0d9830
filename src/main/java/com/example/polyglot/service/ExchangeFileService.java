package com.example.polyglot.service;

import com.example.polyglot.model.ExchangeFileException;
import com.example.polyglot.model.ExchangeRecord;
import com.example.polyglot.model.TranslationValue;
import com.example.polyglot.model.TranslationValueDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON files exchanged with translation providers.
 * <ul>
 *   <li>extraction output: array of {@code {"msgid", "msgid_plural"?}}</li>
 *   <li>translations: object {@code msgid -> string | {"msgstr": string | [string...]}}, or an
 *       array of records carrying {@code msgid} and {@code msgstr}</li>
 * </ul>
 */
@Service
public class ExchangeFileService {

    private static final Logger log = LoggerFactory.getLogger(ExchangeFileService.class);

    private final ObjectMapper objectMapper;

    public ExchangeFileService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void writeRecords(Path file, List<ExchangeRecord> records) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), records);
        } catch (IOException e) {
            throw new ExchangeFileException("Unable to write exchange file " + file + ": " + e.getMessage(), e);
        }
        log.info("Written {} records to {}", records.size(), file);
    }

    /**
     * Loads several translation files in order. Missing files are reported and ignored; a msgid
     * present in more than one file takes the value of the last one.
     */
    public Map<String, TranslationValue> loadTranslations(List<Path> files) {
        Map<String, TranslationValue> translations = new LinkedHashMap<>();
        for (Path file : files) {
            if (!Files.isRegularFile(file)) {
                log.warn("Translation file {} not found", file);
                continue;
            }
            log.info("Loading translations from: {}", file);
            Map<String, TranslationValue> loaded = readTranslations(file);
            translations.putAll(loaded);
            log.info("  Loaded {} translations from {}", loaded.size(), file);
        }
        return translations;
    }

    public Map<String, TranslationValue> readTranslations(Path file) {
        JsonNode root = readJson(file);
        Map<String, TranslationValue> translations = new LinkedHashMap<>();

        if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                translations.put(field.getKey(), TranslationValueDeserializer.fromNode(field.getValue()));
            }
        } else if (root.isArray()) {
            for (JsonNode item : root) {
                JsonNode msgid = item.get("msgid");
                if (item.isObject() && msgid != null && msgid.isTextual()) {
                    translations.put(msgid.asText(), TranslationValueDeserializer.fromNode(item));
                } else {
                    log.warn("Unexpected translation format in {}: {}", file, item);
                }
            }
        } else {
            throw new ExchangeFileException(
                    "Translation file " + file + " must contain a JSON object or array", null);
        }
        return translations;
    }

    /** Flat {@code "dotted.key": "text"} map, e.g. help texts keyed by the symbol they document. */
    public Map<String, String> readSymbolTexts(Path file) {
        JsonNode root = readJson(file);
        if (!root.isObject()) {
            throw new ExchangeFileException("Symbol text file " + file + " must contain a JSON object", null);
        }
        Map<String, String> texts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual()) {
                texts.put(field.getKey(), field.getValue().asText());
            }
        }
        return texts;
    }

    public JsonNode readJson(Path file) {
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || root.isMissingNode()) {
                throw new ExchangeFileException("JSON file " + file + " is empty", null);
            }
            return root;
        } catch (IOException e) {
            throw new ExchangeFileException("Unable to read JSON file " + file + ": " + e.getMessage(), e);
        }
    }
}
