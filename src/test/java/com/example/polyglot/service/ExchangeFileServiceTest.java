package com.example.polyglot.service;

import com.example.polyglot.config.JacksonConfig;
import com.example.polyglot.model.ExchangeFileException;
import com.example.polyglot.model.ExchangeRecord;
import com.example.polyglot.model.TranslationValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeFileServiceTest {

    @TempDir
    Path dir;

    private final ExchangeFileService service = new ExchangeFileService(JacksonConfig.createObjectMapper());

    @Test
    void recordsAreWrittenWithPluralKeyOnlyWhenPresent() throws Exception {
        Path file = dir.resolve("out/translateables.json");

        service.writeRecords(file, List.of(
                new ExchangeRecord("Partner", null),
                new ExchangeRecord("%d item", "%d items")));

        String json = Files.readString(file);
        assertTrue(json.contains("\"msgid\" : \"Partner\""));
        assertTrue(json.contains("\"msgid_plural\" : \"%d items\""));
        assertEquals(1, json.split("msgid_plural", -1).length - 1);
    }

    @Test
    void objectFormIsReadPerValueShape() throws Exception {
        Path file = dir.resolve("translated.json");
        Files.writeString(file, """
                {
                  "Partner": "Partenaire",
                  "Name": {"msgstr": "Nom"},
                  "%d item": {"msgid_plural": "%d items", "msgstr": ["%d élément", "%d éléments"]},
                  "Broken": {"msgid_plural": "x"}
                }
                """);

        Map<String, TranslationValue> translations = service.readTranslations(file);

        assertEquals(List.of("Partner", "Name", "%d item", "Broken"), List.copyOf(translations.keySet()));
        assertEquals(new TranslationValue.LegacyText("Partenaire"), translations.get("Partner"));
        assertEquals(new TranslationValue.SingularText("Nom"), translations.get("Name"));
        assertEquals(new TranslationValue.PluralForms(List.of("%d élément", "%d éléments")), translations.get("%d item"));
        assertInstanceOf(TranslationValue.MissingTranslation.class, translations.get("Broken"));
    }

    @Test
    void arrayFormIsKeyedByMsgid() throws Exception {
        Path file = dir.resolve("translated.json");
        Files.writeString(file, """
                [
                  {"msgid": "Partner", "msgstr": "Partenaire"},
                  {"msgstr": "orphan"},
                  "not an object"
                ]
                """);

        Map<String, TranslationValue> translations = service.readTranslations(file);

        assertEquals(Map.of("Partner", new TranslationValue.SingularText("Partenaire")), translations);
    }

    @Test
    void laterFilesOverrideEarlierOnesAndMissingFilesAreIgnored() throws Exception {
        Path first = dir.resolve("a.json");
        Path second = dir.resolve("b.json");
        Files.writeString(first, "{\"Partner\": \"one\", \"Name\": \"Nom\"}");
        Files.writeString(second, "{\"Partner\": \"two\"}");

        Map<String, TranslationValue> translations =
                service.loadTranslations(List.of(first, dir.resolve("missing.json"), second));

        assertEquals(2, translations.size());
        assertEquals(new TranslationValue.LegacyText("two"), translations.get("Partner"));
    }

    @Test
    void scalarRootIsRejected() throws Exception {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "42");
        assertThrows(ExchangeFileException.class, () -> service.readTranslations(file));
    }

    @Test
    void malformedOrEmptyJsonIsRejected() throws Exception {
        Path malformed = dir.resolve("malformed.json");
        Files.writeString(malformed, "{\"Partner\": ");
        Path empty = dir.resolve("empty.json");
        Files.writeString(empty, "");

        assertThrows(ExchangeFileException.class, () -> service.readTranslations(malformed));
        assertThrows(ExchangeFileException.class, () -> service.readTranslations(empty));
    }

    @Test
    void symbolTextsKeepOnlyStringValues() throws Exception {
        Path file = dir.resolve("help_texts.json");
        Files.writeString(file, "{\"app.Partner.name\": \"The name.\", \"app.Partner.id\": 3}");

        assertEquals(Map.of("app.Partner.name", "The name."), service.readSymbolTexts(file));
    }
}
