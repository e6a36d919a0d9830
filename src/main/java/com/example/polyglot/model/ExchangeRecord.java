package com.example.polyglot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Untranslated string handed to a translation provider.
 * Serialized as {@code {"msgid": ..., "msgid_plural": ...}}; the plural key is omitted for
 * singular entries.
 *
 * @param msgid       source string, unique within one extraction run
 * @param msgidPlural source plural form, or {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExchangeRecord(
        @JsonProperty("msgid") String msgid,
        @JsonProperty("msgid_plural") String msgidPlural
) {
    public static ExchangeRecord of(CatalogEntry entry) {
        return new ExchangeRecord(entry.getMsgid(), entry.getMsgidPlural());
    }

    public boolean isPlural() {
        return msgidPlural != null;
    }
}
