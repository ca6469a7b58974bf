package com.chipilink.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Human-readable string in the three languages the clients support.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocalizedText(String es, String en, String zh) {

    public static final String DEFAULT_LANGUAGE = "es";

    public static LocalizedText of(String es, String en, String zh) {
        return new LocalizedText(es, en, zh);
    }

    /** Text for {@code language}, falling back to Spanish. */
    public String in(String language) {
        String value = null;
        if ("en".equals(language)) {
            value = en;
        } else if ("zh".equals(language)) {
            value = zh;
        }
        return value != null ? value : es;
    }

    public static boolean isSupported(String language) {
        return "es".equals(language) || "en".equals(language) || "zh".equals(language);
    }
}
