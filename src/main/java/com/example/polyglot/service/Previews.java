package com.example.polyglot.service;

/**
 * Shortened strings for progress lines.
 */
final class Previews {

    private Previews() {
    }

    static String of(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String flat = text.replace('\n', ' ');
        return flat.length() > maxChars ? flat.substring(0, maxChars) + "..." : flat;
    }
}
