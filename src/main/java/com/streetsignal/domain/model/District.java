package com.streetsignal.domain.model;

import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Postcode district (outcode) such as {@code E1} or {@code SW1}.
 * Always held in normalized form: trimmed and upper-cased.
 */
@EqualsAndHashCode
public final class District {

    private final String code;

    private District(String code) {
        this.code = code;
    }

    /**
     * Normalizes and validates a raw district identifier.
     *
     * @throws IllegalArgumentException if the input is null or blank
     */
    public static District of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("District must not be blank");
        }
        return new District(raw.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Splits free text on commas and line breaks, dropping blank entries.
     */
    public static List<District> parseList(String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(text.split("[,\\r\\n]+"))
            .filter(token -> !token.isBlank())
            .map(District::of)
            .toList();
    }

    public String getCode() {
        return code;
    }

    /**
     * A postcode belongs to this district when its compact upper-case form starts
     * with the district code. Sub-districts sharing the prefix (SE17 for SE1) match too.
     */
    public boolean matchesPostcode(String postcode) {
        if (postcode == null || postcode.isBlank()) {
            return true;
        }
        String compact = postcode.replace(" ", "").toUpperCase(Locale.ROOT);
        return compact.startsWith(code);
    }

    @Override
    public String toString() {
        return code;
    }
}
