package com.dogfold.scaffold.codegen.target;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import lombok.Getter;

/**
 * Alternate spellings of target keys, plus the target used when none is selected.
 * Lookups are case-insensitive.
 */
public class AliasTable {

    @Getter
    private final String defaultTarget;
    private final Map<String, String> aliases;

    public AliasTable(String defaultTarget, Map<String, String> aliases) {
        this.defaultTarget = normalize(defaultTarget);
        Map<String, String> normalized = new LinkedHashMap<>();
        aliases.forEach((alias, key) -> normalized.put(normalize(alias), normalize(key)));
        this.aliases = Collections.unmodifiableMap(normalized);
    }

    /**
     * Maps a selector to its canonical key. Null or blank selects the default target; names
     * without an alias are returned lowercased.
     */
    public String canonicalKey(String selector) {
        if (selector == null || selector.isBlank()) {
            return defaultTarget;
        }
        String key = normalize(selector);
        return aliases.getOrDefault(key, key);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
