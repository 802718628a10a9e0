package com.tomlformatter.toml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A possibly dotted TOML key. Every part keeps the spelling it had in the source
 * (bare, "basic" or 'literal') next to its decoded value.
 */
public final class TomlKey {
    private final List<Part> parts;

    public TomlKey(List<Part> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("a key needs at least one part");
        }
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public List<Part> getParts() {
        return parts;
    }

    /**
     * Source spelling of the parts joined by dots, without surrounding whitespace.
     */
    public String render() {
        return parts.stream().map(Part::getRaw).collect(Collectors.joining("."));
    }

    /**
     * Decoded parts joined by dots; what key sorting compares.
     */
    public String sortKey() {
        return String.join(".", path());
    }

    public List<String> path() {
        return parts.stream().map(Part::getValue).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return render();
    }

    public static final class Part {
        private final String raw;
        private final String value;

        public Part(String raw, String value) {
            this.raw = raw;
            this.value = value;
        }

        public String getRaw() {
            return raw;
        }

        public String getValue() {
            return value;
        }
    }
}
