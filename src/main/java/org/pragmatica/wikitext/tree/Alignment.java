package org.pragmatica.wikitext.tree;

import java.util.Optional;

/**
 * Text alignment of a legacy alignment block ({@code [[<]]}, {@code [[>]]}, {@code [[=]]}, {@code [[==]]}).
 */
public enum Alignment {
    LEFT("<"),
    RIGHT(">"),
    CENTER("="),
    JUSTIFY("==");

    private final String marker;

    Alignment(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }

    public static Optional<Alignment> fromMarker(String marker) {
        for (var alignment : values()) {
            if (alignment.marker.equals(marker)) {
                return Optional.of(alignment);
            }
        }
        return Optional.empty();
    }
}
