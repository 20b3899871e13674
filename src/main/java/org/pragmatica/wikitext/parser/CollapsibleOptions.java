package org.pragmatica.wikitext.parser;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Display settings of a {@code [[collapsible]]} block read from its arguments.
 *
 * <p>{@code folded} takes a boolean ({@code yes}/{@code no}, {@code true}/{@code false},
 * {@code on}/{@code off}, {@code 1}/{@code 0}) and defaults to folded. {@code hideLocation} is one
 * of {@code top}, {@code bottom}, {@code both}, {@code neither} or {@code none} and defaults to
 * {@code top}.
 */
public record CollapsibleOptions(boolean startOpen,
                                 Optional<String> showText,
                                 Optional<String> hideText,
                                 boolean showTop,
                                 boolean showBottom,
                                 Map<String, String> attributes) {

    /**
     * Read the settings, or empty when {@code folded} or {@code hideLocation} has a value outside its set.
     */
    public static Optional<CollapsibleOptions> from(Map<String, String> attributes) {
        var folded = Optional.ofNullable(attributes.get("folded"))
                             .map(CollapsibleOptions::parseBoolean)
                             .orElse(Optional.of(true));
        var location = Optional.ofNullable(attributes.get("hidelocation"))
                               .map(CollapsibleOptions::parseHideLocation)
                               .orElse(Optional.of(Placement.TOP));
        if (folded.isEmpty() || location.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CollapsibleOptions(!folded.get(),
                                                  Optional.ofNullable(attributes.get("show")),
                                                  Optional.ofNullable(attributes.get("hide")),
                                                  location.get().top(),
                                                  location.get().bottom(),
                                                  attributes));
    }

    static Optional<Boolean> parseBoolean(String value) {
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> Optional.of(true);
            case "false", "no", "off", "0" -> Optional.of(false);
            default -> Optional.empty();
        };
    }

    private record Placement(boolean top, boolean bottom) {
        static final Placement TOP = new Placement(true, false);
    }

    private static Optional<Placement> parseHideLocation(String value) {
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "top" -> Optional.of(Placement.TOP);
            case "bottom" -> Optional.of(new Placement(false, true));
            case "both" -> Optional.of(new Placement(true, true));
            case "neither", "none" -> Optional.of(new Placement(false, false));
            default -> Optional.empty();
        };
    }
}
