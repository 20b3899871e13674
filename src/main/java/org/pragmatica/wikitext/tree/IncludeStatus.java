package org.pragmatica.wikitext.tree;

import java.util.Optional;

/**
 * Why an include directive is still present in the tree as a placeholder.
 */
public enum IncludeStatus {
    /**
     * No resolver was supplied during preprocessing, the directive was left as written.
     */
    UNRESOLVED("unresolved"),
    NOT_FOUND("not-found"),
    CYCLIC_INCLUDE("cyclic-include"),
    RESOLVER_ERROR("resolver-error");

    private final String reason;

    IncludeStatus(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }

    public static Optional<IncludeStatus> fromReason(String reason) {
        for (var status : values()) {
            if (status.reason.equalsIgnoreCase(reason)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
