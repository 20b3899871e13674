package org.pragmatica.wikitext.include;

import org.pragmatica.wikitext.tree.IncludeStatus;

import java.util.List;

/**
 * Reason an include could not be expanded. Recovered locally, never propagated.
 */
public sealed interface ResolutionError {
    PageRef page();

    String message();

    /**
     * Status recorded on the placeholder left in the text.
     */
    IncludeStatus status();

    record NotFound(PageRef page) implements ResolutionError {
        @Override
        public String message() {
            return "Page '" + page + "' not found";
        }

        @Override
        public IncludeStatus status() {
            return IncludeStatus.NOT_FOUND;
        }
    }

    /**
     * The page is already being expanded further up the include chain.
     *
     * @param chain active chain, outermost include first
     */
    record Cyclic(PageRef page, List<PageRef> chain) implements ResolutionError {
        public Cyclic {
            chain = List.copyOf(chain);
        }

        @Override
        public String message() {
            return "Page '" + page + "' includes itself through " + chain;
        }

        @Override
        public IncludeStatus status() {
            return IncludeStatus.CYCLIC_INCLUDE;
        }
    }

    /**
     * The resolver itself failed.
     */
    record ResolverFailure(PageRef page, String reason) implements ResolutionError {
        @Override
        public String message() {
            return "Resolver failed for page '" + page + "': " + reason;
        }

        @Override
        public IncludeStatus status() {
            return IncludeStatus.RESOLVER_ERROR;
        }
    }
}
