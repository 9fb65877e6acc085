package com.pulpulitiko.importprocessor.validation;

import java.util.List;

/**
 * Proposes close catalog values for a name that did not match exactly.
 */
public interface SuggestionEngine {

    /**
     * @param target     the unmatched input
     * @param candidates catalog names, in catalog order
     * @param limit      maximum number of suggestions
     * @return at most {@code limit} candidates, best first; empty when nothing is close
     */
    List<String> suggest(String target, List<String> candidates, int limit);
}
