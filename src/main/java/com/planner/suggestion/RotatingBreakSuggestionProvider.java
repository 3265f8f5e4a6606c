package com.planner.suggestion;

import java.util.List;

/**
 * Deterministic provider: cycles through the suggestions by schedule position.
 */
public class RotatingBreakSuggestionProvider implements BreakSuggestionProvider {

    private final List<String> suggestions;

    public RotatingBreakSuggestionProvider() {
        this(DEFAULT_SUGGESTIONS);
    }

    public RotatingBreakSuggestionProvider(List<String> suggestions) {
        if (suggestions == null || suggestions.isEmpty()) {
            throw new IllegalArgumentException("At least one suggestion is required");
        }
        this.suggestions = List.copyOf(suggestions);
    }

    @Override
    public String suggest(int breakMinutes, int position) {
        int index = Math.floorMod(position - 1, suggestions.size());
        return suggestions.get(index);
    }
}
