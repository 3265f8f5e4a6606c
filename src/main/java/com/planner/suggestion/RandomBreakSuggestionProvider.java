package com.planner.suggestion;

import java.util.List;
import java.util.Random;

/**
 * Picks a suggestion at random. Pass a seed to make the sequence repeatable.
 */
public class RandomBreakSuggestionProvider implements BreakSuggestionProvider {

    private final List<String> suggestions;
    private final Random random;

    public RandomBreakSuggestionProvider() {
        this(DEFAULT_SUGGESTIONS, new Random());
    }

    public RandomBreakSuggestionProvider(long seed) {
        this(DEFAULT_SUGGESTIONS, new Random(seed));
    }

    public RandomBreakSuggestionProvider(List<String> suggestions, Random random) {
        if (suggestions == null || suggestions.isEmpty()) {
            throw new IllegalArgumentException("At least one suggestion is required");
        }
        this.suggestions = List.copyOf(suggestions);
        this.random = random;
    }

    @Override
    public String suggest(int breakMinutes, int position) {
        return suggestions.get(random.nextInt(suggestions.size()));
    }
}
