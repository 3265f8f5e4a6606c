package com.planner.suggestion;

import java.util.List;

/**
 * Supplies the cosmetic break idea attached to scheduled tasks.
 * Kept behind an interface so schedules stay reproducible in tests.
 */
public interface BreakSuggestionProvider {

    List<String> DEFAULT_SUGGESTIONS = List.of(
            "Stretch and walk around for a bit",
            "Grab a glass of water",
            "Rest your eyes by looking at something far away",
            "Take a few slow, deep breaths",
            "Step outside for some fresh air",
            "Tidy up your workspace"
    );

    /**
     * @param breakMinutes Length of the break being suggested
     * @param position     1-based position of the task the break follows
     * @return Suggestion text, never null
     */
    String suggest(int breakMinutes, int position);
}
