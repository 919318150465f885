package io.github.jakubt4.transitfinder.service.search;

import io.github.jakubt4.transitfinder.domain.SearchTask;

import java.util.List;

/**
 * Tasks generated for a search, and the coverage lost while generating them.
 */
public record TaskPlan(List<SearchTask> tasks, List<String> warnings) {

    public TaskPlan {
        tasks = List.copyOf(tasks);
        warnings = List.copyOf(warnings);
    }
}
