package com.todotrail.core.todo;

import com.todotrail.core.model.TodoStatus;

import java.util.List;

/**
 * Roll-up of a todo's direct children.
 *
 * @param title           the summarized todo's title
 * @param status          status derived from the children
 * @param objectives      first sentence of each phase or session child
 * @param progress        child counts by state
 * @param keyDependencies distinct ids the children are blocked by
 * @param nextSteps       titles of up to five open task children
 */
public record TodoSummary(
    String title,
    TodoStatus status,
    List<String> objectives,
    Progress progress,
    List<String> keyDependencies,
    List<String> nextSteps
) {

    public record Progress(int completed, int inProgress, int pending, int total) {
    }
}
