package com.todotrail.core.citation;

import com.todotrail.core.model.Citation;
import com.todotrail.core.model.CitationContext;
import com.todotrail.core.model.CitationPriority;
import com.todotrail.core.model.CitationType;

/**
 * Filters for {@link CitationEngine#query}. Null components do not filter.
 *
 * @param todoId           only citations on this todo
 * @param changeLogId      only citations of this change
 * @param type             exact citation type
 * @param priority         exact priority
 * @param minPriority      priority at or above
 * @param context          citations relevant at this junction
 * @param unreviewed       true for unreviewed only, false for reviewed only
 * @param includeDismissed whether dismissed citations are reported
 */
public record CitationQuery(
    String todoId,
    String changeLogId,
    CitationType type,
    CitationPriority priority,
    CitationPriority minPriority,
    CitationContext context,
    Boolean unreviewed,
    boolean includeDismissed
) {

    public static CitationQuery all() {
        return new CitationQuery(null, null, null, null, null, null, null, false);
    }

    public CitationQuery forTodo(String id) {
        return new CitationQuery(id, changeLogId, type, priority, minPriority, context, unreviewed, includeDismissed);
    }

    public CitationQuery forChange(String id) {
        return new CitationQuery(todoId, id, type, priority, minPriority, context, unreviewed, includeDismissed);
    }

    public CitationQuery ofType(CitationType t) {
        return new CitationQuery(todoId, changeLogId, t, priority, minPriority, context, unreviewed, includeDismissed);
    }

    public CitationQuery withPriority(CitationPriority p) {
        return new CitationQuery(todoId, changeLogId, type, p, minPriority, context, unreviewed, includeDismissed);
    }

    public CitationQuery atLeast(CitationPriority p) {
        return new CitationQuery(todoId, changeLogId, type, priority, p, context, unreviewed, includeDismissed);
    }

    public CitationQuery inContext(CitationContext c) {
        return new CitationQuery(todoId, changeLogId, type, priority, minPriority, c, unreviewed, includeDismissed);
    }

    public CitationQuery reviewed(boolean reviewed) {
        return new CitationQuery(todoId, changeLogId, type, priority, minPriority, context, !reviewed, includeDismissed);
    }

    public CitationQuery includingDismissed() {
        return new CitationQuery(todoId, changeLogId, type, priority, minPriority, context, unreviewed, true);
    }

    boolean matches(String citationTodoId, Citation citation) {
        if (todoId != null && !todoId.equals(citationTodoId)) return false;
        if (changeLogId != null && !changeLogId.equals(citation.changeLogId())) return false;
        if (type != null && type != citation.type()) return false;
        if (priority != null && priority != citation.priority()) return false;
        if (minPriority != null && !citation.priority().atLeast(minPriority)) return false;
        if (context != null && !citation.context().contains(context)) return false;
        if (unreviewed != null && unreviewed == citation.isReviewed()) return false;
        return includeDismissed || !citation.isDismissed();
    }
}
