package com.todotrail.core.citation;

import com.todotrail.core.model.Citation;

/**
 * A citation together with the todo that carries it.
 */
public record TodoCitation(String todoId, Citation citation) {
}
