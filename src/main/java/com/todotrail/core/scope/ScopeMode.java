package com.todotrail.core.scope;

/**
 * What {@link ScopeEngine#enforceScope} does with violations.
 */
public enum ScopeMode {
    /** Attach violations to the todo and continue. */
    WARN,
    /** Reject the todo with a ScopeViolationException. */
    BLOCK
}
