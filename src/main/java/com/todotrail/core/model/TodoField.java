package com.todotrail.core.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * The mutable content fields of a {@link Todo}: the ones recorded in change-log diffs and
 * restored by rollbacks.
 * <p>
 * Identity ({@code id}, {@code tier}, {@code createdAt}), {@code updatedAt}, citations and
 * scope violations are not content fields and never appear here.
 */
public enum TodoField {
    TITLE("title", Todo::title, (b, t) -> b.title(t.title())),
    DESCRIPTION("description", Todo::description, (b, t) -> b.description(t.description())),
    STATUS("status", Todo::status, (b, t) -> b.status(t.status())),
    PARENT_ID("parentId", Todo::parentId, (b, t) -> b.parentId(t.parentId())),
    PLANNING_DOC_PATH("planningDocPath", Todo::planningDocPath, (b, t) -> b.planningDocPath(t.planningDocPath())),
    PLANNING_DOC_SECTION("planningDocSection", Todo::planningDocSection,
            (b, t) -> b.planningDocSection(t.planningDocSection())),
    COMPLETED_AT("completedAt", Todo::completedAt, (b, t) -> b.completedAt(t.completedAt())),
    BLOCKED_BY("blockedBy", Todo::blockedBy, (b, t) -> b.blockedBy(t.blockedBy())),
    BLOCKS("blocks", Todo::blocks, (b, t) -> b.blocks(t.blocks())),
    TAGS("tags", Todo::tags, (b, t) -> b.tags(t.tags())),
    METADATA("metadata", Todo::metadata, (b, t) -> b.metadata(t.metadata())),
    SCOPE("scope", Todo::scope, (b, t) -> b.scope(t.scope()));

    private final String fieldName;
    private final Function<Todo, Object> getter;
    private final BiConsumer<Todo.Builder, Todo> copier;

    TodoField(String fieldName, Function<Todo, Object> getter, BiConsumer<Todo.Builder, Todo> copier) {
        this.fieldName = fieldName;
        this.getter = getter;
        this.copier = copier;
    }

    /** Name used in JSON and change-log diffs. */
    public String fieldName() {
        return fieldName;
    }

    public Object get(Todo todo) {
        return getter.apply(todo);
    }

    /** Copies this field's value from {@code source} into {@code target}. */
    public void copy(Todo source, Todo.Builder target) {
        copier.accept(target, source);
    }

    public static Optional<TodoField> fromName(String name) {
        for (TodoField field : values()) {
            if (field.fieldName.equals(name) || field.name().equalsIgnoreCase(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    /** Fields whose values differ between the two todos. */
    public static Set<TodoField> diff(Todo before, Todo after) {
        Set<TodoField> changed = EnumSet.noneOf(TodoField.class);
        for (TodoField field : values()) {
            if (!Objects.equals(field.get(before), field.get(after))) {
                changed.add(field);
            }
        }
        return changed;
    }

    /** Partial snapshot of the given fields, keyed by field name, in declaration order. */
    public static Map<String, Object> snapshot(Todo todo, Collection<TodoField> fields) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (TodoField field : values()) {
            if (fields.contains(field)) {
                values.put(field.fieldName, field.get(todo));
            }
        }
        return values;
    }

    public static Map<String, Object> snapshot(Todo todo) {
        return snapshot(todo, EnumSet.allOf(TodoField.class));
    }
}
