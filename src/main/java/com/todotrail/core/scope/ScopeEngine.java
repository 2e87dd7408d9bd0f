package com.todotrail.core.scope;

import com.todotrail.core.error.ScopeViolationException;
import com.todotrail.core.model.AbstractionLevel;
import com.todotrail.core.model.DetailLevel;
import com.todotrail.core.model.Scope;
import com.todotrail.core.model.ScopeCorrection;
import com.todotrail.core.model.ScopeCorrectionType;
import com.todotrail.core.model.ScopeViolation;
import com.todotrail.core.model.ScopeViolationType;
import com.todotrail.core.model.Todo;
import com.todotrail.core.model.TodoTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps todo content at the abstraction level of its tier.
 * <p>
 * All operations are pure: they inspect the todo they are given and return a result, never
 * touching storage.
 */
@Service
public class ScopeEngine {

    private static final Logger log = LoggerFactory.getLogger(ScopeEngine.class);

    private static final List<String> STRUCTURAL_DETAILS = List.of("file_paths", "code_identifiers");

    public Scope defaultScope(TodoTier tier) {
        return switch (tier) {
            case FEATURE -> new Scope(tier, AbstractionLevel.HIGH, DetailLevel.HIGH_LEVEL,
                    List.of("objectives", "phases", "major_milestones"),
                    withStructural("implementation", "specific_technologies", "code"), null);
            case PHASE -> new Scope(tier, AbstractionLevel.MEDIUM_HIGH, DetailLevel.FOCUSED,
                    List.of("objectives", "sessions", "dependencies", "high_level_tasks"),
                    withStructural("implementation_details", "specific_apis", "code_snippets"), null);
            case SESSION -> new Scope(tier, AbstractionLevel.MEDIUM, DetailLevel.FOCUSED,
                    List.of("objectives", "tasks", "dependencies", "approach"),
                    withStructural("specific_code", "detailed_implementation_steps"), null);
            case TASK -> new Scope(tier, AbstractionLevel.LOW, DetailLevel.GRANULAR,
                    List.of(Scope.ALL_DETAILS), List.of(), null);
        };
    }

    private static List<String> withStructural(String... details) {
        List<String> all = new ArrayList<>(List.of(details));
        all.addAll(STRUCTURAL_DETAILS);
        return all;
    }

    /**
     * Derives the scope for {@code todo}'s tier. With a parent, restrictions the parent carries
     * beyond its own tier default are inherited, so a scope only narrows going down the tree.
     */
    public Scope assignScope(Todo todo, Todo parent) {
        Scope base = defaultScope(todo.tier());
        if (parent == null) {
            return base;
        }
        Scope parentScope = parent.scope() != null ? parent.scope() : defaultScope(parent.tier());
        Scope parentDefault = defaultScope(parent.tier());

        Set<String> forbidden = new LinkedHashSet<>(base.forbiddenDetails());
        parentScope.forbiddenDetails().stream()
                .filter(d -> !parentDefault.forbids(d))
                .forEach(forbidden::add);

        List<String> allowed = base.allowedDetails().stream()
                .filter(d -> !forbidden.contains(d))
                .toList();
        return new Scope(base.level(), base.abstraction(), base.detailLevel(), allowed,
                List.copyOf(forbidden), parent.id());
    }

    /**
     * Scans title and description for detail finer than the todo's scope allows.
     * Todos without a scope are checked against their tier default.
     */
    public List<ScopeViolation> detectScopeCreep(Todo todo) {
        Scope scope = effectiveScope(todo);
        List<ScopeViolation> violations = new ArrayList<>();
        if (scope == null || scope.allowsEverything() && scope.forbiddenDetails().isEmpty()) {
            return violations;
        }

        for (String detailType : scope.forbiddenDetails()) {
            locate(todo, detailType).ifPresent(location -> violations.add(new ScopeViolation(
                    ScopeViolationType.FORBIDDEN_DETAIL, detailType, location,
                    "Todo contains forbidden detail type: " + detailType,
                    "Move " + detailType.replace('_', ' ') + " to a " + targetTierFor(detailType).value()
                            + "-level todo")));
        }

        String text = text(todo);
        if (scope.abstraction() == AbstractionLevel.HIGH && DetailPatterns.containsMediumLevelDetails(text)) {
            violations.add(new ScopeViolation(ScopeViolationType.ABSTRACTION_VIOLATION, null, "description",
                    "High-level todo contains medium-level details",
                    "Summarize the work at feature level and leave phase or session planning to child todos"));
        }
        if (scope.detailLevel() == DetailLevel.HIGH_LEVEL && DetailPatterns.containsGranularDetails(text)) {
            violations.add(new ScopeViolation(ScopeViolationType.DETAIL_LEVEL_VIOLATION, null, "description",
                    "High-level detail todo contains granular details",
                    "Drop step-by-step or code wording from this todo"));
        }
        return violations;
    }

    /**
     * Scope creep plus consistency of the scope itself: its level must match the tier, its
     * abstraction must be the tier's, and it may not be coarser than the parent's.
     */
    public ScopeValidation validate(Todo todo, Todo parent) {
        Scope scope = todo.scope() != null ? todo.scope() : assignScope(todo, parent);
        Todo checked = todo.scope() != null ? todo : todo.toBuilder().scope(scope).build();
        List<ScopeViolation> violations = new ArrayList<>();

        if (scope.level() != todo.tier()) {
            violations.add(new ScopeViolation(ScopeViolationType.SCOPE_TIER_MISMATCH, null, "scope",
                    "Scope level " + value(scope.level()) + " does not match tier " + value(todo.tier()),
                    "Reassign the default scope for " + value(todo.tier())));
        }
        AbstractionLevel expected = AbstractionLevel.expectedFor(todo.tier());
        if (scope.abstraction() != expected) {
            violations.add(new ScopeViolation(ScopeViolationType.ABSTRACTION_VIOLATION, null, "scope",
                    "Abstraction " + value(scope.abstraction()) + " not appropriate for tier " + value(todo.tier()),
                    "Use abstraction " + expected.value()));
        }
        if (parent != null) {
            Scope parentScope = parent.scope() != null ? parent.scope() : defaultScope(parent.tier());
            if (scope.abstraction() != null && parentScope.abstraction() != null
                    && scope.abstraction().coarseness() > parentScope.abstraction().coarseness()) {
                violations.add(new ScopeViolation(ScopeViolationType.ABSTRACTION_VIOLATION, null, "scope",
                        "Abstraction " + scope.abstraction().value() + " is coarser than parent "
                                + parent.id() + " (" + parentScope.abstraction().value() + ")",
                        "A child may not be more abstract than its parent"));
            }
            if (scope.detailLevel() != null && parentScope.detailLevel() != null
                    && scope.detailLevel().coarseness() > parentScope.detailLevel().coarseness()) {
                violations.add(new ScopeViolation(ScopeViolationType.DETAIL_LEVEL_VIOLATION, null, "scope",
                        "Detail level " + scope.detailLevel().value() + " is coarser than parent "
                                + parent.id() + " (" + parentScope.detailLevel().value() + ")",
                        "A child may not be less detailed than its parent"));
            }
        }
        violations.addAll(detectScopeCreep(checked));
        return new ScopeValidation(scope, violations);
    }

    /**
     * Applies the scope policy.
     *
     * @return the todo with its scope assigned and, in warn mode, its violations attached
     * @throws ScopeViolationException in block mode when any violation is found
     */
    public Todo enforceScope(Todo todo, Todo parent, ScopeMode mode) {
        ScopeValidation validation = validate(todo, parent);
        Todo.Builder scoped = todo.toBuilder().scope(validation.scope());
        if (validation.isValid()) {
            return scoped.scopeViolations(List.of()).build();
        }
        if (mode == ScopeMode.BLOCK) {
            throw new ScopeViolationException("Scope validation failed for " + todo.id() + ": "
                    + validation.violations().size() + " violation(s)", validation.violations());
        }
        log.warn("Todo {} saved with {} scope violation(s)", todo.id(), validation.violations().size());
        return scoped.scopeViolations(validation.violations()).build();
    }

    public List<ScopeCorrection> suggestCorrections(List<ScopeViolation> violations) {
        List<ScopeCorrection> corrections = new ArrayList<>();
        for (ScopeViolation violation : violations) {
            switch (violation.type()) {
                case FORBIDDEN_DETAIL -> {
                    String detail = violation.detailType() != null ? violation.detailType() : "detail";
                    if ("code_snippets".equals(detail) || "code".equals(detail)) {
                        corrections.add(new ScopeCorrection(ScopeCorrectionType.REMOVE_DETAIL, detail,
                                "task-level-todo", null, "Code belongs in the implementation, not in the plan"));
                    } else {
                        corrections.add(new ScopeCorrection(ScopeCorrectionType.MOVE_DETAIL, detail,
                                targetTierFor(detail).value() + "-level-todo", null,
                                "Detail is too granular for this tier"));
                    }
                }
                case ABSTRACTION_VIOLATION, DETAIL_LEVEL_VIOLATION -> corrections.add(new ScopeCorrection(
                        ScopeCorrectionType.SUMMARIZE_DETAIL, violation.description(), null,
                        summarize(violation.description()),
                        "Detail should be summarized for this abstraction level"));
                case SCOPE_TIER_MISMATCH -> corrections.add(new ScopeCorrection(
                        ScopeCorrectionType.ADJUST_SCOPE, violation.description(), null, null,
                        violation.suggestion()));
            }
        }
        return corrections;
    }

    private Scope effectiveScope(Todo todo) {
        if (todo.scope() != null) {
            return todo.scope();
        }
        return todo.tier() == null ? null : defaultScope(todo.tier());
    }

    private static Optional<String> locate(Todo todo, String detailType) {
        var inTitle = DetailPatterns.firstMatch(detailType, todo.title());
        if (inTitle.isPresent()) {
            return Optional.of("title@" + inTitle.get());
        }
        return DetailPatterns.firstMatch(detailType, todo.description()).map(offset -> "description@" + offset);
    }

    private static TodoTier targetTierFor(String detailType) {
        return switch (detailType) {
            case "implementation", "specific_technologies", "specific_apis" -> TodoTier.SESSION;
            default -> TodoTier.TASK;
        };
    }

    private static String summarize(String description) {
        if (description == null) {
            return null;
        }
        return description.length() <= 50 ? description : description.substring(0, 50) + "...";
    }

    private static String text(Todo todo) {
        return (todo.title() == null ? "" : todo.title()) + " " + (todo.description() == null ? "" : todo.description());
    }

    private static String value(Object level) {
        if (level instanceof TodoTier tier) return tier.value();
        if (level instanceof AbstractionLevel abstraction) return abstraction.value();
        return String.valueOf(level);
    }
}
