package com.todotrail.core.scope;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text markers for each detail category a scope can forbid.
 */
final class DetailPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Map<String, List<Pattern>> CATEGORIES = new LinkedHashMap<>();

    static {
        register("implementation",
                "\\bimplement(s|ed|ing|ation)?\\b", "\\bfunction\\b", "\\bclass\\b", "\\bcode\\b");
        register("specific_technologies",
                "\\bvue(\\.js)?\\b", "\\breact\\b", "\\btypescript\\b", "\\bjavascript\\b",
                "\\bspring boot\\b", "\\bpostgres(ql)?\\b", "\\bdocker\\b", "\\bkubernetes\\b");
        register("code", "```", "\\bfunction\\s+\\w+", "\\b(const|let|var)\\s+\\w+\\s*=");
        register("implementation_details", "\\bstep\\s+\\d+", "\\bfirst\\s+do\\b", "\\bthen\\s+do\\b");
        register("specific_apis", "\\.(get|post|put|patch|delete)\\(", "\\bapi\\.\\w+");
        register("code_snippets", "```[\\s\\S]*?```");
        register("specific_code", "\\bconst\\s+\\w+\\s*=\\s*\\{", "\\bexport\\s+(default\\s+)?function\\b");
        register("detailed_implementation_steps", "\\bstep\\s+\\d+:", "\\bfirst:", "\\bsecond:", "\\bthird:");
        // framework names like Node.js read as file names without the lookahead
        register("file_paths",
                "(?:[\\w.-]+/)+[\\w.-]+\\.[a-z0-9]{1,6}\\b",
                "\\b(?!(?:node|vue|next|nuxt|express|react|angular|ember|three|d3|chart)\\.js\\b)[\\w-]+\\.(java|kt|ts|tsx|js|jsx|vue|py|go|rs|json|ya?ml|xml|md|sql|css|scss|html|sh)\\b");
        CATEGORIES.put("code_identifiers", List.of(
                // camelCase identifiers and call syntax are case-sensitive markers
                Pattern.compile("\\b[a-z]+(?:[A-Z][a-z0-9]*)+\\b"),
                Pattern.compile("\\b[A-Za-z_]\\w*\\(\\)"),
                Pattern.compile("\\b\\w+::\\w+")));
    }

    private static final Pattern MEDIUM_LEVEL_NOUNS = Pattern.compile("\\b(session|task|phase)s?\\b", FLAGS);
    private static final Pattern MEDIUM_LEVEL_VERBS = Pattern.compile("\\b(implement|create|build)\\w*\\b", FLAGS);
    private static final Pattern GRANULAR = Pattern.compile("\\b(step|first|then|finally|code|function|class)\\b", FLAGS);

    private DetailPatterns() {}

    private static void register(String category, String... regexes) {
        CATEGORIES.put(category, Arrays.stream(regexes).map(r -> Pattern.compile(r, FLAGS)).toList());
    }

    /**
     * Earliest match of any marker of {@code category} in {@code text}, as a character offset.
     */
    static Optional<Integer> firstMatch(String category, String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        int best = -1;
        for (Pattern pattern : CATEGORIES.getOrDefault(category, List.of())) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && (best < 0 || matcher.start() < best)) {
                best = matcher.start();
            }
        }
        return best < 0 ? Optional.empty() : Optional.of(best);
    }

    static boolean containsMediumLevelDetails(String text) {
        return MEDIUM_LEVEL_NOUNS.matcher(text).find() && MEDIUM_LEVEL_VERBS.matcher(text).find();
    }

    static boolean containsGranularDetails(String text) {
        return GRANULAR.matcher(text).find();
    }
}
