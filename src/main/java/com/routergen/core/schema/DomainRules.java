package com.routergen.core.schema;

import com.routergen.config.ValidationPolicy;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Domain-logic ("anti-hallucination") rules, one per variant.
 *
 * Each factory closes over the {@link ValidationPolicy} so thresholds stay
 * configurable. Rules return null when valid, otherwise the violation text.
 */
public final class DomainRules {

    /** Whole words only, so "show" and "scan" are not read as "how" and "can". */
    private static final List<Pattern> QUESTION_MARKERS = Stream.of(
                    "what", "how", "which", "should", "can", "could", "would", "do you", "is it")
            .map(word -> Pattern.compile("\\b" + Pattern.quote(word) + "\\b"))
            .collect(Collectors.toList());

    private DomainRules() {
    }

    // =========================================================================
    // codebase_search
    // =========================================================================

    public static DomainRule codebaseSearch(ValidationPolicy policy) {
        return (call, userQuery) -> {
            CodebaseSearchCall search = (CodebaseSearchCall) call;
            String term = search.getQuery().trim();

            if (term.length() < policy.getMinSearchTermLength()) {
                return "Codebase search query too short: '" + term + "'";
            }
            if (policy.getGenericSearchTerms().contains(term.toLowerCase(Locale.ROOT))) {
                return "Search query too generic: '" + term + "'";
            }

            Optional<String> symbol = SymbolDetector.findSymbol(userQuery);
            switch (search.getMode()) {
                case EXACT:
                case HYBRID:
                    if (symbol.isEmpty()) {
                        return "mode=" + search.getMode().getWire()
                                + " but the query names no literal symbol (expected semantic)";
                    }
                    return null;
                case SEMANTIC:
                    if (symbol.isPresent()) {
                        return "mode=semantic but the query names literal symbol '"
                                + symbol.get() + "' (expected exact or hybrid)";
                    }
                    return null;
                default:
                    return "Unhandled search mode " + search.getMode();
            }
        };
    }

    // =========================================================================
    // file_manager
    // =========================================================================

    public static DomainRule fileManager(ValidationPolicy policy) {
        return (call, userQuery) -> {
            FileManagerCall file = (FileManagerCall) call;
            String path = file.getPath();

            if (path == null || path.isBlank()) {
                return "File manager missing path";
            }
            String normalized = normalizePath(path);
            if (normalized.startsWith("../") || normalized.contains("/../")
                    || normalized.endsWith("/..") || normalized.equals("..")) {
                return "Path escapes the workspace: '" + path + "'";
            }
            if (policy.isRequirePathInQuery() && !pathAppearsIn(normalized, userQuery)) {
                return "Path '" + path + "' is not stated in the query";
            }

            if (file.getOperation() == FileOperation.PATCH) {
                if (file.getTargetString() == null || file.getTargetString().isEmpty()) {
                    return "Patch operation missing target_string";
                }
                if (file.getReplacementString() == null) {
                    return "Patch operation missing replacement_string (empty string allowed)";
                }
                if (file.getTargetString().equals(file.getReplacementString())) {
                    return "Patch target and replacement are identical";
                }
            }
            return null;
        };
    }

    static String normalizePath(String path) {
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private static boolean pathAppearsIn(String normalizedPath, String userQuery) {
        if (userQuery == null) return false;
        return userQuery.replace('\\', '/').contains(normalizedPath);
    }

    // =========================================================================
    // sandbox_exec
    // =========================================================================

    public static DomainRule sandboxExec(ValidationPolicy policy) {
        return (call, userQuery) -> {
            SandboxExecCall exec = (SandboxExecCall) call;
            String code = exec.getCode();

            if (code == null || code.isBlank()) {
                return "Sandbox execution missing code";
            }
            for (String pattern : policy.getDangerousCodePatterns()) {
                if (code.contains(pattern)) {
                    return "Sandbox code contains dangerous pattern '" + pattern + "'";
                }
            }
            int timeout = exec.effectiveTimeout();
            if (timeout < 1 || timeout > policy.getMaxSandboxTimeout()) {
                return "Sandbox timeout " + timeout + "s outside 1.." + policy.getMaxSandboxTimeout();
            }
            return null;
        };
    }

    // =========================================================================
    // ask_human
    // =========================================================================

    public static DomainRule askHuman(ValidationPolicy policy) {
        // keywords match at a word start: "dropping" counts as "drop", "skill" is not "kill"
        List<Pattern> dangerousKeywords = policy.getDangerousQueryKeywords().stream()
                .map(word -> Pattern.compile("\\b" + Pattern.quote(word.toLowerCase(Locale.ROOT))))
                .collect(Collectors.toList());

        return (call, userQuery) -> {
            AskHumanCall ask = (AskHumanCall) call;
            String question = ask.getQuestion().trim();

            if (question.length() < 5) {
                return "ask_human question too short";
            }

            String lowerQuestion = question.toLowerCase(Locale.ROOT);
            boolean looksLikeQuestion = lowerQuestion.contains("?")
                    || QUESTION_MARKERS.stream().anyMatch(p -> p.matcher(lowerQuestion).find());
            if (!looksLikeQuestion) {
                String lowerQuery = userQuery == null ? "" : userQuery.toLowerCase(Locale.ROOT);
                boolean dangerousRequest = dangerousKeywords.stream()
                        .anyMatch(p -> p.matcher(lowerQuery).find());
                if (!dangerousRequest) {
                    return "ask_human content doesn't appear to be a question";
                }
            }
            return null;
        };
    }
}
