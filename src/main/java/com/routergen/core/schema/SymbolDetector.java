package com.routergen.core.schema;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a natural-language query names a literal code symbol
 * (identifier, call, constant, qualified name) as opposed to a concept.
 *
 * Drives the exact-vs-semantic consistency rule for codebase_search.
 */
public final class SymbolDetector {

    private static final Pattern BACKTICKED      = Pattern.compile("`[^`\\s][^`]*`");
    private static final Pattern CALL_SYNTAX     = Pattern.compile("\\b[A-Za-z_][A-Za-z0-9_.]*\\(");
    private static final Pattern CAMEL_CASE      = Pattern.compile("\\b[a-z]+[A-Z][A-Za-z0-9]*\\b");
    private static final Pattern PASCAL_COMPOUND = Pattern.compile("\\b[A-Z][a-z0-9]+[A-Z][A-Za-z0-9]*\\b");
    private static final Pattern SNAKE_CASE      = Pattern.compile("\\b[a-z0-9]+_[a-z0-9_]+\\b");
    private static final Pattern SCREAMING_CASE  = Pattern.compile("\\b[A-Z][A-Z0-9]*_[A-Z0-9_]+\\b");
    private static final Pattern QUALIFIED_NAME  = Pattern.compile("\\b[A-Za-z_]\\w+\\.[A-Za-z_]\\w+\\b");
    private static final Pattern DECLARATION     = Pattern.compile(
            "\\b(?:class|def|function|func|fn|interface|struct|enum|method|type)\\s+([A-Za-z_][A-Za-z0-9_]*)");

    private static final List<Pattern> DIRECT_PATTERNS = List.of(
            BACKTICKED, CALL_SYNTAX, CAMEL_CASE, PASCAL_COMPOUND, SNAKE_CASE, SCREAMING_CASE, QUALIFIED_NAME
    );

    // "the function that validates ..." is prose, not a declaration
    private static final Set<String> DECLARATION_STOPWORDS = Set.of(
            "that", "which", "where", "for", "to", "the", "a", "an", "in", "of", "is", "are",
            "responsible", "handling", "used", "called", "and", "or", "with", "we", "it", "does"
    );

    private SymbolDetector() {
    }

    public static boolean namesLiteralSymbol(String query) {
        return findSymbol(query).isPresent();
    }

    /** First literal symbol found in the query, if any. */
    public static Optional<String> findSymbol(String query) {
        if (query == null || query.isBlank()) return Optional.empty();

        for (Pattern pattern : DIRECT_PATTERNS) {
            Matcher m = pattern.matcher(query);
            if (m.find()) {
                return Optional.of(m.group());
            }
        }

        Matcher decl = DECLARATION.matcher(query);
        while (decl.find()) {
            String name = decl.group(1);
            if (!DECLARATION_STOPWORDS.contains(name.toLowerCase())) {
                return Optional.of(decl.group());
            }
        }
        return Optional.empty();
    }
}
