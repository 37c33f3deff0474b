package com.routergen.core.generator;

import java.util.List;

/**
 * A phrasing style for the user query, with a short description and examples
 * shown to the model.
 */
public final class QueryStyle {

    private final String       name;
    private final String       description;
    private final List<String> examples;

    public QueryStyle(String name, String description, List<String> examples) {
        this.name        = name;
        this.description = description;
        this.examples    = List.copyOf(examples);
    }

    public String       getName()        { return name; }
    public String       getDescription() { return description; }
    public List<String> getExamples()    { return examples; }
}
