package com.routergen.core.dataset;

import com.routergen.core.example.Example;
import com.routergen.core.schema.ToolKind;
import com.routergen.core.validator.RejectionReason;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of re-validating an existing JSONL dataset.
 */
public final class AuditReport {

    private final Path                          file;
    private final int                           total;
    private final int                           duplicates;
    private final Map<RejectionReason, Integer> rejectedByReason;
    private final Map<ToolKind, Integer>        validByKind;
    private final List<String>                  sampleIssues;
    private final List<Example>                 validExamples;

    AuditReport(Path file, int total, int duplicates,
                Map<RejectionReason, Integer> rejectedByReason,
                Map<ToolKind, Integer> validByKind,
                List<String> sampleIssues,
                List<Example> validExamples) {
        this.file             = file;
        this.total            = total;
        this.duplicates       = duplicates;
        this.rejectedByReason = Collections.unmodifiableMap(new EnumMap<>(rejectedByReason));
        this.validByKind      = Collections.unmodifiableMap(new EnumMap<>(validByKind));
        this.sampleIssues     = List.copyOf(sampleIssues);
        this.validExamples    = List.copyOf(validExamples);
    }

    public Path                          getFile()             { return file; }
    public int                           getTotal()            { return total; }
    public int                           getValid()            { return validExamples.size(); }
    public int                           getDuplicates()       { return duplicates; }
    public Map<RejectionReason, Integer> getRejectedByReason() { return rejectedByReason; }
    public Map<ToolKind, Integer>        getValidByKind()      { return validByKind; }
    public List<String>                  getSampleIssues()     { return sampleIssues; }
    public List<Example>                 getValidExamples()    { return validExamples; }

    public int getInvalid() {
        return total - getValid();
    }

    public double validRatio() {
        return total == 0 ? 0.0 : (double) getValid() / total;
    }
}
