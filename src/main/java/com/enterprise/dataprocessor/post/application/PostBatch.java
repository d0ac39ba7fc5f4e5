package com.enterprise.dataprocessor.post.application;

import com.enterprise.dataprocessor.post.domain.AnalysisReport;
import com.enterprise.dataprocessor.post.domain.DerivedRecord;
import com.enterprise.dataprocessor.post.domain.RawRecord;
import com.enterprise.dataprocessor.post.domain.RunContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Job-scoped hand-off between the steps of one run. Each step reads what the
 * previous step stored; the {@link RunContext} is fixed at construction.
 */
public class PostBatch {

    private final RunContext context;
    private List<RawRecord> rawRecords = List.of();
    private final List<DerivedRecord> derivedRecords = new ArrayList<>();
    private AnalysisReport report;

    public PostBatch(RunContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public RunContext context() {
        return context;
    }

    public void setRawRecords(List<RawRecord> rawRecords) {
        this.rawRecords = List.copyOf(rawRecords);
    }

    public List<RawRecord> rawRecords() {
        return rawRecords;
    }

    public void addDerivedRecords(Collection<? extends DerivedRecord> records) {
        derivedRecords.addAll(records);
    }

    public List<DerivedRecord> derivedRecords() {
        return List.copyOf(derivedRecords);
    }

    public void setReport(AnalysisReport report) {
        this.report = report;
    }

    public AnalysisReport report() {
        if (report == null) {
            throw new IllegalStateException("Report has not been built for execution " + context.executionId());
        }
        return report;
    }
}
