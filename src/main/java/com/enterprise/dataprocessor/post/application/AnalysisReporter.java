package com.enterprise.dataprocessor.post.application;

import com.enterprise.dataprocessor.post.domain.AggregateRow;
import com.enterprise.dataprocessor.post.domain.AnalysisReport;
import com.enterprise.dataprocessor.post.domain.AnalysisReport.ExecutionInfo;
import com.enterprise.dataprocessor.post.domain.AnalysisReport.Summary;
import com.enterprise.dataprocessor.post.domain.DerivedRecord;
import com.enterprise.dataprocessor.post.domain.RunContext;

import java.time.Clock;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.SortedMap;

/**
 * Assembles the {@link AnalysisReport} of a run.
 *
 * <p>Summary values come straight from the records, not from the breakdown,
 * so the dataset-wide mean is never built from already-rounded group means.
 * The summary mean keeps full precision. An empty batch yields zeros.
 */
public class AnalysisReporter {

    private final Clock clock;

    public AnalysisReporter(Clock clock) {
        this.clock = clock;
    }

    public AnalysisReport buildReport(
            List<DerivedRecord> records,
            SortedMap<Integer, AggregateRow> breakdown,
            RunContext context) {

        IntSummaryStatistics titles = records.stream()
            .mapToInt(DerivedRecord::titleLength)
            .summaryStatistics();
        long totalWords = records.stream()
            .mapToLong(DerivedRecord::wordCount)
            .sum();

        Summary summary = new Summary(
            records.size(),
            breakdown.size(),
            titles.getAverage(),
            totalWords,
            records.isEmpty() ? 0 : titles.getMin(),
            records.isEmpty() ? 0 : titles.getMax());

        ExecutionInfo info = new ExecutionInfo(
            context.jobName(),
            context.executionId(),
            context.manualTrigger(),
            clock.instant());

        return new AnalysisReport(info, summary, breakdown);
    }
}
