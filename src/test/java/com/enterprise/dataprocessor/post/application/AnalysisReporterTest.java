package com.enterprise.dataprocessor.post.application;

import com.enterprise.dataprocessor.post.domain.AggregateRow;
import com.enterprise.dataprocessor.post.domain.AnalysisReport;
import com.enterprise.dataprocessor.post.domain.DerivedRecord;
import com.enterprise.dataprocessor.post.domain.RawRecord;
import com.enterprise.dataprocessor.post.domain.RunContext;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

class AnalysisReporterTest {

    private static final Instant STARTED = Instant.parse("2024-05-01T08:30:00Z");
    private static final Instant COMPLETED = Instant.parse("2024-05-01T08:30:05Z");
    private static final RunContext CONTEXT = new RunContext("nightly-posts", "exec-42", true, STARTED);

    private final AnalysisReporter reporter =
        new AnalysisReporter(Clock.fixed(COMPLETED, ZoneOffset.UTC));
    private final PostTransformer transformer = new PostTransformer();
    private final PostAggregator aggregator = new PostAggregator();

    @Test
    void summarizesExampleBatch() {
        List<DerivedRecord> records = transformer.transform(List.of(
            new RawRecord(1, "AB", "a b c", 1),
            new RawRecord(2, "CDE", "d e", 1),
            new RawRecord(3, "F", "g", 2)), STARTED);

        AnalysisReport report = reporter.buildReport(records, aggregator.aggregate(records), CONTEXT);

        assertThat(report.summary()).isEqualTo(new AnalysisReport.Summary(3, 2, 2.0, 6, 1, 3));
        assertThat(report.breakdown()).containsExactly(
            entry(1, new AggregateRow(2, 2.5, 5)),
            entry(2, new AggregateRow(1, 1.0, 1)));
    }

    @Test
    void executionInfoCarriesRunContextAndCompletionTime() {
        AnalysisReport report = reporter.buildReport(List.of(), new TreeMap<>(), CONTEXT);

        assertThat(report.executionInfo()).isEqualTo(
            new AnalysisReport.ExecutionInfo("nightly-posts", "exec-42", true, COMPLETED));
    }

    @Test
    void summaryMeanKeepsFullPrecision() {
        List<DerivedRecord> records = transformer.transform(List.of(
            new RawRecord(1, "abc", "", 1),
            new RawRecord(2, "abc", "", 2),
            new RawRecord(3, "abcd", "", 3)), STARTED);

        AnalysisReport report = reporter.buildReport(records, aggregator.aggregate(records), CONTEXT);

        assertThat(report.summary().avgTitleLength()).isEqualTo(10.0 / 3);
    }

    @Test
    void summaryMatchesBreakdownInvariants() {
        List<DerivedRecord> records = transformer.transform(
            new FallbackPostGenerator().generate(10), STARTED);
        SortedMap<Integer, AggregateRow> breakdown = aggregator.aggregate(records);

        AnalysisReport.Summary summary = reporter.buildReport(records, breakdown, CONTEXT).summary();

        assertThat(breakdown.values().stream().mapToInt(AggregateRow::count).sum())
            .isEqualTo(summary.totalRecords());
        assertThat(breakdown).hasSize(summary.uniqueGroups());
        assertThat(records).allSatisfy(r -> assertThat(r.titleLength())
            .isBetween(summary.minTitleLength(), summary.maxTitleLength()));
        assertThat(summary.minTitleLength()).isEqualTo(19);
        assertThat(summary.maxTitleLength()).isEqualTo(20);
        assertThat(summary.totalWordCount()).isEqualTo(70);
    }

    @Test
    void emptyBatchYieldsZeroSummary() {
        AnalysisReport report = reporter.buildReport(List.of(), new TreeMap<>(), CONTEXT);

        assertThat(report.summary()).isEqualTo(new AnalysisReport.Summary(0, 0, 0.0, 0, 0, 0));
        assertThat(report.breakdown()).isEmpty();
    }
}
