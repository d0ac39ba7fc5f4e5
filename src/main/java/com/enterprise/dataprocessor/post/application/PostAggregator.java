package com.enterprise.dataprocessor.post.application;

import com.enterprise.dataprocessor.post.domain.AggregateRow;
import com.enterprise.dataprocessor.post.domain.DerivedRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups derived records by group id in a single pass.
 *
 * <p>The mean title length is computed exactly from the integer sum and
 * rounded to {@value #AVERAGE_SCALE} decimal places with
 * {@link RoundingMode#HALF_EVEN}. Rows iterate in ascending group id order.
 */
public class PostAggregator {

    static final int AVERAGE_SCALE = 2;

    public SortedMap<Integer, AggregateRow> aggregate(List<DerivedRecord> records) {
        SortedMap<Integer, GroupAccumulator> groups = new TreeMap<>();
        for (DerivedRecord record : records) {
            groups.computeIfAbsent(record.groupId(), k -> new GroupAccumulator()).add(record);
        }

        SortedMap<Integer, AggregateRow> rows = new TreeMap<>();
        groups.forEach((groupId, acc) -> rows.put(groupId, acc.toRow()));
        return Collections.unmodifiableSortedMap(rows);
    }

    static double roundedMean(long sum, int count) {
        return BigDecimal.valueOf(sum)
            .divide(BigDecimal.valueOf(count), AVERAGE_SCALE, RoundingMode.HALF_EVEN)
            .doubleValue();
    }

    private static final class GroupAccumulator {

        private int count;
        private long titleLengthSum;
        private long wordCountTotal;

        void add(DerivedRecord record) {
            count++;
            titleLengthSum += record.titleLength();
            wordCountTotal += record.wordCount();
        }

        AggregateRow toRow() {
            return new AggregateRow(count, roundedMean(titleLengthSum, count), wordCountTotal);
        }
    }
}
