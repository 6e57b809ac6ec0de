package com.studioflow.finance.dto;

import com.studioflow.finance.util.MoneyUtils;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outstanding receivables or payables grouped by days past due.
 */
@Getter
public class AgingReport {

    public static final String BUCKET_0_30 = "0-30";
    public static final String BUCKET_31_60 = "31-60";
    public static final String BUCKET_61_90 = "61-90";
    public static final String BUCKET_90_PLUS = "90+";

    private final LocalDate asOf;
    private final Map<String, List<AgingRow>> buckets = new LinkedHashMap<>();
    private final Map<String, BigDecimal> totals = new LinkedHashMap<>();

    public AgingReport(LocalDate asOf) {
        this.asOf = asOf;
        for (String key : List.of(BUCKET_0_30, BUCKET_31_60, BUCKET_61_90, BUCKET_90_PLUS)) {
            buckets.put(key, new ArrayList<>());
            totals.put(key, MoneyUtils.zero());
        }
    }

    public static String bucketFor(long daysOverdue) {
        if (daysOverdue <= 30)
            return BUCKET_0_30;
        if (daysOverdue <= 60)
            return BUCKET_31_60;
        if (daysOverdue <= 90)
            return BUCKET_61_90;
        return BUCKET_90_PLUS;
    }

    public void add(AgingRow row) {
        String key = bucketFor(row.getDaysOverdue());
        buckets.get(key).add(row);
        totals.put(key, totals.get(key).add(row.getOutstanding()));
    }

    public List<AgingRow> getRows(String bucket) {
        return Collections.unmodifiableList(buckets.getOrDefault(bucket, List.of()));
    }

    public BigDecimal getGrandTotal() {
        return MoneyUtils.sum(totals.values().stream());
    }
}
