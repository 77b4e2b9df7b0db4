package com.flagship.finance_ledger.shard;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Equality-filtered read against one collection, with optional ordering and limit.
 */
@Value
@Builder
public class RecordQuery {
    @Singular
    Map<String, Object> filters;
    String orderBy;
    boolean descending;
    Integer limit;

    public static RecordQuery where(String column, Object value) {
        return RecordQuery.builder().filter(column, value).build();
    }
}
