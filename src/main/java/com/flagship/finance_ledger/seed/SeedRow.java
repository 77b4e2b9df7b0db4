package com.flagship.finance_ledger.seed;

import com.flagship.finance_ledger.shard.RecordCollection;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One record to insert, with its primary key already fixed.
 */
@Value
@Builder
public class SeedRow {
    RecordCollection collection;
    @Singular
    Map<String, Object> values;

    public static SeedRowBuilder into(RecordCollection collection) {
        return builder().collection(collection);
    }
}
