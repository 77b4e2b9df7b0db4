package com.flagship.finance_ledger.migration;

import com.flagship.finance_ledger.common.exception.MigrationException;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an apply or rollback run on one shard or across all of them.
 *
 * Failures are per shard and per version; a failure on one shard says
 * nothing about the others, whose steps are listed in {@link #completed}.
 */
@Value
public class MigrationReport {
    List<MigrationStep> completed;
    List<MigrationStep> skipped;
    List<MigrationException> failures;

    public static MigrationReport empty() {
        return new MigrationReport(List.of(), List.of(), List.of());
    }

    public static MigrationReport failed(MigrationException failure) {
        return new MigrationReport(List.of(), List.of(), List.of(failure));
    }

    public static MigrationReport merge(List<MigrationReport> reports) {
        List<MigrationStep> completed = new ArrayList<>();
        List<MigrationStep> skipped = new ArrayList<>();
        List<MigrationException> failures = new ArrayList<>();
        for (MigrationReport report : reports) {
            completed.addAll(report.getCompleted());
            skipped.addAll(report.getSkipped());
            failures.addAll(report.getFailures());
        }
        return new MigrationReport(List.copyOf(completed), List.copyOf(skipped), List.copyOf(failures));
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    /**
     * Throws the first failure, with any further failures attached as suppressed.
     */
    public void throwIfFailed() {
        if (failures.isEmpty()) {
            return;
        }
        MigrationException first = failures.get(0);
        failures.stream().skip(1).forEach(first::addSuppressed);
        throw first;
    }
}
