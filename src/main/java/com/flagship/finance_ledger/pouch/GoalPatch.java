package com.flagship.finance_ledger.pouch;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial goal update; null fields are left unchanged.
 */
@Value
@Builder
public class GoalPatch {
    String title;
    BigDecimal targetAmount;
    BigDecimal currentAmount;
    LocalDate targetDate;
    Boolean active;

    boolean changesSchedule() {
        return targetAmount != null || currentAmount != null || targetDate != null;
    }
}
