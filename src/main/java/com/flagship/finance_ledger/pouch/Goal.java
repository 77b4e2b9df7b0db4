package com.flagship.finance_ledger.pouch;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Savings goal, optionally linked to a pouch. {@code monthlyContribution} is
 * recomputed by {@link GoalService} whenever the target amount, current amount
 * or target date change.
 */
@Value
@Builder(toBuilder = true)
public class Goal {
    String id;
    String ownerId;
    String pouchId;
    String title;
    BigDecimal targetAmount;
    BigDecimal currentAmount;
    LocalDate targetDate;
    BigDecimal monthlyContribution;
    boolean active;

    public BigDecimal progressPercentage() {
        if (targetAmount.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return currentAmount.multiply(BigDecimal.valueOf(100)).divide(targetAmount, 2, RoundingMode.HALF_UP);
    }

    /**
     * Past the target date without having reached the target amount.
     */
    public boolean isBehindSchedule(LocalDate today) {
        return today.isAfter(targetDate) && currentAmount.compareTo(targetAmount) < 0;
    }
}
