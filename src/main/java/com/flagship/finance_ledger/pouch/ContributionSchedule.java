package com.flagship.finance_ledger.pouch;

import com.flagship.finance_ledger.common.Amounts;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.Period;

/**
 * Savings-goal arithmetic.
 */
public final class ContributionSchedule {

    private ContributionSchedule() {
        // Utility class
    }

    /**
     * Whole calendar months from {@code today} until {@code targetDate}, a
     * started month counting as a full one, and never less than 1.
     */
    public static int monthsRemaining(LocalDate today, LocalDate targetDate) {
        Period period = Period.between(today, targetDate);
        long months = period.toTotalMonths();
        if (period.getDays() > 0) {
            months++;
        }
        return (int) Math.max(1, months);
    }

    /**
     * (target - current) / monthsRemaining, rounded half-up to cents.
     * A goal that is already reached needs no contribution.
     */
    public static BigDecimal monthlyContribution(BigDecimal targetAmount, BigDecimal currentAmount,
                                                 LocalDate targetDate, LocalDate today) {
        BigDecimal remaining = targetAmount.subtract(currentAmount);
        if (remaining.signum() <= 0) {
            return Amounts.zero();
        }
        return remaining.divide(BigDecimal.valueOf(monthsRemaining(today, targetDate)), Amounts.SCALE, RoundingMode.HALF_UP);
    }
}
