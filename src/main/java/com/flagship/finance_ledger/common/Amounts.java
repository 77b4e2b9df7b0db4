package com.flagship.finance_ledger.common;

import com.flagship.finance_ledger.common.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary amounts are stored as DECIMAL(15,2); everything entering the
 * ledger is normalized to scale 2 here.
 */
public final class Amounts {

    public static final int SCALE = 2;

    private Amounts() {
        // Utility class
    }

    /**
     * @throws ValidationException if the amount is missing, not positive, or has more than two decimals
     */
    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        if (amount == null) {
            throw new ValidationException(field + " is required");
        }
        if (amount.signum() <= 0) {
            throw new ValidationException(field + " must be positive, got " + amount.toPlainString());
        }
        return normalize(amount, field);
    }

    public static BigDecimal normalize(BigDecimal amount, String field) {
        try {
            return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new ValidationException(field + " has more than " + SCALE + " decimal places: " + amount.toPlainString());
        }
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }
}
