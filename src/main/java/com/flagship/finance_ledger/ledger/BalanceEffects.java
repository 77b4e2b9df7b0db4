package com.flagship.finance_ledger.ledger;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Signed balance changes per account and per pouch.
 *
 * Keys are kept sorted so balance rows are always written, and therefore
 * locked, in the same order.
 */
public final class BalanceEffects {

    private final Map<String, BigDecimal> accountDeltas;
    private final Map<String, BigDecimal> pouchDeltas;

    private BalanceEffects(Map<String, BigDecimal> accountDeltas, Map<String, BigDecimal> pouchDeltas) {
        this.accountDeltas = accountDeltas;
        this.pouchDeltas = pouchDeltas;
    }

    public static BalanceEffects none() {
        return new BalanceEffects(new TreeMap<>(), new TreeMap<>());
    }

    /**
     * The full effect an active transaction has on balances: its signed amount
     * on the account, and on pouches either each split's signed amount or,
     * without splits, the signed amount on the directly referenced pouch.
     */
    public static BalanceEffects of(Transaction transaction) {
        BalanceEffects effects = none();
        TransactionType type = transaction.getType();
        effects.addAccount(transaction.getAccountId(), type.effect(transaction.getAmount()));
        if (transaction.hasSplits()) {
            for (TransactionSplit split : transaction.getSplits()) {
                effects.addPouch(split.getPouchId(), type.effect(split.getAmount()));
            }
        } else if (transaction.getPouchId() != null) {
            effects.addPouch(transaction.getPouchId(), type.effect(transaction.getAmount()));
        }
        return effects;
    }

    public static BalanceEffects transfer(String fromAccountId, String toAccountId, BigDecimal amount) {
        BalanceEffects effects = none();
        effects.addAccount(fromAccountId, amount.negate());
        effects.addAccount(toAccountId, amount);
        return effects;
    }

    /**
     * this - other, per account and per pouch.
     */
    public BalanceEffects minus(BalanceEffects other) {
        BalanceEffects result = copy(UnaryOperator.identity());
        other.accountDeltas.forEach((id, delta) -> result.addAccount(id, delta.negate()));
        other.pouchDeltas.forEach((id, delta) -> result.addPouch(id, delta.negate()));
        return result;
    }

    public BalanceEffects negate() {
        return copy(BigDecimal::negate);
    }

    /**
     * Non-zero account deltas, in key order.
     */
    public Map<String, BigDecimal> accountDeltas() {
        return nonZero(accountDeltas);
    }

    /**
     * Non-zero pouch deltas, in key order.
     */
    public Map<String, BigDecimal> pouchDeltas() {
        return nonZero(pouchDeltas);
    }

    public boolean isEmpty() {
        return accountDeltas().isEmpty() && pouchDeltas().isEmpty();
    }

    private void addAccount(String accountId, BigDecimal delta) {
        accountDeltas.merge(accountId, delta, BigDecimal::add);
    }

    private void addPouch(String pouchId, BigDecimal delta) {
        pouchDeltas.merge(pouchId, delta, BigDecimal::add);
    }

    private BalanceEffects copy(UnaryOperator<BigDecimal> operator) {
        BalanceEffects result = none();
        accountDeltas.forEach((id, delta) -> result.addAccount(id, operator.apply(delta)));
        pouchDeltas.forEach((id, delta) -> result.addPouch(id, operator.apply(delta)));
        return result;
    }

    private static Map<String, BigDecimal> nonZero(Map<String, BigDecimal> deltas) {
        Map<String, BigDecimal> result = new TreeMap<>();
        deltas.forEach((id, delta) -> {
            if (delta.signum() != 0) {
                result.put(id, delta);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "BalanceEffects{accounts=" + accountDeltas() + ", pouches=" + pouchDeltas() + "}";
    }
}
