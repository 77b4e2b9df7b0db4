package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.account.Account;
import com.flagship.finance_ledger.account.AccountRepository;
import com.flagship.finance_ledger.account.AccountService;
import com.flagship.finance_ledger.account.AccountType;
import com.flagship.finance_ledger.common.CurrencyCode;
import com.flagship.finance_ledger.common.exception.NotFoundException;
import com.flagship.finance_ledger.common.exception.ValidationException;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.pouch.Pouch;
import com.flagship.finance_ledger.pouch.PouchRepository;
import com.flagship.finance_ledger.pouch.PouchService;
import com.flagship.finance_ledger.pouch.PouchVisibility;
import com.flagship.finance_ledger.shard.RecordCollection;
import com.flagship.finance_ledger.shard.ShardRouter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the balance invariants:
 * - account balance = initial balance + signed effects of active transactions
 * - pouch balance = signed apportioned amounts of active transactions and splits
 *
 * Every test works on freshly created accounts and pouches, so tests sharing
 * the in-memory shards never see each other's balances.
 */
@SpringBootTest
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private PouchService pouchService;

    @Autowired
    private BalanceReconciler reconciler;

    @Autowired
    private ShardRouter router;

    @Autowired
    private MeterRegistry meterRegistry;

    private String ownerId;
    private Account account;
    private Pouch pouch1;
    private Pouch pouch2;
    private Pouch pouch3;

    @BeforeEach
    void setUp() {
        ownerId = "user-" + UUID.randomUUID();
        account = accountService.createAccount(ownerId, "Main Checking", AccountType.SAVINGS,
            CurrencyCode.USD, new BigDecimal("5000.00"));
        pouch1 = pouchService.createPouch(ownerId, "Groceries", PouchVisibility.PRIVATE, null, null);
        pouch2 = pouchService.createPouch(ownerId, "Fun", PouchVisibility.PRIVATE, null, null);
        pouch3 = pouchService.createPouch(ownerId, "Travel", PouchVisibility.SHARED, null, null);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private CreateTransactionRequest.CreateTransactionRequestBuilder expense(String amount) {
        return CreateTransactionRequest.builder()
            .ownerId(ownerId)
            .accountId(account.getId())
            .amount(new BigDecimal(amount))
            .type(TransactionType.EXPENSE)
            .currency(CurrencyCode.USD)
            .description("Test expense");
    }

    private BigDecimal accountBalance() {
        return accountService.getAccount(account.getId()).getCurrentBalance();
    }

    private BigDecimal pouchBalance(Pouch pouch) {
        return pouchService.getPouch(pouch.getId()).getBalance();
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "Expected " + expected + " but was " + actual);
    }

    private void assertLedgerConsistent() {
        ReconciliationResult accountCheck = reconciler.reconcileAccount(account.getId());
        assertTrue(accountCheck.isConsistent(), "Account drift: " + accountCheck);
        for (Pouch pouch : List.of(pouch1, pouch2, pouch3)) {
            ReconciliationResult pouchCheck = reconciler.reconcilePouch(pouch.getId());
            assertTrue(pouchCheck.isConsistent(), "Pouch drift: " + pouchCheck);
        }
    }

    private int countRows(String sql, String id) {
        Integer count = router.executorFor(RecordCollection.TRANSACTIONS).jdbc().queryForObject(sql, Integer.class, id);
        return count != null ? count : 0;
    }

    // ========================================================================
    // SCENARIOS
    // ========================================================================

    @Nested
    @DisplayName("1. Balance scenarios")
    class Scenarios {

        @Test
        @DisplayName("1.1 An expense without pouch lowers the account balance only")
        void testExpenseWithoutPouch() {
            // Given: an account opened with 5000.00

            // When: an expense of 45.67 is recorded
            Transaction transaction = ledgerService.createTransaction(expense("45.67").build());

            // Then: the account holds 4954.33 and no pouch moved
            assertAmount("4954.33", accountBalance());
            assertAmount("0.00", pouchBalance(pouch1));
            assertEquals(TransactionType.EXPENSE, transaction.getType());
            assertFalse(transaction.hasSplits());
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("1.2 Updating an expense on a pouch moves the pouch by the difference only")
        void testUpdateAmountOnPouch() {
            // Given: an expense of 100.00 on pouch P1
            Transaction transaction = ledgerService.createTransaction(expense("100.00").pouchId(pouch1.getId()).build());
            assertAmount("-100.00", pouchBalance(pouch1));

            // When: the amount becomes 150.00
            Transaction updated = ledgerService.updateTransaction(transaction.getId(),
                TransactionPatch.builder().amount(new BigDecimal("150.00")).build());

            // Then: P1 is at -150.00, not -250.00
            assertAmount("150.00", updated.getAmount());
            assertAmount("-150.00", pouchBalance(pouch1));
            assertAmount("4850.00", accountBalance());
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("1.3 Deleting the transaction restores pouch and account")
        void testDeleteRestoresBalances() {
            // Given: the updated expense of 1.2
            Transaction transaction = ledgerService.createTransaction(expense("100.00").pouchId(pouch1.getId()).build());
            ledgerService.updateTransaction(transaction.getId(),
                TransactionPatch.builder().amount(new BigDecimal("150.00")).build());

            // When: it is deleted
            ledgerService.deleteTransaction(transaction.getId());

            // Then: balances are back where they started and the record is gone from reads
            assertAmount("0.00", pouchBalance(pouch1));
            assertAmount("5000.00", accountBalance());
            assertTrue(ledgerService.findTransaction(transaction.getId()).isEmpty());
            assertThrows(NotFoundException.class, () -> ledgerService.getTransaction(transaction.getId()));
            assertTrue(ledgerService.listTransactions(ownerId).isEmpty());
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("1.4 Income raises account and pouch")
        void testIncome() {
            ledgerService.createTransaction(expense("250.00").type(TransactionType.INCOME).pouchId(pouch3.getId()).build());

            assertAmount("5250.00", accountBalance());
            assertAmount("250.00", pouchBalance(pouch3));
            assertLedgerConsistent();
        }
    }

    @Nested
    @DisplayName("2. Splits")
    class Splits {

        @Test
        @DisplayName("2.1 Split amounts go to their pouches and the direct pouch is not touched")
        void testSplitsApplied() {
            Transaction transaction = ledgerService.createTransaction(expense("100.00")
                .pouchId(pouch3.getId())
                .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("60.00")))
                .split(SplitAllocation.of(pouch2.getId(), new BigDecimal("40.00")))
                .build());

            assertEquals(2, ledgerService.listSplits(transaction.getId()).size());
            assertAmount("-60.00", pouchBalance(pouch1));
            assertAmount("-40.00", pouchBalance(pouch2));
            assertAmount("0.00", pouchBalance(pouch3));
            assertAmount("4900.00", accountBalance());
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("2.2 Splits summing to less than the amount are allowed")
        void testPartialSplits() {
            ledgerService.createTransaction(expense("100.00")
                .pouchId(pouch3.getId())
                .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("30.00")))
                .build());

            // The unsplit 70.00 stays unallocated, even with a direct pouch set
            assertAmount("-30.00", pouchBalance(pouch1));
            assertAmount("0.00", pouchBalance(pouch3));
            assertAmount("4900.00", accountBalance());
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("2.3 Splits exceeding the amount are rejected and nothing is persisted")
        void testSplitSumExceeded() {
            ValidationException exception = assertThrows(ValidationException.class,
                () -> ledgerService.createTransaction(expense("100.00")
                    .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("60.00")))
                    .split(SplitAllocation.of(pouch2.getId(), new BigDecimal("40.01")))
                    .build()));

            assertTrue(exception.getMessage().contains("exceeds"));
            assertEquals(0, countRows("SELECT COUNT(*) FROM transactions WHERE account_id = ?", account.getId()));
            assertEquals(0, countRows("SELECT COUNT(*) FROM transaction_splits WHERE pouch_id = ?", pouch1.getId()));
            assertAmount("5000.00", accountBalance());
            assertAmount("0.00", pouchBalance(pouch1));
        }

        @Test
        @DisplayName("2.4 Editing splits reverses removed ones, applies added ones and keeps unchanged rows")
        void testSplitDiff() {
            Transaction transaction = ledgerService.createTransaction(expense("100.00")
                .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("30.00")))
                .split(SplitAllocation.of(pouch2.getId(), new BigDecimal("20.00")))
                .build());
            String keptSplitId = transaction.getSplits().stream()
                .filter(split -> split.getPouchId().equals(pouch1.getId()))
                .findFirst()
                .orElseThrow()
                .getId();

            Transaction updated = ledgerService.updateTransaction(transaction.getId(), TransactionPatch.builder()
                .splits(List.of(
                    SplitAllocation.of(pouch1.getId(), new BigDecimal("30.00")),
                    SplitAllocation.of(pouch3.getId(), new BigDecimal("25.00"))))
                .build());

            assertAmount("-30.00", pouchBalance(pouch1));
            assertAmount("0.00", pouchBalance(pouch2));
            assertAmount("-25.00", pouchBalance(pouch3));
            assertAmount("4900.00", accountBalance());
            assertTrue(updated.getSplits().stream().anyMatch(split -> split.getId().equals(keptSplitId)));
            assertEquals(2, countRows("SELECT COUNT(*) FROM transaction_splits WHERE transaction_id = ?", transaction.getId()));
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("2.5 Lowering the amount below the existing splits is rejected")
        void testAmountBelowSplits() {
            Transaction transaction = ledgerService.createTransaction(expense("100.00")
                .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("80.00")))
                .build());

            assertThrows(ValidationException.class, () -> ledgerService.updateTransaction(transaction.getId(),
                TransactionPatch.builder().amount(new BigDecimal("50.00")).build()));

            assertAmount("4900.00", accountBalance());
            assertAmount("-80.00", pouchBalance(pouch1));
            assertAmount("100.00", ledgerService.getTransaction(transaction.getId()).getAmount());
        }

        @Test
        @DisplayName("2.6 An empty split list removes every split and falls back to the direct pouch")
        void testRemoveAllSplits() {
            Transaction transaction = ledgerService.createTransaction(expense("100.00")
                .pouchId(pouch3.getId())
                .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("100.00")))
                .build());

            ledgerService.updateTransaction(transaction.getId(), TransactionPatch.builder().splits(List.of()).build());

            assertAmount("0.00", pouchBalance(pouch1));
            assertAmount("-100.00", pouchBalance(pouch3));
            assertTrue(ledgerService.listSplits(transaction.getId()).isEmpty());
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("2.7 Deleting a split transaction reverses every split")
        void testDeleteWithSplits() {
            Transaction transaction = ledgerService.createTransaction(expense("90.00")
                .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("45.00")))
                .split(SplitAllocation.of(pouch2.getId(), new BigDecimal("45.00")))
                .build());

            ledgerService.deleteTransaction(transaction.getId());

            assertAmount("0.00", pouchBalance(pouch1));
            assertAmount("0.00", pouchBalance(pouch2));
            assertAmount("5000.00", accountBalance());
            assertLedgerConsistent();
        }
    }

    @Nested
    @DisplayName("3. Updates")
    class Updates {

        @Test
        @DisplayName("3.1 Reassigning the pouch moves the full effect from the old pouch to the new one")
        void testPouchReassignment() {
            Transaction transaction = ledgerService.createTransaction(expense("50.00").pouchId(pouch1.getId()).build());

            ledgerService.updateTransaction(transaction.getId(), TransactionPatch.builder()
                .pouchId(pouch2.getId())
                .amount(new BigDecimal("70.00"))
                .build());

            assertAmount("0.00", pouchBalance(pouch1));
            assertAmount("-70.00", pouchBalance(pouch2));
            assertAmount("4930.00", accountBalance());
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("3.2 Changing the type flips the sign of the effect")
        void testTypeChange() {
            Transaction transaction = ledgerService.createTransaction(expense("200.00")
                .type(TransactionType.INCOME).pouchId(pouch1.getId()).build());
            assertAmount("5200.00", accountBalance());

            ledgerService.updateTransaction(transaction.getId(),
                TransactionPatch.builder().type(TransactionType.EXPENSE).build());

            assertAmount("4800.00", accountBalance());
            assertAmount("-200.00", pouchBalance(pouch1));
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("3.3 Clearing the pouch reverses its effect on that pouch")
        void testClearPouch() {
            Transaction transaction = ledgerService.createTransaction(expense("20.00").pouchId(pouch2.getId()).build());

            Transaction updated = ledgerService.updateTransaction(transaction.getId(),
                TransactionPatch.builder().clearPouch(true).description("No pouch").build());

            assertNull(updated.getPouchId());
            assertEquals("No pouch", updated.getDescription());
            assertAmount("0.00", pouchBalance(pouch2));
            assertAmount("4980.00", accountBalance());
        }

        @Test
        @DisplayName("3.4 Updating or deleting a missing transaction is rejected before any write")
        void testMissingTransaction() {
            assertThrows(NotFoundException.class, () -> ledgerService.updateTransaction("missing",
                TransactionPatch.builder().amount(BigDecimal.TEN).build()));
            assertThrows(NotFoundException.class, () -> ledgerService.deleteTransaction("missing"));

            Transaction transaction = ledgerService.createTransaction(expense("10.00").build());
            ledgerService.deleteTransaction(transaction.getId());
            assertThrows(NotFoundException.class, () -> ledgerService.deleteTransaction(transaction.getId()));
            assertAmount("5000.00", accountBalance());
        }

        @Test
        @DisplayName("3.5 Reassigning to an unknown pouch is rejected and nothing changes")
        void testUnknownPouchOnUpdate() {
            Transaction transaction = ledgerService.createTransaction(expense("10.00").pouchId(pouch1.getId()).build());

            assertThrows(ValidationException.class, () -> ledgerService.updateTransaction(transaction.getId(),
                TransactionPatch.builder().pouchId("no-such-pouch").build()));

            assertAmount("-10.00", pouchBalance(pouch1));
            assertEquals(pouch1.getId(), ledgerService.getTransaction(transaction.getId()).getPouchId());
        }

        @Test
        @DisplayName("3.6 Updates are stamped with the ledger's clock")
        void testUpdateUsesClock(@Autowired TransactionRepository transactionRepository,
                                 @Autowired AccountRepository accountRepository,
                                 @Autowired PouchRepository pouchRepository,
                                 @Autowired BalanceWriter balanceWriter,
                                 @Autowired LedgerMetrics metrics) {
            Instant editedAt = Instant.parse("2030-03-01T12:00:00Z");
            LedgerService ledger = new LedgerService(router, transactionRepository, accountRepository, pouchRepository,
                balanceWriter, metrics, Clock.fixed(editedAt, ZoneOffset.UTC));
            Transaction transaction = ledgerService.createTransaction(expense("10.00").build());

            Transaction updated = ledger.updateTransaction(transaction.getId(),
                TransactionPatch.builder().description("Edited").build());

            assertEquals(editedAt, updated.getUpdatedAt());
            assertEquals("Edited", updated.getDescription());
        }
    }

    @Nested
    @DisplayName("4. Validation")
    class Validation {

        @Test
        @DisplayName("4.1 Non-positive and over-precise amounts are rejected")
        void testInvalidAmounts() {
            assertThrows(ValidationException.class, () -> ledgerService.createTransaction(expense("0.00").build()));
            assertThrows(ValidationException.class, () -> ledgerService.createTransaction(expense("-5.00").build()));
            assertThrows(ValidationException.class, () -> ledgerService.createTransaction(expense("1.005").build()));
            assertAmount("5000.00", accountBalance());
        }

        @Test
        @DisplayName("4.2 Unknown or inactive accounts and unknown pouches are rejected")
        void testReferences() {
            assertThrows(ValidationException.class,
                () -> ledgerService.createTransaction(expense("10.00").accountId("no-such-account").build()));
            assertThrows(ValidationException.class,
                () -> ledgerService.createTransaction(expense("10.00").pouchId("no-such-pouch").build()));

            Account closed = accountService.createAccount(ownerId, "Old", AccountType.CASH, CurrencyCode.USD, BigDecimal.ZERO);
            accountService.deactivateAccount(closed.getId());
            assertThrows(ValidationException.class,
                () -> ledgerService.createTransaction(expense("10.00").accountId(closed.getId()).build()));
        }

        @Test
        @DisplayName("4.3 Currency must match the account currency")
        void testCurrencyMismatch() {
            assertThrows(ValidationException.class,
                () -> ledgerService.createTransaction(expense("10.00").currency(CurrencyCode.EUR).build()));
            assertAmount("5000.00", accountBalance());
        }

        @Test
        @DisplayName("4.4 Missing type is rejected")
        void testMissingType() {
            assertThrows(ValidationException.class, () -> ledgerService.createTransaction(expense("10.00").type(null).build()));
        }

        @Test
        @DisplayName("4.5 A missing split entry is a validation error, not a crash")
        void testNullSplitEntry() {
            Transaction transaction = ledgerService.createTransaction(expense("20.00").build());
            List<SplitAllocation> withGap = Arrays.asList(SplitAllocation.of(pouch1.getId(), new BigDecimal("5.00")), null);

            ValidationException onCreate = assertThrows(ValidationException.class,
                () -> ledgerService.createTransaction(expense("10.00").splits(withGap).build()));
            ValidationException onUpdate = assertThrows(ValidationException.class,
                () -> ledgerService.updateTransaction(transaction.getId(), TransactionPatch.builder().splits(withGap).build()));

            assertEquals("split is required", onCreate.getMessage());
            assertEquals("split is required", onUpdate.getMessage());
            assertAmount("4980.00", accountBalance());
            assertAmount("0.00", pouchBalance(pouch1));
            assertLedgerConsistent();
        }
    }

    @Nested
    @DisplayName("5. Invariants")
    class Invariants {

        @Test
        @DisplayName("5.1 Balances match recomputation after a mixed sequence of operations")
        void testInvariantAfterSequence() {
            Transaction salary = ledgerService.createTransaction(expense("2500.00").type(TransactionType.INCOME).build());
            Transaction groceries = ledgerService.createTransaction(expense("80.25").pouchId(pouch1.getId()).build());
            Transaction dinner = ledgerService.createTransaction(expense("120.00")
                .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("70.00")))
                .split(SplitAllocation.of(pouch2.getId(), new BigDecimal("50.00")))
                .build());
            ledgerService.updateTransaction(groceries.getId(), TransactionPatch.builder()
                .amount(new BigDecimal("95.10")).pouchId(pouch3.getId()).build());
            ledgerService.updateTransaction(dinner.getId(), TransactionPatch.builder()
                .amount(new BigDecimal("130.00"))
                .splits(List.of(SplitAllocation.of(pouch2.getId(), new BigDecimal("50.00")),
                    SplitAllocation.of(pouch3.getId(), new BigDecimal("80.00"))))
                .build());
            ledgerService.deleteTransaction(salary.getId());

            assertAmount("4774.90", accountBalance());
            assertAmount("0.00", pouchBalance(pouch1));
            assertAmount("-50.00", pouchBalance(pouch2));
            assertAmount("-175.10", pouchBalance(pouch3));
            assertLedgerConsistent();
            assertEquals(2, ledgerService.listTransactions(ownerId).size());
        }

        @Test
        @DisplayName("5.2 Concurrent expenses on one account lose no update")
        void testConcurrentExpenses() throws InterruptedException {
            int threadCount = 10;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);
            AtomicInteger failures = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);

            for (int i = 0; i < threadCount; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        ledgerService.createTransaction(expense("10.00").pouchId(pouch1.getId()).build());
                    } catch (Exception e) {
                        failures.incrementAndGet();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }

            startLatch.countDown();
            assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(0, failures.get());
            assertAmount("4900.00", accountBalance());
            assertAmount("-100.00", pouchBalance(pouch1));
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("5.3 Listing returns newest first and honours the limit")
        void testListing() {
            for (int i = 0; i < 3; i++) {
                ledgerService.createTransaction(expense("1.00").description("Expense " + i).build());
            }

            assertEquals(3, ledgerService.listTransactions(ownerId).size());
            assertEquals(2, ledgerService.listTransactions(ownerId, 2).size());
            assertThrows(ValidationException.class, () -> ledgerService.listTransactions(ownerId, 0));
        }

        @Test
        @DisplayName("5.4 Every ledger mutation is counted")
        void testMetrics() {
            double before = meterRegistry.counter("ledger.transactions", "operation", "create").count();

            ledgerService.createTransaction(expense("1.00").build());

            assertEquals(before + 1, meterRegistry.counter("ledger.transactions", "operation", "create").count());
        }
    }

    @Nested
    @DisplayName("6. Failure atomicity")
    class FailureAtomicity {

        @Autowired
        private TransactionRepository transactionRepository;

        @Autowired
        private AccountRepository accountRepository;

        @Autowired
        private PouchRepository pouchRepository;

        @Autowired
        private LedgerMetrics metrics;

        @Autowired
        private Clock clock;

        /**
         * A ledger whose balance writer fails after every balance write has gone
         * through, so each unit fails as late as it can.
         */
        private LedgerService ledgerFailingAfterBalanceWrites() {
            BalanceWriter failing = new BalanceWriter(accountRepository, pouchRepository) {
                @Override
                public void apply(BalanceEffects effects) {
                    super.apply(effects);
                    throw new IllegalStateException("balance store unavailable");
                }
            };
            return new LedgerService(router, transactionRepository, accountRepository, pouchRepository,
                failing, metrics, clock);
        }

        private int transactionsOfOwner() {
            return countRows("SELECT COUNT(*) FROM transactions WHERE user_id = ?", ownerId);
        }

        @Test
        @DisplayName("6.1 A failed create leaves no record, no splits and no balance change")
        void testCreateRolledBack() {
            // Given: a ledger that fails after writing balances
            LedgerService failingLedger = ledgerFailingAfterBalanceWrites();

            // When: a split expense is created
            assertThrows(IllegalStateException.class, () -> failingLedger.createTransaction(expense("40.00")
                .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("25.00")))
                .split(SplitAllocation.of(pouch2.getId(), new BigDecimal("10.00")))
                .build()));

            // Then: nothing of it survives
            assertEquals(0, transactionsOfOwner());
            assertAmount("5000.00", accountBalance());
            assertAmount("0.00", pouchBalance(pouch1));
            assertAmount("0.00", pouchBalance(pouch2));
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("6.2 A failed update keeps the old record, its splits and the old balances")
        void testUpdateRolledBack() {
            // Given: an expense of 30.00 split 20.00 to P1
            Transaction transaction = ledgerService.createTransaction(expense("30.00")
                .split(SplitAllocation.of(pouch1.getId(), new BigDecimal("20.00")))
                .build());

            // When: an update that moves the split to P2 fails
            assertThrows(IllegalStateException.class, () -> ledgerFailingAfterBalanceWrites().updateTransaction(
                transaction.getId(), TransactionPatch.builder()
                    .amount(new BigDecimal("50.00"))
                    .splits(List.of(SplitAllocation.of(pouch2.getId(), new BigDecimal("50.00"))))
                    .build()));

            // Then: the stored transaction and every balance are as before
            Transaction stored = ledgerService.getTransaction(transaction.getId());
            assertAmount("30.00", stored.getAmount());
            assertEquals(1, stored.getSplits().size());
            assertEquals(pouch1.getId(), stored.getSplits().get(0).getPouchId());
            assertAmount("4970.00", accountBalance());
            assertAmount("-20.00", pouchBalance(pouch1));
            assertAmount("0.00", pouchBalance(pouch2));
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("6.3 A failed delete leaves the transaction active and balances applied")
        void testDeleteRolledBack() {
            // Given: an expense of 15.00 on P3
            Transaction transaction = ledgerService.createTransaction(expense("15.00").pouchId(pouch3.getId()).build());

            // When: deleting it fails
            assertThrows(IllegalStateException.class,
                () -> ledgerFailingAfterBalanceWrites().deleteTransaction(transaction.getId()));

            // Then: it is still active and still counted
            assertTrue(ledgerService.findTransaction(transaction.getId()).isPresent());
            assertAmount("4985.00", accountBalance());
            assertAmount("-15.00", pouchBalance(pouch3));
            assertLedgerConsistent();
        }

        @Test
        @DisplayName("6.4 A pouch row vanishing mid-update rolls back the account write too")
        void testMissingBalanceRowRollsBack() {
            // Given: an expense of 10.00 on P2, whose row is then removed behind the ledger's back
            Transaction transaction = ledgerService.createTransaction(expense("10.00").pouchId(pouch2.getId()).build());
            router.executorFor(RecordCollection.POUCHES).jdbc().update("DELETE FROM pouches WHERE id = ?", pouch2.getId());

            // When: the amount is raised to 30.00
            IllegalStateException failure = assertThrows(IllegalStateException.class,
                () -> ledgerService.updateTransaction(transaction.getId(),
                    TransactionPatch.builder().amount(new BigDecimal("30.00")).build()));

            // Then: the account balance and the record are untouched
            assertTrue(failure.getMessage().contains(pouch2.getId()));
            assertAmount("4990.00", accountBalance());
            assertAmount("10.00", ledgerService.getTransaction(transaction.getId()).getAmount());
        }

        @Test
        @DisplayName("6.5 A create racing a deactivation sees the committed account state")
        void testCreateWaitsForDeactivation() throws Exception {
            // Given: another transaction holds the account row while deactivating it
            CountDownLatch locked = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<?> deactivation = executor.submit(() ->
                    router.executorFor(RecordCollection.ACCOUNTS).inTransaction(() -> {
                        router.executorFor(RecordCollection.ACCOUNTS).jdbc()
                            .update("UPDATE accounts SET is_active = FALSE WHERE id = ?", account.getId());
                        locked.countDown();
                        try {
                            release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return null;
                    }));
                assertTrue(locked.await(5, TimeUnit.SECONDS));

                // When: an expense is created while the deactivation is still open
                Future<Transaction> create = executor.submit(() -> ledgerService.createTransaction(expense("10.00").build()));
                Thread.sleep(200);
                release.countDown();
                deactivation.get(5, TimeUnit.SECONDS);

                // Then: the expense is rejected and the balance never moved
                ExecutionException failure = assertThrows(ExecutionException.class, () -> create.get(15, TimeUnit.SECONDS));
                assertInstanceOf(ValidationException.class, failure.getCause());
                assertAmount("5000.00", accountBalance());
                assertEquals(0, transactionsOfOwner());
            } finally {
                release.countDown();
                executor.shutdownNow();
            }
        }
    }
}
