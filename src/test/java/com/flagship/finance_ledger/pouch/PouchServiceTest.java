package com.flagship.finance_ledger.pouch;

import com.flagship.finance_ledger.common.exception.ConstraintException;
import com.flagship.finance_ledger.common.exception.NotFoundException;
import com.flagship.finance_ledger.common.exception.ValidationException;
import com.flagship.finance_ledger.shard.InMemoryShards;
import com.flagship.finance_ledger.shard.ShardRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PouchServiceTest {

    private ShardRouter router;
    private PouchService pouchService;

    @BeforeEach
    void setUp() {
        router = InMemoryShards.migratedRouter("pouches");
        pouchService = new PouchService(new PouchRepository(router));
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    @Test
    @DisplayName("A new pouch starts empty and private by default")
    void testCreatePouch() {
        Pouch pouch = pouchService.createPouch("user-1", "Groceries", null, new BigDecimal("400"), BudgetPeriod.MONTHLY);

        Pouch stored = pouchService.getPouch(pouch.getId());
        assertEquals(PouchVisibility.PRIVATE, stored.getVisibility());
        assertEquals(0, BigDecimal.ZERO.compareTo(stored.getBalance()));
        assertEquals(0, new BigDecimal("400.00").compareTo(stored.getBudgetAmount()));
        assertEquals(BudgetPeriod.MONTHLY, stored.getBudgetPeriod());
        assertEquals(1, pouchService.listPouches("user-1").size());
    }

    @Test
    @DisplayName("Budget amount and period come together")
    void testBudgetValidation() {
        assertThrows(ValidationException.class,
            () -> pouchService.createPouch("user-1", "Half budget", null, new BigDecimal("100.00"), null));
        assertThrows(ValidationException.class,
            () -> pouchService.createPouch("user-1", " ", null, null, null));
    }

    @Test
    @DisplayName("A user can hold only one role per pouch")
    void testShareOncePerUser() {
        Pouch pouch = pouchService.createPouch("user-1", "Holiday", PouchVisibility.SHARED, null, null);

        pouchService.sharePouch(pouch.getId(), "user-2", ShareRole.EDITOR);
        pouchService.sharePouch(pouch.getId(), "user-3", ShareRole.VIEWER);

        assertThrows(ConstraintException.class, () -> pouchService.sharePouch(pouch.getId(), "user-2", ShareRole.VIEWER));
        assertEquals(2, pouchService.listShares(pouch.getId()).size());
    }

    @Test
    @DisplayName("Sharing or reading an unknown pouch is not found")
    void testUnknownPouch() {
        assertTrue(pouchService.findPouch("missing").isEmpty());
        assertThrows(NotFoundException.class, () -> pouchService.getPouch("missing"));
        assertThrows(NotFoundException.class, () -> pouchService.sharePouch("missing", "user-2", ShareRole.VIEWER));
    }
}
