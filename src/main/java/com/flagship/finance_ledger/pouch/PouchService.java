package com.flagship.finance_ledger.pouch;

import com.flagship.finance_ledger.common.Amounts;
import com.flagship.finance_ledger.common.exception.ConstraintException;
import com.flagship.finance_ledger.common.exception.NotFoundException;
import com.flagship.finance_ledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PouchService {

    private final PouchRepository pouchRepository;

    public Pouch createPouch(String ownerId, String name, PouchVisibility visibility,
                             BigDecimal budgetAmount, BudgetPeriod budgetPeriod) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Pouch name is required");
        }
        if ((budgetAmount == null) != (budgetPeriod == null)) {
            throw new ValidationException("Budget amount and budget period must be given together");
        }

        Pouch pouch = Pouch.builder()
            .id(UUID.randomUUID().toString())
            .ownerId(ownerId)
            .name(name)
            .visibility(visibility != null ? visibility : PouchVisibility.PRIVATE)
            .budgetAmount(budgetAmount != null ? Amounts.requirePositive(budgetAmount, "budgetAmount") : null)
            .budgetPeriod(budgetPeriod)
            .balance(Amounts.zero())
            .build();
        pouchRepository.insert(pouch);
        log.info("Created pouch {} '{}' for owner {}", pouch.getId(), name, ownerId);
        return pouch;
    }

    public Optional<Pouch> findPouch(String pouchId) {
        return pouchRepository.findById(pouchId);
    }

    public Pouch getPouch(String pouchId) {
        return pouchRepository.findById(pouchId)
            .orElseThrow(() -> new NotFoundException("Pouch", pouchId));
    }

    public List<Pouch> listPouches(String ownerId) {
        return pouchRepository.findByOwner(ownerId);
    }

    /**
     * Grants a user a role on a pouch. A user holds at most one role per pouch.
     *
     * @throws ConstraintException if the user already has a share on this pouch
     */
    public PouchShare sharePouch(String pouchId, String userId, ShareRole role) {
        if (userId == null || userId.isBlank() || role == null) {
            throw new ValidationException("User and role are required to share a pouch");
        }
        getPouch(pouchId);

        PouchShare share = new PouchShare(UUID.randomUUID().toString(), pouchId, userId, role);
        try {
            pouchRepository.insertShare(share);
        } catch (DuplicateKeyException e) {
            throw new ConstraintException(String.format("User %s already has access to pouch %s", userId, pouchId), e);
        }
        log.info("Shared pouch {} with user {} as {}", pouchId, userId, role);
        return share;
    }

    public List<PouchShare> listShares(String pouchId) {
        return pouchRepository.findShares(pouchId);
    }
}
