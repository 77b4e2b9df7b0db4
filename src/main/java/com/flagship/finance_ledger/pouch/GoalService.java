package com.flagship.finance_ledger.pouch;

import com.flagship.finance_ledger.common.Amounts;
import com.flagship.finance_ledger.common.exception.NotFoundException;
import com.flagship.finance_ledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Savings goals with automatic monthly-contribution recomputation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GoalService {

    private final GoalRepository goalRepository;
    private final PouchRepository pouchRepository;
    private final Clock clock;

    public Goal createGoal(String ownerId, String pouchId, String title, BigDecimal targetAmount,
                           BigDecimal currentAmount, LocalDate targetDate) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner is required");
        }
        if (title == null || title.isBlank()) {
            throw new ValidationException("Goal title is required");
        }
        if (targetDate == null) {
            throw new ValidationException("Target date is required");
        }
        BigDecimal target = Amounts.requirePositive(targetAmount, "targetAmount");
        BigDecimal current = currentAmount != null ? Amounts.normalize(currentAmount, "currentAmount") : Amounts.zero();
        if (pouchId != null && pouchRepository.findById(pouchId).isEmpty()) {
            throw new ValidationException("Unknown pouch: " + pouchId);
        }

        Goal goal = Goal.builder()
            .id(UUID.randomUUID().toString())
            .ownerId(ownerId)
            .pouchId(pouchId)
            .title(title)
            .targetAmount(target)
            .currentAmount(current)
            .targetDate(targetDate)
            .monthlyContribution(ContributionSchedule.monthlyContribution(target, current, targetDate, today()))
            .active(true)
            .build();
        goalRepository.insert(goal);
        log.info("Created goal {} for owner {}: target {} by {}, {} per month",
            goal.getId(), ownerId, target, targetDate, goal.getMonthlyContribution());
        return goal;
    }

    public Goal updateGoal(String goalId, GoalPatch patch) {
        Goal existing = getGoal(goalId);

        Goal.GoalBuilder updated = existing.toBuilder();
        if (patch.getTitle() != null) {
            updated.title(patch.getTitle());
        }
        if (patch.getTargetAmount() != null) {
            updated.targetAmount(Amounts.requirePositive(patch.getTargetAmount(), "targetAmount"));
        }
        if (patch.getCurrentAmount() != null) {
            updated.currentAmount(Amounts.normalize(patch.getCurrentAmount(), "currentAmount"));
        }
        if (patch.getTargetDate() != null) {
            updated.targetDate(patch.getTargetDate());
        }
        if (patch.getActive() != null) {
            updated.active(patch.getActive());
        }

        Goal goal = updated.build();
        if (patch.changesSchedule()) {
            goal = goal.toBuilder()
                .monthlyContribution(ContributionSchedule.monthlyContribution(
                    goal.getTargetAmount(), goal.getCurrentAmount(), goal.getTargetDate(), today()))
                .build();
            log.debug("Recomputed monthly contribution for goal {}: {}", goalId, goal.getMonthlyContribution());
        }

        goalRepository.update(goal);
        return goal;
    }

    public Goal getGoal(String goalId) {
        return goalRepository.findById(goalId)
            .orElseThrow(() -> new NotFoundException("Goal", goalId));
    }

    public List<Goal> listGoals(String ownerId) {
        return goalRepository.findByOwner(ownerId);
    }

    public boolean isBehindSchedule(String goalId) {
        return getGoal(goalId).isBehindSchedule(today());
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
