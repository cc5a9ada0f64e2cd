package com.zenith.backend.service;

import com.zenith.backend.config.RuleProperties;
import com.zenith.backend.exception.BadRequestException;
import com.zenith.backend.exception.NotFoundException;
import com.zenith.backend.model.LedgerTransaction;
import com.zenith.backend.model.TransactionStatus;
import com.zenith.backend.model.User;
import com.zenith.backend.repository.LedgerTransactionRepository;
import com.zenith.backend.repository.UserRepository;
import com.zenith.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Gates purchases against stress and balance. Rules run in a fixed order and the first match wins:
 * <ol>
 *     <li>stress above threshold and amount above the impulse limit: blocked</li>
 *     <li>balance below amount: blocked</li>
 *     <li>otherwise allowed and debited</li>
 * </ol>
 * Each call writes exactly one ledger row in the same database transaction as any balance change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseRuleEngine {

    public static final String STRESS_BLOCK_REASON = "High stress impulse buy detected.";
    public static final String INSUFFICIENT_FUNDS_REASON = "Insufficient funds.";
    static final String DEFAULT_INCOME_SOURCE = "Income";
    static final int LOCK_STRIPES = 64;

    private final UserRepository userRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final RuleProperties ruleProperties;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock[] userLocks = newStripes();

    public PurchaseDecision evaluatePurchase(Long userId, BigDecimal amount, String itemName) {
        BigDecimal validAmount = validateAmount(amount);
        if (itemName == null || itemName.isBlank()) {
            throw new BadRequestException("Item name is required");
        }
        String item = itemName.trim();
        PurchaseDecision decision = withUserLock(userId,
                () -> transactionTemplate.execute(status -> decide(userId, validAmount, item)));
        log.info("Purchase user={} item='{}' amount={} -> {} {}", userId, item, validAmount,
                decision.status(), decision.reason() == null ? "" : decision.reason());
        return decision;
    }

    public PurchaseDecision addIncome(Long userId, BigDecimal amount, String source) {
        BigDecimal validAmount = validateAmount(amount);
        String label = source == null || source.isBlank() ? DEFAULT_INCOME_SOURCE : source.trim();
        PurchaseDecision decision = withUserLock(userId, () -> transactionTemplate.execute(status -> {
            if (userRepository.credit(userId, validAmount) == 0) {
                throw new NotFoundException("User not found: " + userId);
            }
            BigDecimal newBalance = currentBalance(userId);
            return append(userId, label, validAmount, TransactionStatus.INCOME, null, newBalance);
        }));
        log.info("Income user={} source='{}' amount={} -> balance {}", userId, label, validAmount, decision.newBalance());
        return decision;
    }

    private PurchaseDecision decide(Long userId, BigDecimal amount, String itemName) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        if (isImpulseBuy(user.getStressLevel(), amount)) {
            return append(userId, itemName, amount, TransactionStatus.BLOCKED, STRESS_BLOCK_REASON, null);
        }
        if (userRepository.debitIfSufficient(userId, amount) == 0) {
            return append(userId, itemName, amount, TransactionStatus.BLOCKED, INSUFFICIENT_FUNDS_REASON, null);
        }
        return append(userId, itemName, amount, TransactionStatus.ALLOWED, null, currentBalance(userId));
    }

    private boolean isImpulseBuy(Integer stressLevel, BigDecimal amount) {
        return stressLevel != null
                && stressLevel > ruleProperties.getStressThreshold()
                && amount.compareTo(ruleProperties.getImpulseAmount()) > 0;
    }

    private PurchaseDecision append(Long userId, String itemName, BigDecimal amount, TransactionStatus status,
                                    String reason, BigDecimal newBalance) {
        LedgerTransaction saved = transactionRepository.save(LedgerTransaction.builder()
                .userId(userId)
                .itemName(itemName)
                .amount(amount)
                .status(status)
                .reason(reason)
                .build());
        return new PurchaseDecision(status, reason, newBalance, saved.getId());
    }

    private BigDecimal currentBalance(Long userId) {
        return userRepository.findBalanceById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }

    private BigDecimal validateAmount(BigDecimal amount) {
        if (!MoneyUtils.isPositive(amount)) {
            throw new BadRequestException("Amount must be a positive number");
        }
        if (amount.stripTrailingZeros().scale() > MoneyUtils.SCALE) {
            throw new BadRequestException("Amount supports at most " + MoneyUtils.SCALE + " decimal places");
        }
        return MoneyUtils.scale(amount);
    }

    // Users that hash to the same stripe serialise against each other.
    ReentrantLock lockFor(Long userId) {
        return userLocks[Math.floorMod(userId.hashCode(), LOCK_STRIPES)];
    }

    private <T> T withUserLock(Long userId, Supplier<T> action) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }
}
