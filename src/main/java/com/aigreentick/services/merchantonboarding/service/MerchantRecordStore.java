package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.OnboardingStatus;
import com.aigreentick.services.merchantonboarding.entity.MerchantOnboardingRecord;
import com.aigreentick.services.merchantonboarding.event.MerchantStatusChangedEvent;
import com.aigreentick.services.merchantonboarding.exception.MerchantNotFoundException;
import com.aigreentick.services.merchantonboarding.repository.MerchantOnboardingRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Function;

/**
 * Gateway to the per-merchant onboarding record.
 *
 * Every mutation is a compare-and-swap on the record's @Version column:
 *   load → apply mutator → flush. If another writer committed in between, the flush
 *   fails with an optimistic-lock conflict and the whole load/apply/flush is repeated
 *   on the fresh row, up to {@link #MAX_CAS_ATTEMPTS} times.
 *
 * Mutators must therefore be safe to re-apply: they are merges (set-if-absent,
 * monotonic flags, forward-only status), never blind overwrites of a stale snapshot.
 *
 * A status change made by a mutator publishes one {@link MerchantStatusChangedEvent}
 * inside the same transaction.
 */
@Service
@Slf4j
public class MerchantRecordStore {

    static final int MAX_CAS_ATTEMPTS = 5;

    private final MerchantOnboardingRecordRepository repository;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate writeTransaction;

    public MerchantRecordStore(MerchantOnboardingRecordRepository repository,
                               ApplicationEventPublisher eventPublisher,
                               PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.eventPublisher = eventPublisher;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    // ════════════════════════════════════════════════════════════
    // READS
    // ════════════════════════════════════════════════════════════

    @Transactional(readOnly = true)
    public Optional<MerchantOnboardingRecord> get(String merchantId) {
        return repository.findByMerchantId(merchantId);
    }

    @Transactional(readOnly = true)
    public MerchantOnboardingRecord getOrThrow(String merchantId) {
        return repository.findByMerchantId(merchantId)
                .orElseThrow(() -> MerchantNotFoundException.withMerchantId(merchantId));
    }

    @Transactional(readOnly = true)
    public Optional<MerchantOnboardingRecord> findByAccountHolderId(String accountHolderId) {
        if (accountHolderId == null || accountHolderId.isBlank()) {
            return Optional.empty();
        }
        return repository.findFirstByAccountHolderIdOrderByIdAsc(accountHolderId);
    }

    // ════════════════════════════════════════════════════════════
    // WRITES
    // ════════════════════════════════════════════════════════════

    public MerchantOnboardingRecord create(MerchantOnboardingRecord record) {
        return writeTransaction.execute(status -> {
            MerchantOnboardingRecord saved = repository.saveAndFlush(record);
            log.info("Onboarding record created: merchantId={}, status={}",
                    saved.getMerchantId(), saved.getStatus());
            return saved;
        });
    }

    /**
     * Load the record, apply {@code mutator}, and commit, retrying on version conflict.
     *
     * @return whatever the mutator returned on the attempt that committed
     * @throws MerchantNotFoundException if the record does not exist
     * @throws ObjectOptimisticLockingFailureException if every attempt lost the race
     */
    public <T> T update(String merchantId, Function<MerchantOnboardingRecord, T> mutator) {
        ObjectOptimisticLockingFailureException lastConflict = null;

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            try {
                return writeTransaction.execute(status -> applyAndFlush(merchantId, mutator));
            } catch (ObjectOptimisticLockingFailureException ex) {
                lastConflict = ex;
                log.warn("Version conflict on merchant {} (attempt {}/{}), reloading and reapplying",
                        merchantId, attempt, MAX_CAS_ATTEMPTS);
            }
        }

        log.error("Giving up on merchant {} after {} version conflicts", merchantId, MAX_CAS_ATTEMPTS);
        throw lastConflict;
    }

    /**
     * CAS hasGeneratedLink false → true.
     *
     * @return true if this call set the flag, false if it was already set
     */
    public boolean markLinkGenerated(String merchantId) {
        Integer updated = writeTransaction.execute(status ->
                repository.markLinkGenerated(merchantId, LocalDateTime.now()));
        if (updated == null || updated == 0) {
            log.warn("hasGeneratedLink CAS returned 0 for merchant {}: already set", merchantId);
            return false;
        }
        log.info("Merchant {} → hasGeneratedLink=true", merchantId);
        return true;
    }

    private <T> T applyAndFlush(String merchantId, Function<MerchantOnboardingRecord, T> mutator) {
        MerchantOnboardingRecord record = repository.findByMerchantId(merchantId)
                .orElseThrow(() -> MerchantNotFoundException.withMerchantId(merchantId));
        OnboardingStatus before = record.getStatus();

        T result = mutator.apply(record);
        repository.saveAndFlush(record);

        if (record.getStatus() != before) {
            log.info("Merchant {} status {} → {}", merchantId, before, record.getStatus());
            eventPublisher.publishEvent(new MerchantStatusChangedEvent(merchantId, before, record.getStatus()));
        }
        return result;
    }
}
