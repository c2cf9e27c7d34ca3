package org.pilot.usertransactions.service;

import io.micrometer.core.instrument.MeterRegistry;
import org.pilot.usertransactions.dto.TransactionListResponse;
import org.pilot.usertransactions.dto.TransactionResponse;
import org.pilot.usertransactions.entity.TransactionRecord;
import org.pilot.usertransactions.entity.TransactionStatus;
import org.pilot.usertransactions.entity.TransactionType;
import org.pilot.usertransactions.exception.TransactionNotFoundException;
import org.pilot.usertransactions.exception.UserNotFoundException;
import org.pilot.usertransactions.repository.TransactionRepository;
import org.pilot.usertransactions.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final TransactionRepository transactionRepository;
    private final UserRepository userRepository;

    // null when constructed directly in tests
    private final MeterRegistry meterRegistry;

    @Autowired
    public TransactionService(TransactionRepository transactionRepository, UserRepository userRepository, @Nullable MeterRegistry meterRegistry) {
        this.transactionRepository = transactionRepository;
        this.userRepository = userRepository;
        this.meterRegistry = meterRegistry;
    }

    public TransactionService(TransactionRepository transactionRepository, UserRepository userRepository) {
        this(transactionRepository, userRepository, null);
    }

    /**
     * Records a new transaction for an existing user. The status always starts as PENDING.
     *
     * @throws UserNotFoundException if no user has the given id; nothing is written
     */
    @Transactional
    public TransactionResponse create(BigDecimal amount, TransactionType type, Long userId) {
        requireUser(userId);

        TransactionRecord rec = new TransactionRecord();
        rec.setAmount(amount.setScale(2, RoundingMode.HALF_UP));
        rec.setType(type);
        rec.setStatus(TransactionStatus.PENDING);
        rec.setUserId(userId);
        TransactionRecord saved = transactionRepository.save(rec);

        log.info("Created {} transaction {} of {} for user {}", type, saved.getId(), saved.getAmount(), userId);
        if (meterRegistry != null) {
            meterRegistry.counter("transactions.created.count", "type", type.name()).increment();
        }
        return TransactionResponse.withUser(saved);
    }

    @Transactional(readOnly = true)
    public TransactionListResponse listForUser(Long userId) {
        requireUser(userId);
        List<TransactionResponse> items = transactionRepository.findAllForUserNewestFirst(userId).stream()
                .map(TransactionResponse::of)
                .collect(Collectors.toList());
        return new TransactionListResponse(items);
    }

    @Transactional(readOnly = true)
    public TransactionResponse get(Long transactionId) {
        return TransactionResponse.of(load(transactionId));
    }

    /**
     * Overwrites the status whatever the current one is. Terminal states can be
     * left again and repeated writes of the same value are accepted.
     */
    @Transactional
    public TransactionResponse updateStatus(Long transactionId, TransactionStatus status) {
        TransactionRecord rec = load(transactionId);
        TransactionStatus previous = rec.getStatus();
        rec.setStatus(status);
        TransactionRecord saved = transactionRepository.save(rec);

        log.info("Transaction {} status {} -> {}", transactionId, previous, status);
        if (meterRegistry != null) {
            meterRegistry.counter("transactions.status.updated.count", "status", status.name()).increment();
        }
        return TransactionResponse.of(saved);
    }

    private void requireUser(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
    }

    private TransactionRecord load(Long transactionId) {
        return transactionRepository.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }
}
