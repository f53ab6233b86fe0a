package se.ironyy_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import se.ironyy_be.pojo.OrderNumberSequence;
import se.ironyy_be.repository.OrderNumberSequenceRepository;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Hands out {@code yyMMdd-NNNNN} order numbers from a per-day counter row. The row is locked
 * for the rest of the caller's transaction, so numbers are never handed out twice.
 */
@Component
@Slf4j
public class OrderNumberGenerator {

    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ofPattern("yyMMdd");

    private final OrderNumberSequenceRepository sequenceRepository;
    private final TransactionTemplate independentTx;

    public OrderNumberGenerator(OrderNumberSequenceRepository sequenceRepository,
                                @Qualifier("independentTx") TransactionTemplate independentTx) {
        this.sequenceRepository = sequenceRepository;
        this.independentTx = independentTx;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextOrderNumber() {
        return nextOrderNumber(LocalDate.now());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextOrderNumber(LocalDate day) {
        String dayKey = day.format(DAY_KEY);
        ensureCounterRow(dayKey);

        OrderNumberSequence sequence = sequenceRepository.findByDayKeyForUpdate(dayKey)
                .orElseThrow(() -> new IllegalStateException("Order number counter missing for " + dayKey));
        int next = sequence.getLastValue() + 1;
        sequence.setLastValue(next);

        return String.format("%s-%05d", dayKey, next);
    }

    // The first order of the day creates the row in its own transaction; a concurrent
    // creator losing the insert just proceeds to lock the row the winner committed.
    private void ensureCounterRow(String dayKey) {
        if (sequenceRepository.existsById(dayKey)) {
            return;
        }
        try {
            independentTx.executeWithoutResult(status -> sequenceRepository.saveAndFlush(
                    OrderNumberSequence.builder().dayKey(dayKey).lastValue(0).build()));
            log.debug("Created order number counter for {}", dayKey);
        } catch (DataIntegrityViolationException e) {
            log.debug("Order number counter for {} was created concurrently", dayKey);
        }
    }
}
