package se.ironyy_be.service;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import se.ironyy_be.IntegrationTestSupport;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderNumberGeneratorIntegrationTest extends IntegrationTestSupport {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 9);

    @Autowired
    private OrderNumberGenerator generator;

    private String next(LocalDate day) {
        return tx.execute(status -> generator.nextOrderNumber(day));
    }

    @Test
    void numbersCountUpPerDay() {
        assertThat(next(DAY)).isEqualTo("260309-00001");
        assertThat(next(DAY)).isEqualTo("260309-00002");
        assertThat(next(DAY.plusDays(1))).isEqualTo("260310-00001");
        assertThat(next(DAY)).isEqualTo("260309-00003");
    }

    @Test
    void rolledBackTransactionDoesNotConsumeANumber() {
        next(DAY);
        tx.executeWithoutResult(status -> {
            generator.nextOrderNumber(DAY);
            status.setRollbackOnly();
        });

        assertThat(next(DAY)).isEqualTo("260309-00002");
    }

    @Test
    void requiresSurroundingTransaction() {
        assertThatThrownBy(() -> generator.nextOrderNumber(DAY))
                .isInstanceOf(IllegalTransactionStateException.class);
    }

    @Test
    void concurrentCallersGetDistinctNumbers() throws Exception {
        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            Callable<String> call = () -> {
                start.await();
                return next(DAY);
            };
            futures.add(executor.submit(call));
        }
        start.countDown();

        List<String> numbers = new ArrayList<>();
        for (Future<String> future : futures) {
            numbers.add(future.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        assertThat(numbers).doesNotHaveDuplicates().hasSize(callers);
        assertThat(numbers).allMatch(number -> number.startsWith("260309-"));
        assertThat(numbers).contains("260309-00001", "260309-00008");
    }
}
