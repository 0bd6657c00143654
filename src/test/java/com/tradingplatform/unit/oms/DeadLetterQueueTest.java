package com.tradingplatform.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingplatform.domain.model.Order;
import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.ErrorType;
import com.tradingplatform.oms.DeadLetterQueue;
import com.tradingplatform.oms.FailedOrder;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DeadLetterQueueTest {

    private final DeadLetterQueue queue = new DeadLetterQueue();

    private static FailedOrder failed(String orderId, ErrorCode code, int attempts) {
        return FailedOrder.builder()
                .order(Order.builder().id(orderId).symbol("SBIN").quantity(1).build())
                .errorType(ErrorType.NETWORK)
                .errorCode(code)
                .message("execution failed")
                .attempts(attempts)
                .failedAt(Instant.parse("2024-03-01T09:20:00Z"))
                .build();
    }

    @Test
    void listsEntriesOldestFirst() {
        queue.add(failed("ORD-1", ErrorCode.TIMEOUT, 4));
        queue.add(failed("ORD-2", ErrorCode.CONNECTION_FAILED, 4));

        assertThat(queue.list()).extracting(FailedOrder::getOrderId).containsExactly("ORD-1", "ORD-2");
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void laterFailureReplacesEarlierEntry() {
        queue.add(failed("ORD-1", ErrorCode.TIMEOUT, 4));
        queue.add(failed("ORD-2", ErrorCode.TIMEOUT, 4));
        queue.add(failed("ORD-1", ErrorCode.CIRCUIT_OPEN, 1));

        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.list()).extracting(FailedOrder::getOrderId).containsExactly("ORD-2", "ORD-1");
        assertThat(queue.get("ORD-1")).hasValueSatisfying(entry -> {
            assertThat(entry.getErrorCode()).isEqualTo(ErrorCode.CIRCUIT_OPEN);
            assertThat(entry.getAttempts()).isEqualTo(1);
        });
    }

    @Test
    void removeReportsWhetherAnEntryExisted() {
        queue.add(failed("ORD-1", ErrorCode.TIMEOUT, 4));

        assertThat(queue.remove("ORD-1")).isTrue();
        assertThat(queue.remove("ORD-1")).isFalse();
        assertThat(queue.get("ORD-1")).isEmpty();
    }
}
