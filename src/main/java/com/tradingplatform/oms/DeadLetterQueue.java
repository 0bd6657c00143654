package com.tradingplatform.oms;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders whose submission failed after the retry budget was spent, kept for inspection
 * and manual resubmission. One entry per order; a later failure replaces the earlier one.
 */
public class DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueue.class);

    private final Map<String, FailedOrder> entries = new LinkedHashMap<>();

    public synchronized void add(FailedOrder failedOrder) {
        entries.remove(failedOrder.getOrderId());
        entries.put(failedOrder.getOrderId(), failedOrder);
        log.warn("Order {} moved to dead letter queue [code={}, attempts={}]",
                failedOrder.getOrderId(), failedOrder.getErrorCode(), failedOrder.getAttempts());
    }

    public synchronized Optional<FailedOrder> get(String orderId) {
        return Optional.ofNullable(entries.get(orderId));
    }

    /** Entries in the order they failed, oldest first. */
    public synchronized List<FailedOrder> list() {
        return new ArrayList<>(entries.values());
    }

    public synchronized boolean remove(String orderId) {
        return entries.remove(orderId) != null;
    }

    public synchronized int size() {
        return entries.size();
    }
}
