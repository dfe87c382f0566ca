package com.stakeledger.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, AtomicLong> eventsByType = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByCode = new ConcurrentHashMap<>();
    private final AtomicLong solvencyMismatches = new AtomicLong();

    public void recordEvent(String eventType) {
        eventsByType.computeIfAbsent(eventType, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("ledger_events_total")
                .tag("type", eventType)
                .register(meterRegistry)
                .increment();
    }

    public void recordValueMoved(String eventType, long amount) {
        if (amount <= 0) {
            return;
        }
        Counter.builder("ledger_value_moved_total")
                .tag("type", eventType)
                .register(meterRegistry)
                .increment(amount);
    }

    public void recordRejection(String operation, String errorCode) {
        rejectsByCode.computeIfAbsent(errorCode, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("ledger_rejections_total")
                .tag("operation", operation)
                .tag("code", errorCode)
                .register(meterRegistry)
                .increment();
    }

    public void recordSolvencyMismatch() {
        solvencyMismatches.incrementAndGet();
        Counter.builder("ledger_solvency_mismatches_total").register(meterRegistry).increment();
    }

    public Map<String, Long> eventCounts() {
        return snapshot(eventsByType);
    }

    public Map<String, Long> rejectionCounts() {
        return snapshot(rejectsByCode);
    }

    public long solvencyMismatchCount() {
        return solvencyMismatches.get();
    }

    private Map<String, Long> snapshot(ConcurrentHashMap<String, AtomicLong> counters) {
        Map<String, Long> copy = new ConcurrentHashMap<>();
        counters.forEach((key, value) -> copy.put(key, value.get()));
        return copy;
    }
}
