package com.example.shield.service;

import com.example.shield.dto.PipelineDecision;
import com.example.shield.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime counters of pipeline verdicts.
 */
@Service
@Slf4j
public class AnalyticsService {

    private final AtomicLong admitted = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);
    private final AtomicLong failedOpen = new AtomicLong(0);
    private final Map<ErrorKind, AtomicLong> rejectionsByKind = new EnumMap<>(ErrorKind.class);

    // Snapshot of the previous report, for the per-interval delta
    private final AtomicLong reportedAdmitted = new AtomicLong(0);
    private final AtomicLong reportedRejected = new AtomicLong(0);

    public AnalyticsService() {
        for (ErrorKind kind : ErrorKind.values()) {
            rejectionsByKind.put(kind, new AtomicLong(0));
        }
    }

    public void record(PipelineDecision decision) {
        if (decision.isFailedOpen()) {
            failedOpen.incrementAndGet();
        }
        if (decision.isAdmitted()) {
            admitted.incrementAndGet();
            return;
        }
        rejected.incrementAndGet();
        if (decision.getFailure() != null && decision.getFailure().getKind() != null) {
            rejectionsByKind.get(decision.getFailure().getKind()).incrementAndGet();
        }
    }

    // Log traffic once a minute
    @Scheduled(fixedRate = 60000)
    public void reportStats() {
        long currentAdmitted = admitted.get();
        long currentRejected = rejected.get();
        long admittedDelta = currentAdmitted - reportedAdmitted.getAndSet(currentAdmitted);
        long rejectedDelta = currentRejected - reportedRejected.getAndSet(currentRejected);
        if (admittedDelta == 0 && rejectedDelta == 0) {
            return;
        }
        log.info("Pipeline traffic in last interval: {} admitted, {} rejected", admittedDelta, rejectedDelta);
    }

    public PipelineSummary getSummary() {
        Map<String, Long> byKind = new TreeMap<>();
        rejectionsByKind.forEach((kind, count) -> {
            if (count.get() > 0) {
                byKind.put(kind.getCode(), count.get());
            }
        });
        return new PipelineSummary(admitted.get(), rejected.get(), failedOpen.get(), byKind);
    }

    public record PipelineSummary(long admitted, long rejected, long failedOpen, Map<String, Long> rejectionsByCode) {
    }
}
