package com.example.shifttrade.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trade.cache", name = "warmup-enabled", havingValue = "true", matchIfMissing = true)
public class SnapshotWarmupScheduler {

    private final ScheduleSnapshotCache cache;
    private final ShiftDatasetLoader loader;

    @Scheduled(fixedDelayString = "${trade.cache.warmup-interval-ms:120000}", initialDelay = 0)
    public void refresh() {
        try {
            var snapshot = cache.refresh(loader::load);
            log.info("Snapshot warmed up: {} shifts for {} people, built at {}",
                    snapshot.shifts().size(), snapshot.people().size(), snapshot.builtAt());
        } catch (RuntimeException e) {
            log.warn("Snapshot warm-up failed, keeping previous snapshot: {}", e.getMessage());
        }
    }
}
