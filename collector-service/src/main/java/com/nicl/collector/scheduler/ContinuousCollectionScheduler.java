package com.nicl.collector.scheduler;

import com.nicl.collector.config.CollectorProperties;
import com.nicl.collector.dto.CollectionOutcome;
import com.nicl.collector.dto.CollectionQuery;
import com.nicl.collector.service.NewsCollectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 최신 뉴스 연속 수집 스케줄러.
 * 첫 주기는 initial-count, 이후 주기는 incremental-count 만큼 수집한다.
 * collector.scheduling.enabled=false(기본값)이면 아무것도 하지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContinuousCollectionScheduler {

    private final NewsCollectionService collectionService;
    private final CollectorProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedCycles = new AtomicLong();

    @Scheduled(
            initialDelayString = "${collector.scheduling.initial-delay:PT10S}",
            fixedDelayString = "${collector.scheduling.interval:PT5M}")
    public void scheduledCollection() {
        CollectorProperties.Scheduling scheduling = properties.getScheduling();
        if (!scheduling.isEnabled()) {
            log.debug("Continuous collection is disabled");
            return;
        }

        // 이전 주기가 아직 실행 중이면 스킵
        if (!running.compareAndSet(false, true)) {
            log.info("Skipping scheduled collection: previous cycle still running");
            return;
        }

        try {
            runCycle();
        } catch (Exception e) {
            log.error("Scheduled collection failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }

    CollectionOutcome runCycle() {
        CollectorProperties.Scheduling scheduling = properties.getScheduling();
        long cycle = completedCycles.get() + 1;
        int count = cycle == 1 ? scheduling.getInitialCount() : scheduling.getIncrementalCount();

        log.info("Continuous collection cycle #{}: collecting {} latest article(s)", cycle, count);
        CollectionOutcome outcome = collectionService.collect(CollectionQuery.latest(), count);
        completedCycles.incrementAndGet();

        if (outcome.success()) {
            log.info("Cycle #{} done: saved={}, duplicates={}", cycle, outcome.saved(), outcome.duplicates());
        } else {
            log.warn("Cycle #{} failed: {}", cycle, outcome.error());
        }
        return outcome;
    }

    public long getCompletedCycles() {
        return completedCycles.get();
    }
}
