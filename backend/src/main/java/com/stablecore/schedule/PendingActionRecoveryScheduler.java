package com.stablecore.schedule;

import com.stablecore.config.AppProps;
import com.stablecore.model.PendingAction;
import com.stablecore.service.CoreExecutor;
import com.stablecore.service.SagaCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Flags saga markers whose continuation never ran and reports everything waiting for the owner.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingActionRecoveryScheduler {

    private final SagaCoordinator saga;
    private final CoreExecutor executor;
    private final AppProps props;
    private final Clock clock;

    private ZonedDateTime nextRun;

    @Scheduled(cron = "30 * * * * ?")
    public void run() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        AppProps.Polling cfg = props.getRecovery();
        CronExpression expr = CronExpression.parse(cfg.getCron());
        if (nextRun == null) nextRun = expr.next(now.minusMinutes(1));
        if (nextRun.isAfter(now)) return;
        nextRun = expr.next(now);
        try {
            int escalated = executor.submit(() -> saga.escalateStuck(Duration.ofSeconds(cfg.getStuckAfterSec()))).join();
            List<PendingAction> waiting = executor.submit(saga::needingRecovery).join();
            if (escalated > 0) log.warn("[recovery] {} pending actions had no settlement and need recovery", escalated);
            if (!waiting.isEmpty()) {
                log.warn("[recovery] {} pending actions wait for the owner: {}", waiting.size(),
                        waiting.stream().map(p -> p.getType() + ":" + p.getId()).toList());
            }
        } catch (RuntimeException e) {
            log.error("[recovery] sweep failed: {}", e.getMessage());
        }
    }
}
