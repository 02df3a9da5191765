package com.stablecore.schedule;

import com.stablecore.config.AppProps;
import com.stablecore.service.RateSnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;

/**
 * Ticks every minute and takes a rate snapshot whenever {@code app.snapshot.cron} is due.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateSnapshotScheduler {

    private final RateSnapshotService service;
    private final AppProps props;
    private final Clock clock;

    private ZonedDateTime nextRun;

    @Scheduled(cron = "0 * * * * ?")
    public void run() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        CronExpression expr = CronExpression.parse(props.getSnapshot().getCron());
        if (nextRun == null) nextRun = expr.next(now.minusMinutes(1));
        if (nextRun.isAfter(now)) {
            log.debug("[snapshot-scheduler] skipping at {}, next run at {}", now, nextRun);
            return;
        }
        nextRun = expr.next(now);
        try {
            service.poll().join();
        } catch (RuntimeException e) {
            log.error("[snapshot-scheduler] snapshot failed: {}", e.getMessage());
        }
    }
}
