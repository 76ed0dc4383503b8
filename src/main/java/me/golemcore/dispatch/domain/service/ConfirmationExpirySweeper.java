package me.golemcore.dispatch.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.infrastructure.config.DispatchProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically expires confirmations nobody resolved in time.
 */
@Component
@Slf4j
public class ConfirmationExpirySweeper {

    private final ConfirmationWorkflow confirmationWorkflow;
    private final Clock clock;
    private final Duration sweepInterval;

    private ScheduledExecutorService sweepExecutor;

    public ConfirmationExpirySweeper(ConfirmationWorkflow confirmationWorkflow, Clock clock,
            DispatchProperties properties) {
        this.confirmationWorkflow = confirmationWorkflow;
        this.clock = clock;
        this.sweepInterval = properties.getConfirmation().getSweepInterval();
    }

    @PostConstruct
    public void init() {
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "confirmation-expiry");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = sweepInterval.toMillis();
        sweepExecutor.scheduleWithFixedDelay(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[Confirm] Expiry sweep every {}", sweepInterval);
    }

    @PreDestroy
    public void destroy() {
        if (sweepExecutor != null) {
            sweepExecutor.shutdownNow();
            try {
                sweepExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * One sweep pass. Failures are logged so the schedule keeps running.
     */
    public int sweep() {
        try {
            List<Invocation> expired = confirmationWorkflow.expireStale(clock.instant());
            if (!expired.isEmpty()) {
                log.info("[Confirm] Expired {} stale confirmation(s)", expired.size());
            }
            return expired.size();
        } catch (RuntimeException e) {
            log.error("[Confirm] Expiry sweep failed", e);
            return 0;
        }
    }
}
