package me.golemcore.agentlink.domain.service;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentlink.infrastructure.config.AgentLinkProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives {@link GovernanceService#tickAll()} at a fixed rate on a dedicated
 * daemon thread.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GovernanceTickScheduler {

    private final GovernanceService governanceService;
    private final AgentLinkProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    @PostConstruct
    public void init() {
        long intervalMs = properties.getGovernance().getTickInterval().toMillis();
        if (intervalMs <= 0) {
            log.info("[Governance] Tick disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "governance-tick");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Governance] Tick every {} ms", intervalMs);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    void tick() {
        try {
            governanceService.tickAll();
        } catch (RuntimeException e) {
            log.error("[Governance] Tick failed: {}", e.getMessage(), e);
        }
    }
}
