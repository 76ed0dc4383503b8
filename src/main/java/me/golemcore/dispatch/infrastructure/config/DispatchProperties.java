package me.golemcore.dispatch.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for action dispatch, bound from
 * application.properties under the {@code dispatch.*} prefix.
 *
 * <ul>
 * <li>{@link ExecutionProperties} - executor pool and timeouts</li>
 * <li>{@link ConfirmationProperties} - human review window</li>
 * <li>{@link PolicyProperties} - per-session rate rule</li>
 * <li>{@link CatalogProperties} - built-in tool catalog</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "dispatch")
@Data
public class DispatchProperties {

    private ExecutionProperties execution = new ExecutionProperties();
    private ConfirmationProperties confirmation = new ConfirmationProperties();
    private PolicyProperties policy = new PolicyProperties();
    private CatalogProperties catalog = new CatalogProperties();

    @Data
    public static class ExecutionProperties {
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private int threads = 8;
    }

    @Data
    public static class ConfirmationProperties {
        private Duration ttl = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class PolicyProperties {
        private Duration sessionWindow = Duration.ofMinutes(1);
        private int maxInvocationsPerWindow = 20;
    }

    @Data
    public static class CatalogProperties {
        private boolean supportToolsEnabled = true;
    }
}
