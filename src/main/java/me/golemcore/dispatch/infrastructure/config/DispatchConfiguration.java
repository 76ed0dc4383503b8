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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.domain.component.ToolContractProvider;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.domain.service.ToolRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and the one-time tool registration.
 *
 * <p>
 * On startup every {@link ToolContractProvider} bean contributes its
 * contracts, then the registry is sealed. A broken contract fails the
 * application start.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class DispatchConfiguration {

    private final DispatchProperties properties;
    private final ToolRegistry toolRegistry;
    private final ObjectProvider<ToolContractProvider> contractProviders;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = "dispatchExecutor", destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getExecution().getThreads(), r -> {
            Thread t = new Thread(r, "dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        contractProviders.orderedStream().forEach(provider -> {
            for (ToolContract contract : provider.getContracts()) {
                toolRegistry.register(contract);
            }
            log.info("[Registry] Registered tools from {}", provider.getClass().getSimpleName());
        });
        toolRegistry.seal();
        log.info("[Dispatch] Ready: {} tools, {} executor threads, default timeout {}, confirmation ttl {}",
                toolRegistry.size(), properties.getExecution().getThreads(),
                properties.getExecution().getDefaultTimeout(), properties.getConfirmation().getTtl());
    }
}
