package me.golemcore.dispatch;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Action dispatch and policy enforcement for an LLM-driven support agent.
 *
 * <p>
 * Validates the agent's tool calls against registered contracts, decides
 * whether each may run unattended, executes or parks it for human review,
 * and records an audit trail of every status change.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ActionDispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ActionDispatchApplication.class, args);
    }
}
