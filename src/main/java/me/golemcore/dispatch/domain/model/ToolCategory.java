package me.golemcore.dispatch.domain.model;

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

/**
 * Closed set of functional areas a tool contract belongs to. Actors are
 * granted capabilities per category.
 */
public enum ToolCategory {

    TICKET_MANAGEMENT("ticket-management"),

    COMMUNICATION("communication"),

    ESCALATION("escalation"),

    KNOWLEDGE("knowledge"),

    BUSINESS_ACTION("business-action"),

    SYSTEM("system");

    private final String id;

    ToolCategory(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
