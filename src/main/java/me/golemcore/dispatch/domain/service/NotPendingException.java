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

import me.golemcore.dispatch.domain.model.InvocationStatus;

/**
 * Thrown when a confirmation decision targets an invocation that is not
 * awaiting one.
 */
public class NotPendingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String invocationId;
    private final transient InvocationStatus status;

    public NotPendingException(String invocationId, InvocationStatus status) {
        super("Invocation " + invocationId + " is not awaiting confirmation (status: " + status + ")");
        this.invocationId = invocationId;
        this.status = status;
    }

    public String getInvocationId() {
        return invocationId;
    }

    public InvocationStatus getStatus() {
        return status;
    }
}
