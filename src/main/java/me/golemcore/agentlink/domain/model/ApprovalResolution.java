package me.golemcore.agentlink.domain.model;

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
 * Result of an operator decision on an approval request. {@code request} is
 * {@code null} when the agent or the request is unknown or the operator is
 * not allowed to decide.
 */
public record ApprovalResolution(Outcome outcome, ApprovalRequest request) {

    public enum Outcome {
        RESOLVED, NOT_GOVERNED, NOT_FOUND, UNAUTHORIZED, ALREADY_RESOLVED, REASON_REQUIRED
    }

    public static ApprovalResolution of(Outcome outcome, ApprovalRequest request) {
        return new ApprovalResolution(outcome, request);
    }

    public boolean isResolved() {
        return outcome == Outcome.RESOLVED;
    }
}
