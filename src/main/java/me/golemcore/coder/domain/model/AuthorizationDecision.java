package me.golemcore.coder.domain.model;

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
 * Outcome of authorizing one tool call.
 */
public record AuthorizationDecision(Verdict verdict, String reason) {

    public enum Verdict {
        EXECUTE, SKIP, AWAIT_APPROVAL
    }

    public static AuthorizationDecision execute(String reason) {
        return new AuthorizationDecision(Verdict.EXECUTE, reason);
    }

    public static AuthorizationDecision skip(String reason) {
        return new AuthorizationDecision(Verdict.SKIP, reason);
    }

    public static AuthorizationDecision awaitApproval() {
        return new AuthorizationDecision(Verdict.AWAIT_APPROVAL, null);
    }

    public boolean isExecute() {
        return verdict == Verdict.EXECUTE;
    }

    public boolean isSkip() {
        return verdict == Verdict.SKIP;
    }

    public boolean isAwaitApproval() {
        return verdict == Verdict.AWAIT_APPROVAL;
    }
}
