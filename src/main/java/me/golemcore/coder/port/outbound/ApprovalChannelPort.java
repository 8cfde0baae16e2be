package me.golemcore.coder.port.outbound;

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

import me.golemcore.coder.domain.model.PendingApproval;

/**
 * Port for notifying the user that a tool call needs approval. The channel
 * answers later through
 * {@link me.golemcore.coder.domain.service.ApprovalGate#resolve}.
 */
public interface ApprovalChannelPort {

    /**
     * Called once per registered approval. Must not block.
     */
    void onApprovalRequested(PendingApproval approval);
}
