package me.golemcore.coder.adapter.outbound.approval;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.ApprovalRequestedEvent;
import me.golemcore.coder.domain.model.PendingApproval;
import me.golemcore.coder.port.outbound.ApprovalChannelPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Approval channel that publishes {@link ApprovalRequestedEvent} on the Spring
 * event bus. Front ends listen for it and answer with an
 * {@link me.golemcore.coder.domain.model.ApprovalResolvedEvent}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApplicationEventApprovalChannelAdapter implements ApprovalChannelPort {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void onApprovalRequested(PendingApproval approval) {
        log.debug("[Approval] Publishing request {} for tool '{}'", approval.correlationId(), approval.toolName());
        eventPublisher.publishEvent(new ApprovalRequestedEvent(approval));
    }
}
