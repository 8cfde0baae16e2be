package me.golemcore.coder.adapter.outbound.approval;

import me.golemcore.coder.domain.model.ApprovalRequestedEvent;
import me.golemcore.coder.domain.model.PendingApproval;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ApplicationEventApprovalChannelAdapterTest {

    @Test
    void shouldPublishApprovalRequestedEvent() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        ApplicationEventApprovalChannelAdapter adapter = new ApplicationEventApprovalChannelAdapter(publisher);
        PendingApproval approval = new PendingApproval("corr-1", "bash", Map.of("command", "rm -rf build"),
                Instant.parse("2026-01-01T12:00:00Z"));

        adapter.onApprovalRequested(approval);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishEvent(captor.capture());
        ApprovalRequestedEvent event = assertInstanceOf(ApprovalRequestedEvent.class, captor.getValue());
        assertSame(approval, event.approval());
    }
}
