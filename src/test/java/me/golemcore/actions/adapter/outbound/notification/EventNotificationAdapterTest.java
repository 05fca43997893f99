package me.golemcore.actions.adapter.outbound.notification;

import me.golemcore.actions.domain.model.ActionNotification;
import me.golemcore.actions.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class EventNotificationAdapterTest {

    @Test
    void shouldPublishNotificationAsApplicationEvent() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        EventNotificationAdapter adapter = new EventNotificationAdapter(new SpringEventBus(publisher));
        ActionNotification notification = new ActionNotification("user-1", "Standup", "In 5 minutes", "info",
                Instant.parse("2026-03-02T10:00:00Z"));

        adapter.send(notification);

        verify(publisher).publishEvent((Object) notification);
    }
}
