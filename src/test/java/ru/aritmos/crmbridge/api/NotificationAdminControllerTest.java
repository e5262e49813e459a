package ru.aritmos.crmbridge.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.crmbridge.model.Notification;
import ru.aritmos.crmbridge.model.NotificationType;
import ru.aritmos.crmbridge.notification.NotificationHub;
import ru.aritmos.crmbridge.notification.NotificationTransport;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationAdminControllerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);

    private NotificationHub hub;
    private NotificationAdminController controller;

    @BeforeEach
    void setUp() {
        hub = new NotificationHub(new ObjectMapper(), CLOCK, 100);
        controller = new NotificationAdminController(hub, CLOCK);
        hub.register("dash-1", new NotificationTransport() {
            @Override
            public CompletableFuture<Void> send(String json) {
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public boolean isOpen() {
                return true;
            }
        });
    }

    @Test
    void broadcast_withoutType_shouldAnswerBadRequest() {
        HttpResponse<NotificationAdminController.PublishResult> response =
                controller.broadcast(new NotificationAdminController.PublishRequest(null, Map.of("text", "x")));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatus());
        assertEquals("Не задан type", response.body().error());
        assertTrue(hub.history().isEmpty());
    }

    @Test
    void broadcast_shouldDeliverAndRecord() {
        HttpResponse<NotificationAdminController.PublishResult> response = controller.broadcast(
                new NotificationAdminController.PublishRequest(NotificationType.CAMPAIGN_STATUS, Map.of("campaignId", 7)));

        assertEquals(HttpStatus.OK, response.getStatus());
        assertEquals(1, response.body().delivered());
        assertNull(response.body().error());
        List<Notification> history = controller.history();
        assertEquals(1, history.size());
        assertEquals(response.body().id(), history.get(0).id());
    }

    @Test
    void accountStatus_withoutAccountOrStatus_shouldAnswerBadRequest() {
        assertEquals(HttpStatus.BAD_REQUEST, controller.accountStatus(
                new NotificationAdminController.AccountStatusRequest(null, "Ventas", "error")).getStatus());
        assertEquals(HttpStatus.BAD_REQUEST, controller.accountStatus(
                new NotificationAdminController.AccountStatusRequest(3L, "Ventas", " ")).getStatus());
        assertEquals(HttpStatus.BAD_REQUEST, controller.accountStatus(null).getStatus());
        assertTrue(hub.history().isEmpty());
    }

    @Test
    void accountStatus_errorShouldBeHighPriority() {
        HttpResponse<NotificationAdminController.PublishResult> response = controller.accountStatus(
                new NotificationAdminController.AccountStatusRequest(3L, "Ventas", " error "));

        assertEquals(HttpStatus.OK, response.getStatus());
        Notification stored = hub.history().get(0);
        assertEquals(NotificationType.CONNECTION_STATUS, stored.type());
        assertEquals("error", stored.data().get("status"));
        assertEquals("high", stored.data().get("priority"));
        assertEquals(3L, stored.data().get("accountId"));
    }
}
