package ru.aritmos.crmbridge.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.crmbridge.model.AgentPersona;
import ru.aritmos.crmbridge.model.MessageEvent;
import ru.aritmos.crmbridge.model.Notification;
import ru.aritmos.crmbridge.model.NotificationType;
import ru.aritmos.crmbridge.notification.NotificationHub;
import ru.aritmos.crmbridge.notification.NotificationTransport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class AutoResponseDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final String REPLY = "¡Hola! ¿En qué puedo ayudarte?";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LivenessRegistry registry;
    private DedupLedger ledger;
    private NotificationHub hub;
    private CountingGenerator generator;
    private RecordingSender sender;
    private AutoResponseDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new LivenessRegistry(CLOCK, new AgentPersona("Smartbots", ""), 100, 50);
        ledger = new DedupLedger(10_000, 5_000);
        hub = new NotificationHub(objectMapper, CLOCK, 100);
        generator = new CountingGenerator(() -> CompletableFuture.completedFuture(REPLY));
        sender = new RecordingSender();
        dispatcher = newDispatcher(Duration.ofSeconds(2));
    }

    private AutoResponseDispatcher newDispatcher(Duration generationTimeout) {
        return new AutoResponseDispatcher(registry, new MessageClassifier(CLOCK), ledger, generator, hub, CLOCK,
                Duration.ofMinutes(2), generationTimeout);
    }

    private static MessageEvent hola(String messageId) {
        return new MessageEvent("c1", messageId, "Hola", true, NOW.getEpochSecond());
    }

    @Test
    void activeChat_shouldGenerateSendAndBroadcastOnce() throws Exception {
        registry.activate("c1");
        CapturingTransport dashboard = new CapturingTransport();
        hub.register("dash-1", dashboard);

        boolean handled = dispatcher.handle(hola("m1"), sender);

        assertTrue(handled);
        assertEquals(1, generator.calls.get());
        assertEquals("Hola", generator.lastPrompt);
        assertEquals(List.of("c1|" + REPLY), sender.sent);
        assertEquals("m1", registry.lastProcessedMessageId("c1"));

        List<Notification> history = hub.history();
        assertEquals(1, history.size());
        assertEquals(NotificationType.NEW_MESSAGE, history.get(0).type());
        assertEquals("c1", history.get(0).data().get("chatId"));
        assertEquals(REPLY, history.get(0).data().get("body"));
        assertEquals("outgoing", history.get(0).data().get("direction"));

        JsonNode live = objectMapper.readTree(dashboard.frames.get(dashboard.frames.size() - 1));
        assertEquals("NOTIFICATION", live.path("type").asText());
        assertEquals("NEW_MESSAGE", live.path("data").path("type").asText());
    }

    @Test
    void redelivery_shouldNotGenerateOrBroadcastAgain() {
        registry.activate("c1");

        assertTrue(dispatcher.handle(hola("m1"), sender));
        assertFalse(dispatcher.handle(hola("m1"), sender));

        assertEquals(1, generator.calls.get());
        assertEquals(1, sender.sent.size());
        assertEquals(1, hub.history().size());
    }

    @Test
    void redeliveryAfterNewerMessage_shouldStillBeSuppressedByLedger() {
        registry.activate("c1");

        assertTrue(dispatcher.handle(hola("m1"), sender));
        assertTrue(dispatcher.handle(hola("m2"), sender));
        assertFalse(dispatcher.handle(hola("m1"), sender));

        assertEquals(2, generator.calls.get());
    }

    @Test
    void inactiveChat_shouldNeverCallGenerator() {
        assertFalse(dispatcher.handle(hola("m1"), sender));

        registry.activate("c1");
        registry.deactivate("c1");
        assertFalse(dispatcher.handle(hola("m2"), sender));

        assertEquals(0, generator.calls.get());
        assertTrue(sender.sent.isEmpty());
        assertTrue(hub.history().isEmpty());
        assertFalse(ledger.contains("m1"));
    }

    @Test
    void messagesSkippedWhileInactive_shouldNotBeProcessedAfterActivation() {
        MessageEvent skipped = new MessageEvent("c1", "m1", "Hola", true, NOW.getEpochSecond() - 600);
        assertFalse(dispatcher.handle(skipped, sender));

        registry.activate("c1");

        assertFalse(dispatcher.handle(skipped, sender));
        assertEquals(0, generator.calls.get());
    }

    @Test
    void staleOrOwnMessage_shouldBeRejectedWithoutConsumingId() {
        registry.activate("c1");

        assertFalse(dispatcher.handle(new MessageEvent("c1", "old", "Hola", true, NOW.getEpochSecond() - 3600), sender));
        assertFalse(dispatcher.handle(new MessageEvent("c1", "own", "Hola", false, NOW.getEpochSecond()), sender));

        assertEquals(0, generator.calls.get());
        assertFalse(ledger.contains("old"));
        assertFalse(ledger.contains("own"));
    }

    @Test
    void generationFailure_shouldConsumeMessageWithoutSending() {
        registry.activate("c1");
        generator.next = () -> CompletableFuture.failedFuture(new ReplyGenerator.GenerationException("LLM API ответил статусом 500"));

        assertFalse(dispatcher.handle(hola("m1"), sender));
        generator.next = () -> CompletableFuture.completedFuture(REPLY);
        assertFalse(dispatcher.handle(hola("m1"), sender));

        assertEquals(1, generator.calls.get());
        assertTrue(sender.sent.isEmpty());
        assertTrue(hub.history().isEmpty());
        assertEquals("m1", registry.lastProcessedMessageId("c1"));
    }

    @Test
    void generationTimeout_shouldBeTreatedAsFailure() {
        registry.activate("c1");
        CompletableFuture<String> never = new CompletableFuture<>();
        generator.next = () -> never;
        AutoResponseDispatcher fast = newDispatcher(Duration.ofMillis(100));

        assertFalse(fast.handle(hola("m1"), sender));

        assertTrue(never.isCancelled());
        assertTrue(sender.sent.isEmpty());
        assertTrue(hub.history().isEmpty());
    }

    @Test
    void blankReply_shouldNotBeSent() {
        registry.activate("c1");
        generator.next = () -> CompletableFuture.completedFuture("   ");

        assertFalse(dispatcher.handle(hola("m1"), sender));

        assertTrue(sender.sent.isEmpty());
        assertTrue(hub.history().isEmpty());
    }

    @Test
    void generatorThrowingSynchronously_shouldNotPropagate() {
        registry.activate("c1");
        generator.next = () -> {
            throw new IllegalStateException("boom");
        };

        assertFalse(assertDoesNotThrow(() -> dispatcher.handle(hola("m1"), sender)));
    }

    @Test
    void sendFailure_shouldSkipBroadcast() {
        registry.activate("c1");
        MessageSender failing = (chatId, text) -> CompletableFuture.failedFuture(new IllegalStateException("session closed"));

        assertFalse(dispatcher.handle(hola("m1"), failing));
        assertFalse(dispatcher.handle(hola("m1"), sender));

        assertEquals(1, generator.calls.get());
        assertTrue(hub.history().isEmpty());
    }

    @Test
    void concurrentRedelivery_shouldDispatchExactlyOnce() throws Exception {
        registry.activate("c1");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger handled = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    if (dispatcher.handle(hola("m1"), sender)) {
                        handled.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, handled.get());
        assertEquals(1, generator.calls.get());
        assertEquals(1, sender.sent.size());
        assertEquals(1, hub.history().size());
    }

    @Test
    void stalledDashboardClient_shouldNotBlockOtherChats() throws Exception {
        hub = new NotificationHub(objectMapper, CLOCK, 100, Duration.ofMillis(200));
        dispatcher = new AutoResponseDispatcher(registry, new MessageClassifier(CLOCK), ledger, generator, hub, CLOCK,
                Duration.ofMinutes(2), Duration.ofSeconds(2));
        CompletableFuture<Void> neverWritten = new CompletableFuture<>();
        hub.register("stalled", new NotificationTransport() {
            private int frames;

            @Override
            public synchronized CompletableFuture<Void> send(String json) {
                return frames++ < 2 ? CompletableFuture.completedFuture(null) : neverWritten;
            }

            @Override
            public boolean isOpen() {
                return true;
            }
        });
        registry.activate("c1");
        registry.activate("c2");
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            Future<Boolean> first = pool.submit(() -> dispatcher.handle(hola("m1"), sender));
            Future<Boolean> second = pool.submit(() ->
                    dispatcher.handle(new MessageEvent("c2", "m2", "Hola", true, NOW.getEpochSecond()), sender));

            assertTrue(first.get(5, TimeUnit.SECONDS));
            assertTrue(second.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertFalse(hub.isRegistered("stalled"));
        assertEquals(2, hub.history().size());
        assertEquals(2, sender.sent.size());
    }

    @Test
    void personaOfChat_shouldBePassedToGenerator() {
        registry.configure("c1", true, new AgentPersona("Ventas", null));

        assertTrue(dispatcher.handle(hola("m1"), sender));

        assertEquals("Ventas", generator.lastPersona.agentName());
        assertEquals("Ventas", hub.history().get(0).data().get("agentName"));
    }

    static final class CountingGenerator implements ReplyGenerator {
        final AtomicInteger calls = new AtomicInteger();
        volatile Supplier<CompletableFuture<String>> next;
        volatile String lastPrompt;
        volatile AgentPersona lastPersona;

        CountingGenerator(Supplier<CompletableFuture<String>> next) {
            this.next = next;
        }

        @Override
        public String id() {
            return "counting";
        }

        @Override
        public CompletableFuture<String> generate(String promptText, AgentPersona persona) {
            calls.incrementAndGet();
            lastPrompt = promptText;
            lastPersona = persona;
            return next.get();
        }
    }

    static final class RecordingSender implements MessageSender {
        final List<String> sent = new CopyOnWriteArrayList<>();

        @Override
        public CompletableFuture<Void> send(String chatId, String text) {
            sent.add(chatId + "|" + text);
            return CompletableFuture.completedFuture(null);
        }
    }

    static final class CapturingTransport implements NotificationTransport {
        final List<String> frames = new CopyOnWriteArrayList<>();

        @Override
        public CompletableFuture<Void> send(String json) {
            frames.add(json);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public boolean isOpen() {
            return true;
        }
    }
}
