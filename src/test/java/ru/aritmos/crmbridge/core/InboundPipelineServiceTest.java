package ru.aritmos.crmbridge.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.crmbridge.model.AgentPersona;
import ru.aritmos.crmbridge.model.MessageEvent;
import ru.aritmos.crmbridge.notification.NotificationHub;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InboundPipelineServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final List<String> sent = new CopyOnWriteArrayList<>();
    private final CountDownLatch otherChatSent = new CountDownLatch(1);

    private ExecutorService executor;
    private LivenessRegistry registry;
    private InboundPipelineService pipeline;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        registry = new LivenessRegistry(CLOCK, new AgentPersona(null, null), 100, 50);

        // "slow" ждёт, пока не уйдёт ответ в другой чат: так проверяется, что чаты не блокируют друг друга
        ReplyGenerator generator = new ReplyGenerator() {
            @Override
            public String id() {
                return "echo";
            }

            @Override
            public CompletableFuture<String> generate(String promptText, AgentPersona persona) {
                if ("slow".equals(promptText)) {
                    return CompletableFuture.supplyAsync(() -> {
                        try {
                            otherChatSent.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return "re: slow";
                    });
                }
                return CompletableFuture.completedFuture("re: " + promptText);
            }
        };

        MessageSender sender = (chatId, text) -> {
            sent.add(chatId + "|" + text);
            if (chatId.equals("c2")) {
                otherChatSent.countDown();
            }
            return CompletableFuture.completedFuture(null);
        };

        AutoResponseDispatcher dispatcher = new AutoResponseDispatcher(registry, new MessageClassifier(CLOCK),
                new DedupLedger(10_000, 5_000), generator, new NotificationHub(new ObjectMapper(), CLOCK, 100), CLOCK,
                Duration.ofMinutes(2), Duration.ofSeconds(10));
        pipeline = new InboundPipelineService(dispatcher, sender, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static MessageEvent event(String chatId, String messageId, String body) {
        return new MessageEvent(chatId, messageId, body, true, NOW.getEpochSecond());
    }

    @Test
    void repliesWithinChat_shouldFollowArrivalOrder() throws Exception {
        registry.activate("c1");
        registry.activate("c2");

        CompletableFuture<Boolean> first = pipeline.submit(event("c1", "m1", "slow"));
        CompletableFuture<Boolean> second = pipeline.submit(event("c1", "m2", "fast"));
        CompletableFuture<Boolean> other = pipeline.submit(event("c2", "m3", "other"));

        assertTrue(first.get(10, TimeUnit.SECONDS));
        assertTrue(second.get(10, TimeUnit.SECONDS));
        assertTrue(other.get(10, TimeUnit.SECONDS));

        List<String> c1 = sent.stream().filter(s -> s.startsWith("c1|")).toList();
        assertEquals(List.of("c1|re: slow", "c1|re: fast"), c1);
        assertEquals("c2|re: other", sent.get(0));
    }

    @Test
    void failedEvent_shouldNotBlockFollowingEventsOfSameChat() throws Exception {
        registry.activate("c1");

        CompletableFuture<Boolean> stale = pipeline.submit(new MessageEvent("c1", "old", "hola", true, NOW.getEpochSecond() - 3600));
        CompletableFuture<Boolean> fresh = pipeline.submit(event("c1", "m2", "hola"));

        assertFalse(stale.get(10, TimeUnit.SECONDS));
        assertTrue(fresh.get(10, TimeUnit.SECONDS));
        assertEquals(List.of("c1|re: hola"), sent);
    }

    @Test
    void eventWithoutChat_shouldBeRejectedImmediately() throws Exception {
        assertFalse(pipeline.submit(null).get(1, TimeUnit.SECONDS));
        assertFalse(pipeline.submit(event(" ", "m1", "hola")).get(1, TimeUnit.SECONDS));
        assertTrue(sent.isEmpty());
    }

    @Test
    void explicitSender_shouldOverrideDefault() throws Exception {
        registry.activate("c1");
        List<String> accountTwo = new CopyOnWriteArrayList<>();

        boolean handled = pipeline.submit(event("c1", "m1", "hola"), (chatId, text) -> {
            accountTwo.add(text);
            return CompletableFuture.completedFuture(null);
        }).get(10, TimeUnit.SECONDS);

        assertTrue(handled);
        assertEquals(List.of("re: hola"), accountTwo);
        assertTrue(sent.isEmpty());
    }
}
