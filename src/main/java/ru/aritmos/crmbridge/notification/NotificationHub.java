package ru.aritmos.crmbridge.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmbridge.config.PipelineProperties;
import ru.aritmos.crmbridge.core.SensitiveDataSanitizer;
import ru.aritmos.crmbridge.model.Notification;
import ru.aritmos.crmbridge.model.NotificationType;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Хаб уведомлений дашборда.
 * <p>
 * Хранит подключённых клиентов и кольцевой буфер последних уведомлений, рассылает новые уведомления
 * всем клиентам.
 * <p>
 * Гарантии:
 * <ul>
 *   <li>все клиенты получают уведомления в порядке вызовов {@link #broadcast(Notification)};</li>
 *   <li>новый клиент сначала получает историю (от старых к новым), затем подтверждение подключения,
 *   и только после этого живые уведомления;</li>
 *   <li>клиент, отправка которому не удалась, не уложилась в таймаут или канал которого закрыт,
 *   удаляется из реестра без повторов.</li>
 * </ul>
 * <p>
 * Ожидание записи в один канал ограничено {@code sendTimeout}: зависший клиент задерживает рассылку
 * не дольше таймаута и затем удаляется.
 * <p>
 * История — только кэш для чтения, а не гарантия доставки.
 * <p>
 * Формат кадров: {@code {"type":"NOTIFICATION","data":{...}}} и
 * {@code {"type":"NOTIFICATION_HISTORY","data":[...]}}.
 */
@Singleton
public class NotificationHub {

    private static final Logger log = LoggerFactory.getLogger(NotificationHub.class);

    public static final String FRAME_NOTIFICATION = "NOTIFICATION";
    public static final String FRAME_HISTORY = "NOTIFICATION_HISTORY";

    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(5);

    private final Map<String, NotificationTransport> clients = new LinkedHashMap<>();
    private final Deque<Notification> history = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int capacity;
    private final Duration sendTimeout;

    @Inject
    public NotificationHub(ObjectMapper objectMapper, Clock clock, PipelineProperties properties) {
        this(objectMapper, clock, properties.getHistoryCapacity(), properties.getSocketSendTimeout());
    }

    public NotificationHub(ObjectMapper objectMapper, Clock clock, int capacity) {
        this(objectMapper, clock, capacity, DEFAULT_SEND_TIMEOUT);
    }

    public NotificationHub(ObjectMapper objectMapper, Clock clock, int capacity, Duration sendTimeout) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.capacity = Math.max(1, capacity);
        this.sendTimeout = (sendTimeout == null || sendTimeout.isZero() || sendTimeout.isNegative())
                ? DEFAULT_SEND_TIMEOUT
                : sendTimeout;
    }

    /**
     * Зарегистрировать клиента (повторная регистрация заменяет прежний канал).
     * <p>
     * Клиенту сразу отправляется вся история, затем уведомление {@link NotificationType#CONNECTION_STATUS}.
     *
     * @param clientId  идентификатор клиента
     * @param transport канал до клиента
     */
    public void register(String clientId, NotificationTransport transport) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Не задан clientId");
        }
        Objects.requireNonNull(transport, "transport");

        lock.lock();
        try {
            NotificationTransport previous = clients.put(clientId, transport);
            log.info("Клиент уведомлений зарегистрирован: {}{} (всего={})",
                    clientId, previous == null ? "" : " (замена канала)", clients.size());

            String historyFrame = frame(FRAME_HISTORY, historyPayload());
            if (historyFrame == null || !deliver(clientId, transport, historyFrame)) {
                return;
            }
            sendTo(clientId, Notifications.clientConnected(clientId, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Удалить клиента. Повторный вызов безопасен.
     */
    public void remove(String clientId) {
        if (clientId == null) {
            return;
        }
        lock.lock();
        try {
            if (clients.remove(clientId) != null) {
                log.info("Клиент уведомлений удалён: {} (осталось={})", clientId, clients.size());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Записать уведомление в историю и разослать всем клиентам.
     *
     * @param notification уведомление
     * @return количество клиентов, которым доставка прошла успешно
     */
    public int broadcast(Notification notification) {
        Objects.requireNonNull(notification, "notification");
        lock.lock();
        try {
            append(notification);
            String json = frame(FRAME_NOTIFICATION, wire(notification));
            if (json == null) {
                return 0;
            }
            int delivered = 0;
            for (Map.Entry<String, NotificationTransport> e : new ArrayList<>(clients.entrySet())) {
                if (deliver(e.getKey(), e.getValue(), json)) {
                    delivered++;
                }
            }
            log.debug("Уведомление {} ({}) разослано: доставлено={}", notification.id(), notification.type(), delivered);
            return delivered;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Отправить уведомление одному клиенту.
     * <p>
     * {@link NotificationType#CONNECTION_STATUS} в историю не пишется, остальные типы пишутся,
     * если клиент зарегистрирован.
     *
     * @return true, если доставка прошла успешно
     */
    public boolean sendTo(String clientId, Notification notification) {
        Objects.requireNonNull(notification, "notification");
        lock.lock();
        try {
            NotificationTransport transport = clientId == null ? null : clients.get(clientId);
            if (transport == null) {
                return false;
            }
            if (notification.type() != NotificationType.CONNECTION_STATUS) {
                append(notification);
            }
            String json = frame(FRAME_NOTIFICATION, wire(notification));
            return json != null && deliver(clientId, transport, json);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Снимок истории от старых к новым.
     */
    public List<Notification> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public int clientCount() {
        lock.lock();
        try {
            return clients.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(String clientId) {
        lock.lock();
        try {
            return clientId != null && clients.containsKey(clientId);
        } finally {
            lock.unlock();
        }
    }

    private void append(Notification notification) {
        history.addLast(notification);
        while (history.size() > capacity) {
            history.removeFirst();
        }
    }

    private boolean deliver(String clientId, NotificationTransport transport, String json) {
        if (!transport.isOpen()) {
            clients.remove(clientId, transport);
            log.info("Канал клиента {} закрыт, клиент удалён", clientId);
            return false;
        }
        CompletableFuture<Void> write = null;
        try {
            write = transport.send(json);
            if (write != null) {
                write.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            return true;
        } catch (TimeoutException e) {
            write.cancel(true);
            clients.remove(clientId, transport);
            log.warn("Клиент {} не принял уведомление за {} мс, клиент удалён", clientId, sendTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clients.remove(clientId, transport);
            log.warn("Отправка уведомления клиенту {} прервана, клиент удалён", clientId);
        } catch (ExecutionException e) {
            clients.remove(clientId, transport);
            log.warn("Не удалось отправить уведомление клиенту {}, клиент удалён: {}",
                    clientId, SensitiveDataSanitizer.describe(e.getCause()));
        } catch (RuntimeException e) {
            clients.remove(clientId, transport);
            log.warn("Не удалось отправить уведомление клиенту {}, клиент удалён: {}",
                    clientId, SensitiveDataSanitizer.describe(e));
        }
        return false;
    }

    private List<Map<String, Object>> historyPayload() {
        List<Map<String, Object>> out = new ArrayList<>(history.size());
        for (Notification n : history) {
            out.add(wire(n));
        }
        return out;
    }

    private static Map<String, Object> wire(Notification n) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", n.id());
        m.put("type", n.type().name());
        m.put("timestamp", n.timestamp().toString());
        m.put("data", n.data());
        return m;
    }

    private String frame(String type, Object data) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type);
        frame.put("data", data);
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Не удалось сериализовать кадр {}: {}", type, SensitiveDataSanitizer.describe(e));
            return null;
        }
    }
}
