package kr.jemi.ticketgate.notification.infrastructure.out.sse;

import kr.jemi.ticketgate.notification.application.port.out.NotificationChannelPort;
import kr.jemi.ticketgate.notification.domain.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 사용자별 SSE 연결 보관소. 연결은 이 인스턴스에만 있으므로 다른 인스턴스의 사용자에게는 전달되지 않는다.
 */
@Component
public class SseNotificationAdapter implements NotificationChannelPort {

    private static final Logger log = LoggerFactory.getLogger(SseNotificationAdapter.class);

    private final Map<Long, CopyOnWriteArrayList<SseEmitter>> emitters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long timeoutMillis;

    public SseNotificationAdapter(Clock clock,
                                  @Value("${ticketgate.notification.emitter-timeout-ms}") long timeoutMillis) {
        this.clock = clock;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public SseEmitter open(long userId) {
        SseEmitter emitter = new SseEmitter(timeoutMillis);
        emitters.computeIfAbsent(userId, key -> new CopyOnWriteArrayList<>()).add(emitter);

        Runnable cleanup = () -> remove(userId, emitter);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(e -> cleanup.run());

        send(userId, emitter, "hello", Map.of("userId", userId));
        return emitter;
    }

    @Override
    public int push(Notification notification) {
        List<SseEmitter> targets = emitters.get(notification.userId());
        if (targets == null || targets.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (SseEmitter emitter : targets) {
            if (send(notification.userId(), emitter, notification.type().getEventName(), notification)) {
                delivered++;
            }
        }
        return delivered;
    }

    @Override
    public void pingAll() {
        Map<String, String> payload = Map.of("at", LocalDateTime.now(clock).toString());
        emitters.forEach((userId, targets) -> targets.forEach(emitter -> send(userId, emitter, "ping", payload)));
    }

    int connectionCount(long userId) {
        List<SseEmitter> targets = emitters.get(userId);
        return targets == null ? 0 : targets.size();
    }

    private boolean send(long userId, SseEmitter emitter, String name, Object data) {
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
            return true;
        } catch (IOException | IllegalStateException e) {
            // 클라이언트가 끊긴 연결
            log.debug("SSE 전송 실패, 연결 정리: userId={}, event={}", userId, name);
            remove(userId, emitter);
            return false;
        }
    }

    private void remove(long userId, SseEmitter emitter) {
        emitters.computeIfPresent(userId, (key, targets) -> {
            targets.remove(emitter);
            return targets.isEmpty() ? null : targets;
        });
    }
}
