package kr.jemi.ticketgate.queue.infrastructure.out.redis;

import kr.jemi.ticketgate.queue.application.port.out.QueueSequencePort;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * 이벤트별 도착 순번. INCR 은 원자적이므로 여러 인스턴스가 동시에 받아도 순번이 겹치지 않는다.
 */
@Component
public class QueueSequenceRedisAdapter implements QueueSequencePort {

    private static final String SEQUENCE_KEY_PREFIX = "ticketgate:queue:seq:";

    private final StringRedisTemplate redisTemplate;

    public QueueSequenceRedisAdapter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public long next(long eventId) {
        Long sequence = redisTemplate.opsForValue().increment(SEQUENCE_KEY_PREFIX + eventId);
        if (sequence == null) {
            throw new IllegalStateException("대기 순번 발급 실패: eventId=" + eventId);
        }
        return sequence;
    }
}
