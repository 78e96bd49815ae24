package kr.jemi.ticketgate.config;

import io.hypersistence.tsid.TSID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 인스턴스마다 다른 TSID 노드 번호를 Redis 카운터로 나눠 갖는다.
 * 노드 수를 넘는 인스턴스가 뜨면 번호가 순환하므로 node-bits 는 동시 인스턴스 수보다 넉넉해야 한다.
 */
@Configuration
public class TsidConfig {

    private static final Logger log = LoggerFactory.getLogger(TsidConfig.class);

    static final String NODE_COUNTER_KEY = "ticketgate:tsid:node:counter";

    @Bean
    public TSID.Factory tsidFactory(StringRedisTemplate redisTemplate,
                                    @Value("${ticketgate.tsid.node-bits}") int nodeBits) {
        Long counter = redisTemplate.opsForValue().increment(NODE_COUNTER_KEY);
        if (counter == null) {
            throw new IllegalStateException("TSID 노드 번호를 할당하지 못했습니다");
        }
        int nodeId = (int) (counter % (1 << nodeBits));
        log.info("TSID 노드 할당: nodeId={}, nodeBits={}", nodeId, nodeBits);

        return TSID.Factory.builder()
                .withNodeBits(nodeBits)
                .withNode(nodeId)
                .build();
    }
}
