package kr.jemi.ticketgate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 만료 판정(대기열 입장 기한, 장바구니 TTL, 결제 대기 타임아웃)이 모두 같은 시계를 보도록 주입한다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
