package kr.jemi.ticketgate.notification.infrastructure.in.scheduler;

import kr.jemi.ticketgate.notification.application.port.in.KeepAliveUseCase;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

// 연결은 인스턴스마다 따로 있으므로 분산 락 없이 모든 인스턴스에서 돈다
@Component
public class NotificationPingScheduler {

    private final KeepAliveUseCase keepAliveUseCase;

    public NotificationPingScheduler(KeepAliveUseCase keepAliveUseCase) {
        this.keepAliveUseCase = keepAliveUseCase;
    }

    @Scheduled(fixedRateString = "${ticketgate.notification.ping-interval-ms}")
    public void ping() {
        keepAliveUseCase.pingAll();
    }
}
