package kr.jemi.ticketgate.notification.application.port.in;

public interface KeepAliveUseCase {

    void pingAll();
}
