package kr.jemi.ticketgate.cart.application.port.out;

public interface AdmissionCheckPort {

    boolean isAdmitted(long eventId, long userId);
}
