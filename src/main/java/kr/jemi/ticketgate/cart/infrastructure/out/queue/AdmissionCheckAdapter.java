package kr.jemi.ticketgate.cart.infrastructure.out.queue;

import kr.jemi.ticketgate.cart.application.port.out.AdmissionCheckPort;
import kr.jemi.ticketgate.queue.api.QueueFacade;
import org.springframework.stereotype.Component;

@Component
public class AdmissionCheckAdapter implements AdmissionCheckPort {

    private final QueueFacade queueFacade;

    public AdmissionCheckAdapter(QueueFacade queueFacade) {
        this.queueFacade = queueFacade;
    }

    @Override
    public boolean isAdmitted(long eventId, long userId) {
        return queueFacade.canProceed(eventId, userId);
    }
}
