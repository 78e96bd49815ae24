package kr.jemi.ticketgate.queue.application.port.in;

public interface ExpireAdmissionsUseCase {

    int expireOverdue();
}
