package kr.jemi.ticketgate.inventory.application.port.in;

import kr.jemi.ticketgate.inventory.domain.SeatCategory;

import java.util.List;

public interface GetCategoriesUseCase {

    List<SeatCategory> getCategories(long eventId);
}
