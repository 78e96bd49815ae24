package kr.jemi.ticketgate.inventory.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.ticketgate.inventory.application.port.in.GetCategoriesUseCase;
import kr.jemi.ticketgate.inventory.infrastructure.in.web.dto.CategoryResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Inventory", description = "좌석 등급별 잔여 현황")
@RestController
public class InventoryApiController {

    private final GetCategoriesUseCase getCategoriesUseCase;

    public InventoryApiController(GetCategoriesUseCase getCategoriesUseCase) {
        this.getCategoriesUseCase = getCategoriesUseCase;
    }

    @Operation(summary = "좌석 등급 조회", description = "이벤트의 좌석 등급과 현재 잔여 좌석 수를 조회합니다.")
    @GetMapping("/api/events/{eventId}/categories")
    public ResponseEntity<List<CategoryResponse>> getCategories(@PathVariable long eventId) {
        List<CategoryResponse> response = getCategoriesUseCase.getCategories(eventId).stream()
                .map(CategoryResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
