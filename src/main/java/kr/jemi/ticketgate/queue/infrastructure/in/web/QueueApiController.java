package kr.jemi.ticketgate.queue.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.ticketgate.queue.application.port.in.GetQueuePositionUseCase;
import kr.jemi.ticketgate.queue.application.port.in.GetQueueStatsUseCase;
import kr.jemi.ticketgate.queue.application.port.in.JoinQueueUseCase;
import kr.jemi.ticketgate.queue.application.port.in.LeaveQueueUseCase;
import kr.jemi.ticketgate.queue.infrastructure.in.web.dto.QueuePositionResponse;
import kr.jemi.ticketgate.queue.infrastructure.in.web.dto.QueueStatsResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Queue", description = "대기열 진입, 순번 조회, 이탈")
@RestController
public class QueueApiController {

    private final JoinQueueUseCase joinQueueUseCase;
    private final GetQueuePositionUseCase getQueuePositionUseCase;
    private final LeaveQueueUseCase leaveQueueUseCase;
    private final GetQueueStatsUseCase getQueueStatsUseCase;

    public QueueApiController(JoinQueueUseCase joinQueueUseCase,
                              GetQueuePositionUseCase getQueuePositionUseCase,
                              LeaveQueueUseCase leaveQueueUseCase,
                              GetQueueStatsUseCase getQueueStatsUseCase) {
        this.joinQueueUseCase = joinQueueUseCase;
        this.getQueuePositionUseCase = getQueuePositionUseCase;
        this.leaveQueueUseCase = leaveQueueUseCase;
        this.getQueueStatsUseCase = getQueueStatsUseCase;
    }

    @Operation(summary = "대기열 진입", description = "이벤트 대기열 맨 뒤에 줄을 서고 앞선 인원 수를 반환합니다.")
    @PostMapping("/api/events/{eventId}/queue/entries")
    public ResponseEntity<QueuePositionResponse> join(
            @PathVariable long eventId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        QueuePositionResponse response = QueuePositionResponse.from(joinQueueUseCase.join(eventId, userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "내 순번 조회", description = "현재 순번, 예상 대기 시간, 예매 진행 가능 여부를 조회합니다.")
    @GetMapping("/api/events/{eventId}/queue/entries/me")
    public ResponseEntity<QueuePositionResponse> getPosition(
            @PathVariable long eventId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return ResponseEntity.ok(QueuePositionResponse.from(getQueuePositionUseCase.getPosition(eventId, userId)));
    }

    @Operation(summary = "대기열 이탈", description = "대기 또는 입장 상태를 포기합니다. 이미 끝난 경우에도 성공합니다.")
    @DeleteMapping("/api/events/{eventId}/queue/entries/me")
    public ResponseEntity<Void> leave(
            @PathVariable long eventId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        leaveQueueUseCase.leave(eventId, userId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "대기열 현황", description = "대기 인원, 입장 인원, 신규 진입 시 예상 대기 시간을 조회합니다.")
    @GetMapping("/api/events/{eventId}/queue")
    public ResponseEntity<QueueStatsResponse> getStats(@PathVariable long eventId) {
        return ResponseEntity.ok(QueueStatsResponse.from(getQueueStatsUseCase.getStats(eventId)));
    }
}
