package kr.jemi.ticketgate.queue.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import kr.jemi.ticketgate.queue.application.port.out.QueueEntryPort;
import kr.jemi.ticketgate.queue.application.port.out.QueueEventPolicyPort;
import kr.jemi.ticketgate.queue.application.port.out.QueueSequencePort;
import kr.jemi.ticketgate.queue.domain.QueueEntry;
import kr.jemi.ticketgate.queue.domain.QueueEventPolicy;
import kr.jemi.ticketgate.queue.domain.QueuePosition;
import kr.jemi.ticketgate.queue.domain.QueueStats;
import kr.jemi.ticketgate.queue.domain.QueueStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class QueueServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);
    private static final long EVENT_ID = 10L;
    private static final long USER_ID = 100L;

    @Mock
    private QueueEntryPort queueEntryPort;

    @Mock
    private QueueSequencePort queueSequencePort;

    @Mock
    private QueueEventPolicyPort queueEventPolicyPort;

    private final TSID.Factory tsidFactory = TSID.Factory.newInstance256(0);

    private QueueService queueService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        queueService = new QueueService(queueEntryPort, queueSequencePort, queueEventPolicyPort,
                tsidFactory, clock, 3);
    }

    private static QueueEventPolicy openPolicy() {
        return new QueueEventPolicy(EVENT_ID, true, 100, 10, true);
    }

    private static QueueEntry processing(LocalDateTime deadline) {
        return new QueueEntry(5L, EVENT_ID, USER_ID, 1L, QueueStatus.PROCESSING, NOW.minusMinutes(10), deadline,
                NOW.minusMinutes(20), NOW.minusMinutes(10));
    }

    @Nested
    @DisplayName("join() - 대기열 진입")
    class Join {

        @Test
        @DisplayName("순번을 발급받아 WAITING 엔트리를 저장하고 앞선 인원을 돌려준다")
        void shouldInsertWaitingEntry() {
            // given
            given(queueEventPolicyPort.getPolicy(EVENT_ID)).willReturn(openPolicy());
            given(queueEntryPort.findActive(EVENT_ID, USER_ID)).willReturn(Optional.empty());
            given(queueSequencePort.next(EVENT_ID)).willReturn(42L);
            given(queueEntryPort.insert(any(QueueEntry.class))).willAnswer(invocation -> invocation.getArgument(0));
            given(queueEntryPort.countAhead(EVENT_ID, 42L)).willReturn(150L);

            // when
            QueuePosition position = queueService.join(EVENT_ID, USER_ID);

            // then
            assertThat(position.status()).isEqualTo(QueueStatus.WAITING);
            assertThat(position.position()).isEqualTo(150L);
            assertThat(position.estimatedWaitMinutes()).isEqualTo(3);
            assertThat(position.canProceed()).isFalse();
        }

        @Test
        @DisplayName("대기열이 꺼진 이벤트면 QUEUE_NOT_ENABLED")
        void shouldRejectWhenQueueDisabled() {
            // given
            given(queueEventPolicyPort.getPolicy(EVENT_ID))
                    .willReturn(new QueueEventPolicy(EVENT_ID, false, 100, 10, true));

            // when & then
            assertThatThrownBy(() -> queueService.join(EVENT_ID, USER_ID))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.QUEUE_NOT_ENABLED));
            then(queueSequencePort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("예매 기간이 아니면 BOOKING_WINDOW_CLOSED")
        void shouldRejectWhenWindowClosed() {
            // given
            given(queueEventPolicyPort.getPolicy(EVENT_ID))
                    .willReturn(new QueueEventPolicy(EVENT_ID, true, 100, 10, false));

            // when & then
            assertThatThrownBy(() -> queueService.join(EVENT_ID, USER_ID))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.BOOKING_WINDOW_CLOSED));
        }

        @Test
        @DisplayName("진행 중인 엔트리가 있으면 ALREADY_QUEUED")
        void shouldRejectDuplicate() {
            // given
            given(queueEventPolicyPort.getPolicy(EVENT_ID)).willReturn(openPolicy());
            given(queueEntryPort.findActive(EVENT_ID, USER_ID))
                    .willReturn(Optional.of(QueueEntry.join(5L, EVENT_ID, USER_ID, 1L, NOW)));

            // when & then
            assertThatThrownBy(() -> queueService.join(EVENT_ID, USER_ID))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.ALREADY_QUEUED));
            then(queueEntryPort).should(never()).insert(any());
        }

        @Test
        @DisplayName("기한이 지난 입장은 만료 처리 후 맨 뒤로 다시 줄 선다")
        void shouldRequeueAfterOverdueAdmission() {
            // given
            QueueEntry overdue = processing(NOW.minusMinutes(1));
            given(queueEventPolicyPort.getPolicy(EVENT_ID)).willReturn(openPolicy());
            given(queueEntryPort.findActive(EVENT_ID, USER_ID)).willReturn(Optional.of(overdue));
            given(queueSequencePort.next(EVENT_ID)).willReturn(300L);
            given(queueEntryPort.insert(any(QueueEntry.class))).willAnswer(invocation -> invocation.getArgument(0));
            given(queueEntryPort.countAhead(EVENT_ID, 300L)).willReturn(0L);

            // when
            QueuePosition position = queueService.join(EVENT_ID, USER_ID);

            // then
            assertThat(overdue.getStatus()).isEqualTo(QueueStatus.EXPIRED);
            then(queueEntryPort).should().update(overdue);
            assertThat(position.status()).isEqualTo(QueueStatus.WAITING);
        }

        @Test
        @DisplayName("동시 진입으로 유니크 제약이 깨지면 ALREADY_QUEUED")
        void shouldMapUniqueViolation() {
            // given
            given(queueEventPolicyPort.getPolicy(EVENT_ID)).willReturn(openPolicy());
            given(queueEntryPort.findActive(EVENT_ID, USER_ID)).willReturn(Optional.empty());
            given(queueSequencePort.next(EVENT_ID)).willReturn(1L);
            given(queueEntryPort.insert(any(QueueEntry.class)))
                    .willThrow(new DataIntegrityViolationException("uk_queue_active"));

            // when & then
            assertThatThrownBy(() -> queueService.join(EVENT_ID, USER_ID))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.ALREADY_QUEUED));
        }
    }

    @Nested
    @DisplayName("getPosition() - 순번 조회")
    class GetPosition {

        @Test
        @DisplayName("엔트리가 없으면 NOT_IN_QUEUE")
        void shouldThrowWhenMissing() {
            // given
            given(queueEntryPort.findLatest(EVENT_ID, USER_ID)).willReturn(Optional.empty());

            // when & then
            assertThatThrownBy(() -> queueService.getPosition(EVENT_ID, USER_ID))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.NOT_IN_QUEUE));
        }

        @Test
        @DisplayName("기한이 지난 PROCESSING 은 EXPIRED 로 보고 진행할 수 없다")
        void shouldReportExpiredWhenOverdue() {
            // given
            given(queueEntryPort.findLatest(EVENT_ID, USER_ID)).willReturn(Optional.of(processing(NOW)));
            given(queueEventPolicyPort.getPolicy(EVENT_ID)).willReturn(openPolicy());

            // when
            QueuePosition position = queueService.getPosition(EVENT_ID, USER_ID);

            // then
            assertThat(position.status()).isEqualTo(QueueStatus.EXPIRED);
            assertThat(position.canProceed()).isFalse();
            assertThat(position.position()).isZero();
        }
    }

    @Nested
    @DisplayName("leave() - 대기열 이탈")
    class Leave {

        @Test
        @DisplayName("WAITING 엔트리는 LEFT 로 바뀐다")
        void shouldMarkLeft() {
            // given
            QueueEntry entry = QueueEntry.join(5L, EVENT_ID, USER_ID, 1L, NOW);
            given(queueEntryPort.findActive(EVENT_ID, USER_ID)).willReturn(Optional.of(entry));

            // when
            queueService.leave(EVENT_ID, USER_ID);

            // then
            then(queueEntryPort).should()
                    .changeActiveStatus(5L, QueueStatus.WAITING, QueueStatus.LEFT, NOW);
        }

        @Test
        @DisplayName("기한이 지난 입장은 EXPIRED 로 정리한다")
        void shouldMarkExpiredWhenOverdue() {
            // given
            given(queueEntryPort.findActive(EVENT_ID, USER_ID)).willReturn(Optional.of(processing(NOW)));

            // when
            queueService.leave(EVENT_ID, USER_ID);

            // then
            then(queueEntryPort).should()
                    .changeActiveStatus(5L, QueueStatus.PROCESSING, QueueStatus.EXPIRED, NOW);
        }

        @Test
        @DisplayName("엔트리가 없으면 아무 일도 하지 않는다")
        void shouldBeNoOpWhenAbsent() {
            // given
            given(queueEntryPort.findActive(EVENT_ID, USER_ID)).willReturn(Optional.empty());

            // when
            queueService.leave(EVENT_ID, USER_ID);

            // then
            then(queueEntryPort).should(never()).changeActiveStatus(anyLong(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("canProceed() / complete()")
    class Proceed {

        @Test
        @DisplayName("기한 이전의 PROCESSING 만 진행할 수 있다")
        void shouldAllowOnlyBeforeDeadline() {
            // given
            given(queueEntryPort.findActive(EVENT_ID, USER_ID))
                    .willReturn(Optional.of(processing(NOW.plusMinutes(1))), Optional.of(processing(NOW)));

            // when & then
            assertThat(queueService.canProceed(EVENT_ID, USER_ID)).isTrue();
            assertThat(queueService.canProceed(EVENT_ID, USER_ID)).isFalse();
        }

        @Test
        @DisplayName("complete() 는 PROCESSING 엔트리를 COMPLETED 로 바꾼다")
        void shouldCompleteProcessing() {
            // given
            given(queueEntryPort.findActive(EVENT_ID, USER_ID)).willReturn(Optional.of(processing(NOW.plusMinutes(1))));

            // when
            queueService.complete(EVENT_ID, USER_ID);

            // then
            then(queueEntryPort).should()
                    .changeActiveStatus(5L, QueueStatus.PROCESSING, QueueStatus.COMPLETED, NOW);
        }
    }

    @Nested
    @DisplayName("getStats() - 대기열 현황")
    class GetStats {

        @Test
        @DisplayName("대기열이 꺼진 이벤트는 비활성 통계를 돌려준다")
        void shouldReturnDisabledStats() {
            // given
            given(queueEventPolicyPort.getPolicy(EVENT_ID))
                    .willReturn(new QueueEventPolicy(EVENT_ID, false, 100, 10, true));

            // when
            QueueStats stats = queueService.getStats(EVENT_ID);

            // then
            assertThat(stats.queueEnabled()).isFalse();
            assertThat(stats.estimatedWaitMinutes()).isNull();
        }

        @Test
        @DisplayName("대기와 입장 인원을 세고 맨 뒤 기준 대기 시간을 계산한다")
        void shouldCountEntries() {
            // given
            given(queueEventPolicyPort.getPolicy(EVENT_ID)).willReturn(openPolicy());
            given(queueEntryPort.countByStatus(EVENT_ID, QueueStatus.WAITING)).willReturn(180L);
            given(queueEntryPort.countByStatus(EVENT_ID, QueueStatus.PROCESSING)).willReturn(100L);

            // when
            QueueStats stats = queueService.getStats(EVENT_ID);

            // then
            assertThat(stats.waiting()).isEqualTo(180L);
            assertThat(stats.processing()).isEqualTo(100L);
            assertThat(stats.estimatedWaitMinutes()).isEqualTo(6);
            assertThat(stats.active()).isTrue();
        }
    }
}
