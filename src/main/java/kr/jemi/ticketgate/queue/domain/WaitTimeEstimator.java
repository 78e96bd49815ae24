package kr.jemi.ticketgate.queue.domain;

public final class WaitTimeEstimator {

    private WaitTimeEstimator() {}

    /**
     * 첫 배치 안이면 0분, 그 뒤로는 앞선 배치 수 x min(평균 결제 소요, 입장 유지 시간).
     */
    public static int estimateMinutes(long ahead, int batchSize, int processingMinutes, int avgCheckoutMinutes) {
        long rank = ahead + 1;
        if (rank <= batchSize) {
            return 0;
        }
        long batchesAhead = (rank - 1) / batchSize;
        return (int) (batchesAhead * Math.min(avgCheckoutMinutes, processingMinutes));
    }
}
