package net.cloudjob.core.model;

/** 상태별 카운트. 시점 스캔 결과일 뿐 트랜잭션 스냅샷은 아님 */
public record JobStatistics(
        long total,
        long waiting,
        long locked,
        long success,
        long failed,
        long disabled
) {
    public static JobStatistics empty() {
        return new JobStatistics(0, 0, 0, 0, 0, 0);
    }

    public static JobStatistics count(Iterable<JobStatus> statuses) {
        long total = 0, waiting = 0, locked = 0, success = 0, failed = 0, disabled = 0;
        for (JobStatus s : statuses) {
            total++;
            switch (s) {
                case WAITING -> waiting++;
                case LOCKED -> locked++;
                case SUCCESS -> success++;
                case FAILED -> failed++;
                case DISABLED -> disabled++;
                default -> { }
            }
        }
        return new JobStatistics(total, waiting, locked, success, failed, disabled);
    }
}
