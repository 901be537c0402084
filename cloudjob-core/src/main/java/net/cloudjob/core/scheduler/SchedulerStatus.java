package net.cloudjob.core.scheduler;

import net.cloudjob.core.model.JobStatistics;

import java.util.List;

/**
 * 코디네이터 상태 스냅샷.
 * statistics 는 저장소 조회에 실패하면 null.
 */
public record SchedulerStatus(
        String instanceId,
        boolean running,
        boolean healthy,
        List<PeriodicLoop.LoopStatus> loops,
        long executed,
        long succeeded,
        long failed,
        long created,
        long creationErrors,
        long released,
        JobStatistics statistics
) {
    public SchedulerStatus {
        loops = List.copyOf(loops);
    }
}
