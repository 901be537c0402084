package net.cloudjob.core.service;

import net.cloudjob.core.model.ExecutionResult;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobType;
import net.cloudjob.core.spi.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/** job_type → JobHandler 라우팅. 핸들러 예외와 Error(OOM 제외)는 실패 결과로 바꿔서 실행 루프가 죽지 않게 한다 */
public final class JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

    public JobDispatcher(Collection<? extends JobHandler> handlers) {
        for (JobHandler h : handlers) {
            JobHandler prev = this.handlers.put(h.type(), h);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate handler for job type: " + h.type().code());
            }
        }
    }

    public ExecutionResult execute(Job job) {
        JobHandler handler = handlers.get(job.jobType());
        if (handler == null) {
            return ExecutionResult.failure("No handler registered for job type: " + job.jobType().code());
        }
        try {
            ExecutionResult r = handler.execute(job.config());
            return r == null ? ExecutionResult.failure("Handler returned no result") : r;
        } catch (Throwable t) {
            if (isFatal(t)) throw (Error) t;
            log.error("Handler failed for job {} ({})", job.jobId(), job.name(), t);
            return ExecutionResult.failure(t.getClass().getSimpleName() + ": " + t.getMessage());
        }
    }

    /** 메모리 고갈, 내부 VM 오류는 삼키지 않는다. StackOverflowError 는 스택이 풀리면 복구 가능 */
    public static boolean isFatal(Throwable t) {
        return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
    }

    public Set<JobType> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
