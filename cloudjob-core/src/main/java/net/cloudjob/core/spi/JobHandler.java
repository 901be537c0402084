package net.cloudjob.core.spi;

import net.cloudjob.core.model.ExecutionResult;
import net.cloudjob.core.model.JobType;

import java.util.Map;

/**
 * 잡 타입별 페이로드 실행기.
 * 리스 만료 후 재픽업으로 같은 잡이 두 번 실행될 수 있으므로 구현은 멱등이어야 한다.
 */
public interface JobHandler {
    JobType type();

    ExecutionResult execute(Map<String, Object> config) throws Exception;
}
