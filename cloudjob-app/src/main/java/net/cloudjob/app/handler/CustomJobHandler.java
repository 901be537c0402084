package net.cloudjob.app.handler;

import net.cloudjob.core.model.ExecutionResult;
import net.cloudjob.core.model.JobType;
import net.cloudjob.core.spi.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/** custom 타입: config 를 로그로 남기고 성공 */
@Component
public class CustomJobHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(CustomJobHandler.class);

    @Override
    public JobType type() {
        return JobType.CUSTOM;
    }

    @Override
    public ExecutionResult execute(Map<String, Object> config) {
        log.info("Executing custom job with config: {}", config);
        return ExecutionResult.success(Map.of(
                "message", "Custom job executed",
                "config", config,
                "executed_at", Instant.now().toString()));
    }
}
