package net.cloudjob.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 크론 기반 잡 생성 규칙. 기동 시 설정에서 읽고 런타임에는 불변 */
public record CronJobDefinition(
        String name,
        String description,
        JobType jobType,
        String cronExpression,
        Map<String, Object> config,
        int maxRetries,
        boolean enabled
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    public CronJobDefinition {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        description = description == null ? "" : description;
    }
}
