package net.cloudjob.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 페이로드 실행 결과 (success, result?, error?) */
public record ExecutionResult(boolean success, Map<String, Object> result, String error) {

    public ExecutionResult {
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static ExecutionResult success(Map<String, Object> result) {
        return new ExecutionResult(true, result, null);
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, Map.of(), error);
    }
}
