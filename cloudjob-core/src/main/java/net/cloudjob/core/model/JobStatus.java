package net.cloudjob.core.model;

import java.util.Locale;

/** 잡 상태. 저장소에는 소문자 코드('waiting' 등)로 기록된다. */
public enum JobStatus {
    WAITING, LOCKED, SUCCESS, FAILED, DISABLED, UNKNOWN;

    public static JobStatus from(String s) {
        if (s == null) return UNKNOWN;
        try { return JobStatus.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }

    public String code() { return name().toLowerCase(Locale.ROOT); }
}
