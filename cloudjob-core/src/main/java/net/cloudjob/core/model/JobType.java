package net.cloudjob.core.model;

/** 페이로드 핸들러 선택 키 */
public enum JobType {
    PAPER_FETCH("paper_fetch"),
    MAINTENANCE("maintenance"),
    CUSTOM("custom"),
    UNKNOWN("unknown");

    private final String code;

    JobType(String code) { this.code = code; }

    public static JobType from(String s) {
        if (s == null) return UNKNOWN;
        for (JobType t : values()) {
            if (t.code.equalsIgnoreCase(s) || t.name().equalsIgnoreCase(s)) return t;
        }
        return UNKNOWN;
    }

    public String code() { return code; }
}
