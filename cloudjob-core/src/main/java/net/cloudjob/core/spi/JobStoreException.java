package net.cloudjob.core.spi;

/** 저장소 호출 실패(연결 불가, HTTP 오류 등) */
public class JobStoreException extends RuntimeException {
    private final int statusCode;

    public JobStoreException(String message, Throwable cause) {
        this(0, message, cause);
    }

    public JobStoreException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP 상태 코드. 알 수 없으면 0 */
    public int getStatusCode() {
        return statusCode;
    }
}
