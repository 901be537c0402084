package net.cloudjob.core.spi;

import java.util.concurrent.Callable;

public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;

    /** 트랜잭션이 없는 저장소(HTTP 등)용. 조건부 업데이트가 동시성 제어를 대신한다 */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
            @Override public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}
