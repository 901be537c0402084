package net.cloudjob.adapter.jdbc;

import java.sql.Connection;

/** 현재 스레드의 트랜잭션 커넥션. 저장소는 이 커넥션만 사용한다 */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    public static Connection required() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required");
        return c;
    }
}
