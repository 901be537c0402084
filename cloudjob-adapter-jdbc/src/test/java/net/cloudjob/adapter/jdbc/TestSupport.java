package net.cloudjob.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static DataSource ds;
    protected static Path dbFile;

    @BeforeAll
    void setupDb() throws Exception {
        // 임시 파일 DB (메모리 DB 는 커넥션마다 따로라 경합 테스트가 안 됨)
        dbFile = Files.createTempFile("cloudjob-test-", ".db");

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:sqlite:" + dbFile.toAbsolutePath());
        cfg.setMaximumPoolSize(8);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        cfg.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        cfg.addDataSourceProperty("busy_timeout", "10000");
        cfg.addDataSourceProperty("journal_mode", "WAL");
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/sqlite")
                .load()
                .migrate();
    }

    @AfterAll
    void cleanup() throws Exception {
        if (ds instanceof HikariDataSource h) h.close();
        if (dbFile != null) {
            Files.deleteIfExists(dbFile);
            Files.deleteIfExists(Path.of(dbFile + "-wal"));
            Files.deleteIfExists(Path.of(dbFile + "-shm"));
        }
    }
}
