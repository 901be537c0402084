package net.cloudjob.adapter.jdbc.mapper;

import net.cloudjob.adapter.jdbc.JdbcUtil;
import net.cloudjob.core.model.Job;
import net.cloudjob.core.model.JobStatus;
import net.cloudjob.core.model.JobType;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getString("JOB_ID"),
                rs.getString("NAME"),
                rs.getString("DESCRIPTION"),
                JobType.from(rs.getString("JOB_TYPE")),
                JdbcUtil.fromJson(rs.getString("CONFIG")),
                JobStatus.from(rs.getString("STATUS")),
                rs.getInt("MAX_RETRIES"),
                rs.getInt("CURRENT_RETRIES"),
                rs.getString("LOCKED_BY"),
                JdbcUtil.getInstant(rs, "LOCKED_AT"),
                JdbcUtil.getInstant(rs, "LOCK_EXPIRES_AT"),
                JdbcUtil.getInstant(rs, "NOT_BEFORE"),
                JdbcUtil.getInstant(rs, "LAST_EXECUTION"),
                JdbcUtil.getInstant(rs, "CREATED_AT")
        );
    }
}
