package net.cloudjob.adapter.rest;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.lang.reflect.RecordComponent;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class CloudJobsSchemaTest {

    static String sql(String name) throws Exception {
        try (InputStream in = CloudJobsSchemaTest.class.getResourceAsStream("/db/migration/postgres/" + name)) {
            assertThat(in).as(name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void migrations_declareEveryWireColumn() throws Exception {
        String ddl = sql("V1__create_cloud_jobs.sql") + sql("V2__add_not_before.sql");

        for (RecordComponent c : JobRow.class.getRecordComponents()) {
            String column = c.getAccessor().getAnnotation(JsonProperty.class) != null
                    ? c.getAccessor().getAnnotation(JsonProperty.class).value()
                    : c.getName();
            assertThat(ddl).as(column).containsPattern("\\b" + column + "\\s+[A-Z]{4,}");
        }
    }

    @Test
    void baseTable_hasNoNotBefore_soImmediateRetryWorksOnIt() throws Exception {
        assertThat(sql("V1__create_cloud_jobs.sql")).doesNotContain("not_before");
        assertThat(Arrays.stream(RestJobStore.RETRY_COLUMNS.split(",")))
                .allSatisfy(col -> assertThat(sql("V1__create_cloud_jobs.sql")).contains(col));
    }
}
