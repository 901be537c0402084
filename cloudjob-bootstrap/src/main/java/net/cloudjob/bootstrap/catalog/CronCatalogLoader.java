package net.cloudjob.bootstrap.catalog;

import net.cloudjob.bootstrap.props.CloudJobProperties;
import net.cloudjob.core.model.CronJobDefinition;
import net.cloudjob.core.model.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** 설정의 cloudjob.catalog.jobs → CronJobDefinition. 잘못된 항목은 그 항목만 건너뛴다 */
public final class CronCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CronCatalogLoader.class);

    private CronCatalogLoader() {}

    public static List<CronJobDefinition> load(CloudJobProperties.Catalog catalog) {
        if (!catalog.isEnabled()) {
            log.info("Cron catalog disabled");
            return List.of();
        }
        List<CronJobDefinition> defs = new ArrayList<>();
        for (var j : catalog.getJobs()) {
            if (j.getName() == null || j.getName().isBlank() || j.getCronExpression() == null) {
                log.warn("Skipping catalog entry {}: name and cron-expression are required", j);
                continue;
            }
            JobType type = JobType.from(j.getJobType());
            if (type == JobType.UNKNOWN) {
                log.warn("Skipping catalog entry '{}': unknown job type '{}'", j.getName(), j.getJobType());
                continue;
            }
            defs.add(new CronJobDefinition(j.getName(), j.getDescription(), type, j.getCronExpression().trim(),
                    j.getConfig(), j.getMaxRetries(), j.isEnabled()));
        }
        log.info("Cron catalog: {}", defs.stream().map(CronJobDefinition::name).toList());
        return defs;
    }
}
