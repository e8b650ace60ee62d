package io.recur4j.config;

import io.recur4j.internal.mongo.ScheduleJobDocument;
import io.recur4j.internal.mongo.ScheduleRunDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for recur4j.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code recur4j.ensure-indexes-on-startup=true}. In production they usually belong to DB migrations.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_enabled_type</b> on {@code schedule_jobs}: { enabled: 1, scheduleType: 1 }
 *       <br/>Used by bulk recalculation (enabled DAILY/WEEKLY jobs).</li>
 *   <li><b>idx_next_run</b> on {@code schedule_jobs}: { nextRunAt: 1 }
 *       <br/>Used by the executor when polling due jobs.</li>
 *   <li><b>idx_runs_job</b> on {@code schedule_runs}: { jobId: 1, plannedAt: -1 }
 *       <br/>Used by per-job run history.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.schedule_jobs.createIndex({ enabled: 1, scheduleType: 1 }, { name: "idx_enabled_type" });
 * db.schedule_jobs.createIndex({ nextRunAt: 1 }, { name: "idx_next_run" });
 * db.schedule_runs.createIndex({ jobId: 1, plannedAt: -1 }, { name: "idx_runs_job" });
 * </pre>
 */
public class Recur4jMongoIndexConfig {

    private static final Logger log = LoggerFactory.getLogger(Recur4jMongoIndexConfig.class);

    public static final String IDX_ENABLED_TYPE = "idx_enabled_type";
    public static final String IDX_NEXT_RUN = "idx_next_run";
    public static final String IDX_RUNS_JOB = "idx_runs_job";

    private final MongoTemplate mongoTemplate;

    public Recur4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the required indexes. Safe to call repeatedly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleJobDocument.class).ensureIndex(enabledTypeIndex());
        mongoTemplate.indexOps(ScheduleJobDocument.class).ensureIndex(nextRunIndex());
        mongoTemplate.indexOps(ScheduleRunDocument.class).ensureIndex(runsByJobIndex());
        log.info("recur4j indexes ensured: {}, {}, {}", IDX_ENABLED_TYPE, IDX_NEXT_RUN, IDX_RUNS_JOB);
    }

    public static Index enabledTypeIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("scheduleType", Sort.Direction.ASC)
                .named(IDX_ENABLED_TYPE);
    }

    public static Index nextRunIndex() {
        return new Index()
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_NEXT_RUN);
    }

    /**
     * Keys: jobId ASC, plannedAt DESC
     */
    public static Index runsByJobIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("plannedAt", Sort.Direction.DESC)
                .named(IDX_RUNS_JOB);
    }
}
