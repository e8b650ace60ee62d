package io.recur4j.internal.mongo;

import io.recur4j.RunStore;
import io.recur4j.core.RunOutcome;
import io.recur4j.core.ScheduleRun;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for execution records.
 *
 * <p>State transitions are single conditional updates, so two writers racing on the same record
 * cannot both win.
 */
public class MongoRunStore implements RunStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("plannedAt"), Sort.Order.desc("_id"));

    private final MongoTemplate mongoTemplate;

    public MongoRunStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public ScheduleRun insert(ScheduleRun run) {
        Objects.requireNonNull(run, "run must not be null");
        ScheduleRunDocument doc = toDocument(run);
        mongoTemplate.insert(doc);
        return run.withId(doc.getId());
    }

    @Override
    public Optional<ScheduleRun> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, ScheduleRunDocument.class)).map(MongoRunStore::toRun);
    }

    @Override
    public boolean markStarted(String id, Instant startedAt) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");

        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("startedAt").is(null)
                        .and("finishedAt").is(null)
        );
        Update u = new Update().set("startedAt", startedAt);

        return mongoTemplate.updateFirst(q, u, ScheduleRunDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean markFinished(String id, RunOutcome outcome, Instant finishedAt) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");

        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("startedAt").ne(null)
                        .and("finishedAt").is(null)
        );
        Update u = new Update()
                .set("finishedAt", finishedAt)
                .set("status", outcome.status())
                .set("responseCode", outcome.responseCode())
                .set("errorMessage", outcome.errorMessage())
                .set("responseBody", outcome.responseBody());

        return mongoTemplate.updateFirst(q, u, ScheduleRunDocument.class).getModifiedCount() > 0;
    }

    @Override
    public List<ScheduleRun> findByJobId(String jobId, int limit) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return find(new Query(Criteria.where("jobId").is(jobId)), limit);
    }

    @Override
    public List<ScheduleRun> findRecent(int limit) {
        return find(new Query(), limit);
    }

    private List<ScheduleRun> find(Query q, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        q.with(NEWEST_FIRST).limit(limit);

        List<ScheduleRunDocument> docs = mongoTemplate.find(q, ScheduleRunDocument.class);
        List<ScheduleRun> runs = new ArrayList<>(docs.size());
        for (ScheduleRunDocument d : docs) {
            if (d != null) {
                runs.add(toRun(d));
            }
        }
        return runs;
    }

    private static ScheduleRunDocument toDocument(ScheduleRun run) {
        ScheduleRunDocument doc = new ScheduleRunDocument();
        doc.setJobId(run.jobId());
        doc.setPlannedAt(run.plannedAt());
        doc.setStartedAt(run.startedAt());
        doc.setFinishedAt(run.finishedAt());
        doc.setStatus(run.status());
        doc.setAttempt(run.attempt());
        doc.setResponseCode(run.responseCode());
        doc.setErrorMessage(run.errorMessage());
        doc.setResponseBody(run.responseBody());
        return doc;
    }

    private static ScheduleRun toRun(ScheduleRunDocument doc) {
        return new ScheduleRun(
                doc.getId(),
                doc.getJobId(),
                doc.getPlannedAt(),
                doc.getStartedAt(),
                doc.getFinishedAt(),
                doc.getStatus(),
                doc.getAttempt(),
                doc.getResponseCode(),
                doc.getErrorMessage(),
                doc.getResponseBody()
        );
    }
}
