package io.recur4j.internal.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.recur4j.JobStore;
import io.recur4j.core.Channel;
import io.recur4j.core.DispatchTarget;
import io.recur4j.core.InvalidScheduleException;
import io.recur4j.core.PersistResult;
import io.recur4j.core.RetryPolicy;
import io.recur4j.core.ScheduleJob;
import io.recur4j.core.ScheduleRule;
import io.recur4j.core.ScheduleType;
import io.recur4j.internal.SimpleRuleBuilder;
import io.recur4j.utils.CivilTimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Rules are stored in their wire encoding (civil run_at text, comma-separated slots and weekday
 * tokens) and rebuilt through {@link SimpleRuleBuilder#buildUnchecked()} on read, so rows written by
 * older tooling (legacy {@code timeOfDay}, full day names) still load. Every write increments
 * {@code version}.
 */
public class MongoJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private static final TypeReference<Map<String, String>> HEADERS_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final ZoneId defaultZone;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, ZoneId defaultZone) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    }

    /**
     * Insert when the job has no id; otherwise update its editable fields by id.
     *
     * <p>Returns CREATED for an insert, UPDATED when an existing document was updated, and NOOP when no
     * document has the id (a deleted job is never brought back).
     */
    @Override
    public PersistResult save(ScheduleJob job) {
        Objects.requireNonNull(job, "job must not be null");

        if (isBlank(job.id())) {
            ScheduleJobDocument doc = toDocument(job);
            mongoTemplate.insert(doc);
            return PersistResult.createdResult(doc.getId());
        }

        Query query = new Query(Criteria.where("_id").is(job.id()));
        Update update = buildEditUpdate(job);

        UpdateResult result = mongoTemplate.updateFirst(query, update, ScheduleJobDocument.class);
        return result.getMatchedCount() > 0
                ? PersistResult.updatedResult(job.id())
                : PersistResult.noop(job.id());
    }

    private Update buildEditUpdate(ScheduleJob job) {
        ScheduleRule rule = job.rule();
        DispatchTarget target = job.target();
        RetryPolicy retry = job.retry() == null ? RetryPolicy.defaults() : job.retry();

        Update u = new Update();
        u.set("name", job.name());
        u.set("enabled", job.enabled());

        u.set("scheduleType", rule.type());
        u.set("runAt", rule.runAt() == null ? null : CivilTimeFormat.formatCivil(rule.runAt()));
        u.unset("timeOfDay");
        u.set("timesOfDay", CivilTimeFormat.formatSlots(rule.timesOfDay()));
        u.set("daysOfWeek", CivilTimeFormat.formatDays(rule.daysOfWeek()));
        u.set("timezone", rule.timezone().getId());

        u.set("nextRunAt", job.nextRunAt());
        u.set("nextRunRuleHash", job.nextRunRuleHash());

        u.set("channel", target.channel());
        u.set("httpMethod", target.httpMethod());
        u.set("httpUrl", target.channel() == Channel.HTTP ? target.destination() : null);
        u.set("httpHeadersJson", writeHeaders(target.headers()));
        u.set("contentType", target.contentType());
        u.set("mqttTopic", target.channel() == Channel.MQTT ? target.destination() : null);
        u.set("qos", target.qos());
        u.set("retained", target.retained());
        u.set("payload", target.payload());

        u.set("maxRetries", retry.maxRetries());
        u.set("retryBackoffSec", retry.retryBackoffSec());
        u.set("timeoutSec", retry.timeoutSec());

        u.set("lastRunAt", job.lastRunAt());
        u.set("updatedAt", job.updatedAt() != null ? job.updatedAt() : Instant.now());
        u.inc("version", 1);
        return u;
    }

    private ScheduleJobDocument toDocument(ScheduleJob job) {
        ScheduleRule rule = job.rule();
        DispatchTarget target = job.target();
        RetryPolicy retry = job.retry() == null ? RetryPolicy.defaults() : job.retry();
        Instant now = job.createdAt() != null ? job.createdAt() : Instant.now();

        ScheduleJobDocument doc = new ScheduleJobDocument();
        doc.setName(job.name());
        doc.setEnabled(job.enabled());

        doc.setScheduleType(rule.type());
        doc.setRunAt(rule.runAt() == null ? null : CivilTimeFormat.formatCivil(rule.runAt()));
        doc.setTimesOfDay(CivilTimeFormat.formatSlots(rule.timesOfDay()));
        doc.setDaysOfWeek(CivilTimeFormat.formatDays(rule.daysOfWeek()));
        doc.setTimezone(rule.timezone().getId());

        doc.setNextRunAt(job.nextRunAt());
        doc.setNextRunRuleHash(job.nextRunRuleHash());

        doc.setChannel(target.channel());
        doc.setHttpMethod(target.httpMethod());
        doc.setHttpUrl(target.channel() == Channel.HTTP ? target.destination() : null);
        doc.setHttpHeadersJson(writeHeaders(target.headers()));
        doc.setContentType(target.contentType());
        doc.setMqttTopic(target.channel() == Channel.MQTT ? target.destination() : null);
        doc.setQos(target.qos());
        doc.setRetained(target.retained());
        doc.setPayload(target.payload());

        doc.setMaxRetries(retry.maxRetries());
        doc.setRetryBackoffSec(retry.retryBackoffSec());
        doc.setTimeoutSec(retry.timeoutSec());

        doc.setLastRunAt(job.lastRunAt());
        doc.setVersion(1L);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(job.updatedAt() != null ? job.updatedAt() : now);
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(ScheduleJob)}.
     *
     * @throws InvalidScheduleException when the stored rule cannot be parsed (bad slot text, unknown zone)
     */
    public ScheduleJob toJob(ScheduleJobDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        if (doc.getScheduleType() == null) {
            throw new InvalidScheduleException("schedule_type is required");
        }

        ScheduleRule rule = new SimpleRuleBuilder(defaultZone)
                .type(doc.getScheduleType())
                .runAt(doc.getRunAt())
                .timeOfDay(doc.getTimeOfDay())
                .timesOfDay(doc.getTimesOfDay())
                .daysOfWeek(doc.getDaysOfWeek())
                .timezone(doc.getTimezone())
                .buildUnchecked();

        Channel channel = doc.getChannel() == null ? Channel.HTTP : doc.getChannel();
        DispatchTarget target = new DispatchTarget(
                channel,
                channel == Channel.HTTP ? doc.getHttpUrl() : doc.getMqttTopic(),
                doc.getHttpMethod(),
                doc.getContentType(),
                readHeaders(doc.getId(), doc.getHttpHeadersJson()),
                doc.getPayload(),
                doc.getQos(),
                doc.isRetained()
        );

        RetryPolicy retry = new RetryPolicy(doc.getMaxRetries(), doc.getRetryBackoffSec(), doc.getTimeoutSec());

        return new ScheduleJob(
                doc.getId(),
                doc.getName(),
                doc.isEnabled(),
                rule,
                doc.getNextRunAt(),
                doc.getNextRunRuleHash(),
                target,
                retry,
                doc.getLastRunAt(),
                doc.getVersion(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    @Override
    public Optional<ScheduleJob> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ScheduleJobDocument doc = mongoTemplate.findById(id, ScheduleJobDocument.class);
        return Optional.ofNullable(doc).map(this::toJob);
    }

    @Override
    public List<ScheduleJob> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("_id")));
        return toJobs(mongoTemplate.find(q, ScheduleJobDocument.class));
    }

    @Override
    public List<ScheduleJob> findEnabledRecurring() {
        Query q = new Query(
                Criteria.where("enabled").is(true)
                        .and("scheduleType").in(ScheduleType.DAILY, ScheduleType.WEEKLY)
        );
        return toJobs(mongoTemplate.find(q, ScheduleJobDocument.class));
    }

    // A row whose rule no longer parses is skipped rather than failing the whole listing.
    private List<ScheduleJob> toJobs(List<ScheduleJobDocument> docs) {
        List<ScheduleJob> jobs = new ArrayList<>(docs.size());
        for (ScheduleJobDocument d : docs) {
            if (d == null) {
                continue;
            }
            try {
                jobs.add(toJob(d));
            } catch (InvalidScheduleException e) {
                log.warn("recur4j skipped unreadable job id={}: {}", d.getId(), e.getMessage());
            }
        }
        return jobs;
    }

    @Override
    public boolean updateNextRunAt(String id, long expectedVersion, Instant nextRunAt, String ruleHash) {
        Objects.requireNonNull(id, "id must not be null");

        Query q = new Query(
                Criteria.where("_id").is(id)
                        // Only write if nobody touched the job since it was read.
                        .and("version").is(expectedVersion)
        );

        Update u = new Update()
                .set("nextRunAt", nextRunAt)
                .set("nextRunRuleHash", nextRunAt == null ? null : ruleHash)
                .inc("version", 1);

        return mongoTemplate.updateFirst(q, u, ScheduleJobDocument.class).getMatchedCount() > 0;
    }

    @Override
    public boolean enable(String id, long expectedVersion, Instant nextRunAt, String ruleHash) {
        Objects.requireNonNull(id, "id must not be null");

        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("version").is(expectedVersion)
        );

        Update u = new Update()
                .set("enabled", true)
                .set("nextRunAt", nextRunAt)
                .set("nextRunRuleHash", nextRunAt == null ? null : ruleHash)
                .set("updatedAt", Instant.now())
                .inc("version", 1);

        return mongoTemplate.updateFirst(q, u, ScheduleJobDocument.class).getMatchedCount() > 0;
    }

    @Override
    public boolean setEnabled(String id, boolean enabled) {
        Objects.requireNonNull(id, "id must not be null");

        Query q = new Query(Criteria.where("_id").is(id));
        Update u = new Update()
                .set("enabled", enabled)
                .set("updatedAt", Instant.now())
                .inc("version", 1);

        return mongoTemplate.updateFirst(q, u, ScheduleJobDocument.class).getMatchedCount() > 0;
    }

    /**
     * Hard delete job by document id.
     *
     * @return deleted count (0 or 1 normally)
     */
    @Override
    public long deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.remove(q, ScheduleJobDocument.class).getDeletedCount();
    }

    private String writeHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(headers);
        } catch (JsonProcessingException e) {
            throw new InvalidScheduleException("http headers are not serializable", e);
        }
    }

    private Map<String, String> readHeaders(String id, String json) {
        if (isBlank(json)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, HEADERS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("recur4j ignored malformed http headers on job id={}: {}", id, e.getOriginalMessage());
            return Map.of();
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
