package io.recur4j.internal.mongo;

import io.recur4j.core.Channel;
import io.recur4j.core.ScheduleType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for persisted jobs.
 */
@Document(collection = "schedule_jobs")
public class ScheduleJobDocument {

    @Id
    private String id;

    private String name;
    private boolean enabled;

    // rule, stored in its wire encoding
    private ScheduleType scheduleType;
    private String runAt;
    private String timeOfDay; // legacy single slot, read only
    private String timesOfDay;
    private String daysOfWeek;
    private String timezone;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;
    private String nextRunRuleHash;

    // dispatch target
    private Channel channel;
    private String httpMethod;
    private String httpUrl;
    private String httpHeadersJson;
    private String contentType;
    private String mqttTopic;
    private int qos;
    private boolean retained;
    private String payload;

    // executor retry settings
    private int maxRetries;
    private int retryBackoffSec;
    private int timeoutSec;

    private Instant lastRunAt;
    private long version;
    private Instant createdAt;
    private Instant updatedAt;

    public ScheduleJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public ScheduleType getScheduleType() {
        return scheduleType;
    }

    public void setScheduleType(ScheduleType scheduleType) {
        this.scheduleType = scheduleType;
    }

    public String getRunAt() {
        return runAt;
    }

    public void setRunAt(String runAt) {
        this.runAt = runAt;
    }

    public String getTimeOfDay() {
        return timeOfDay;
    }

    public void setTimeOfDay(String timeOfDay) {
        this.timeOfDay = timeOfDay;
    }

    public String getTimesOfDay() {
        return timesOfDay;
    }

    public void setTimesOfDay(String timesOfDay) {
        this.timesOfDay = timesOfDay;
    }

    public String getDaysOfWeek() {
        return daysOfWeek;
    }

    public void setDaysOfWeek(String daysOfWeek) {
        this.daysOfWeek = daysOfWeek;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public String getNextRunRuleHash() {
        return nextRunRuleHash;
    }

    public void setNextRunRuleHash(String nextRunRuleHash) {
        this.nextRunRuleHash = nextRunRuleHash;
    }

    public Channel getChannel() {
        return channel;
    }

    public void setChannel(Channel channel) {
        this.channel = channel;
    }

    public String getHttpMethod() {
        return httpMethod;
    }

    public void setHttpMethod(String httpMethod) {
        this.httpMethod = httpMethod;
    }

    public String getHttpUrl() {
        return httpUrl;
    }

    public void setHttpUrl(String httpUrl) {
        this.httpUrl = httpUrl;
    }

    public String getHttpHeadersJson() {
        return httpHeadersJson;
    }

    public void setHttpHeadersJson(String httpHeadersJson) {
        this.httpHeadersJson = httpHeadersJson;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public String getMqttTopic() {
        return mqttTopic;
    }

    public void setMqttTopic(String mqttTopic) {
        this.mqttTopic = mqttTopic;
    }

    public int getQos() {
        return qos;
    }

    public void setQos(int qos) {
        this.qos = qos;
    }

    public boolean isRetained() {
        return retained;
    }

    public void setRetained(boolean retained) {
        this.retained = retained;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getRetryBackoffSec() {
        return retryBackoffSec;
    }

    public void setRetryBackoffSec(int retryBackoffSec) {
        this.retryBackoffSec = retryBackoffSec;
    }

    public int getTimeoutSec() {
        return timeoutSec;
    }

    public void setTimeoutSec(int timeoutSec) {
        this.timeoutSec = timeoutSec;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
