package io.recur4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.ExecutorClient;
import io.recur4j.JobStore;
import io.recur4j.RunStore;
import io.recur4j.ScheduleAdmin;
import io.recur4j.core.BulkRecalculator;
import io.recur4j.core.RunRecorder;
import io.recur4j.core.ScheduleDefaults;
import io.recur4j.internal.DefaultScheduleAdmin;
import io.recur4j.internal.http.HttpExecutorClient;
import io.recur4j.internal.mongo.MongoJobStore;
import io.recur4j.internal.mongo.MongoRunStore;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Spring Boot auto-configuration entrypoint for recur4j components.
 */
@AutoConfiguration
@ConditionalOnClass({ScheduleAdmin.class, MongoTemplate.class})
@EnableConfigurationProperties(Recur4jProperties.class)
@ConditionalOnProperty(prefix = "recur4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Recur4jConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock recur4jClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleDefaults scheduleDefaults(Recur4jProperties props) {
        return new ScheduleDefaults(ZoneId.of(props.getDefaultTimezone()), props.getOnceFallbackDelay());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, ScheduleDefaults defaults) {
        return new MongoJobStore(mongoTemplate, objectMapper, defaults.defaultZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public RunStore runStore(MongoTemplate mongoTemplate) {
        return new MongoRunStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public RunRecorder runRecorder(RunStore runStore, Recur4jProperties props) {
        return new RunRecorder(runStore, props.getMaxResponseBodyLength(), props.getRecentRunsLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public BulkRecalculator bulkRecalculator(JobStore jobStore, Clock clock) {
        return new BulkRecalculator(jobStore, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutorClient executorClient(Recur4jProperties props, ObjectMapper objectMapper) {
        Recur4jProperties.Executor executor = props.getExecutor();
        return new HttpExecutorClient(
                executor.getControlUrl(),
                executor.getToken(),
                executor.getConnectTimeout(),
                executor.getReadTimeout(),
                objectMapper
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleAdmin scheduleAdmin(JobStore jobStore, BulkRecalculator recalculator, ExecutorClient executorClient,
                                       Clock clock, ScheduleDefaults defaults) {
        return new DefaultScheduleAdmin(jobStore, recalculator, executorClient, clock, defaults);
    }

    @Bean
    @ConditionalOnMissingBean
    protected Recur4jMongoIndexConfig recur4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new Recur4jMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "recur4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton recur4jIndexesInitializer(Recur4jMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
