package io.cronqueue4j.config;

import io.cronqueue4j.CronQueue;
import io.cronqueue4j.ErrorHandler;
import io.cronqueue4j.JobHandler;
import io.cronqueue4j.cron.CronExpressionEngine;
import io.cronqueue4j.cron.QuartzCronExpressionEngine;
import io.cronqueue4j.internal.PollingCronQueue;
import io.cronqueue4j.internal.mongo.CronJobDocument;
import io.cronqueue4j.internal.mongo.MongoJobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.ZoneId;

/**
 * Spring Boot auto-configuration entrypoint for CronQueue components.
 *
 * <p>Jobs are handed to the single {@code JobHandler<CronJobDocument>} bean, if any.
 */
@AutoConfiguration
@ConditionalOnClass({CronQueue.class, MongoTemplate.class})
@EnableConfigurationProperties(CronQueueProperties.class)
@ConditionalOnProperty(prefix = "cronqueue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronQueueConfig {

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobStore<CronJobDocument> cronQueueJobStore(MongoTemplate mongoTemplate,
                                                               MongoDatabaseFactory databaseFactory) {
        // kept private to the store so the application's own transaction manager stays the default
        return MongoJobStore.forCronJobs(mongoTemplate, new MongoTransactionManager(databaseFactory));
    }

    @Bean
    @ConditionalOnMissingBean
    public CronExpressionEngine cronExpressionEngine(CronQueueProperties props) {
        String timezone = props.getTimezone();
        if (timezone == null || timezone.isBlank()) {
            return new QuartzCronExpressionEngine();
        }
        return new QuartzCronExpressionEngine(ZoneId.of(timezone));
    }

    @Bean
    @ConditionalOnMissingBean
    protected CronQueueMongoIndexConfig cronQueueMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CronQueueMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronQueue<CronJobDocument> cronQueue(CronQueueProperties props,
                                                MongoJobStore<CronJobDocument> jobStore,
                                                CronExpressionEngine cronEngine,
                                                ObjectProvider<JobHandler<CronJobDocument>> handlerProvider,
                                                ObjectProvider<ErrorHandler> errorHandlerProvider) {
        SchedulerConfig<CronJobDocument> config = props.applyTo(SchedulerConfig.<CronJobDocument>builder())
                .onNewJob(handlerProvider.getIfUnique(JobHandler::noop))
                .onError(errorHandlerProvider.getIfUnique(() -> ErrorHandler.LOGGING))
                .build();
        return new PollingCronQueue<>(config, jobStore, CronJobDocument.ACCESSOR, cronEngine);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronQueueLifecycle cronQueueLifecycle(CronQueue<CronJobDocument> cronQueue, CronQueueProperties props) {
        return new CronQueueLifecycle(cronQueue, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronqueue", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton cronQueueIndexesInitializer(CronQueueMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
