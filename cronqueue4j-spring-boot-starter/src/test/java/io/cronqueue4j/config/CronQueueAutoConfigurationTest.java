package io.cronqueue4j.config;

import io.cronqueue4j.CronQueue;
import io.cronqueue4j.JobHandler;
import io.cronqueue4j.cron.CronExpressionEngine;
import io.cronqueue4j.cron.QuartzCronExpressionEngine;
import io.cronqueue4j.internal.mongo.CronJobDocument;
import io.cronqueue4j.internal.mongo.MongoJobStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionManager;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CronQueueAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CronQueueConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(MongoDatabaseFactory.class, () -> mock(MongoDatabaseFactory.class))
            .withBean(DemoJobHandler.class, DemoJobHandler::new)
            .withPropertyValues(
                    "cronqueue.enabled=true",
                    "cronqueue.auto-startup=false",
                    "cronqueue.idle-delay=500ms",
                    "cronqueue.lock-duration=5s"
            );

    @Test
    void shouldAutoConfigureCronQueueBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(CronQueue.class);
            assertThat(context).hasSingleBean(CronQueueLifecycle.class);
            assertThat(context).hasSingleBean(CronQueueProperties.class);
            assertThat(context).hasSingleBean(MongoJobStore.class);
            assertThat(context).hasSingleBean(CronQueueMongoIndexConfig.class);
            assertThat(context).doesNotHaveBean(SmartInitializingSingleton.class);

            CronQueueProperties props = context.getBean(CronQueueProperties.class);
            assertThat(props.getIdleDelay()).hasMillis(500);
            assertThat(props.getLockDuration()).hasSeconds(5);
        });
    }

    @Test
    void shouldNotPublishTransactionManager() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(CronQueue.class);
            assertThat(context).doesNotHaveBean(TransactionManager.class);
        });
    }

    @Test
    void applicationTransactionManagerShouldStaySingle() {
        contextRunner
                .withBean("transactionManager", PlatformTransactionManager.class, () -> mock(PlatformTransactionManager.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(CronQueue.class);
                    assertThat(context).hasSingleBean(TransactionManager.class);
                    assertThat(context).hasBean("transactionManager");
                });
    }

    @Test
    void queueShouldNotStartWhenAutoStartupIsDisabled() {
        contextRunner.run(context -> {
            assertThat(context.getBean(CronQueueLifecycle.class).isAutoStartup()).isFalse();
            assertThat(context.getBean(CronQueue.class).isRunning()).isFalse();
        });
    }

    @Test
    void timezoneShouldBeAppliedToCronEngine() {
        contextRunner
                .withPropertyValues("cronqueue.timezone=Asia/Taipei")
                .run(context -> {
                    CronExpressionEngine engine = context.getBean(CronExpressionEngine.class);
                    assertThat(engine).isInstanceOf(QuartzCronExpressionEngine.class);
                    assertThat(((QuartzCronExpressionEngine) engine).getZone()).isEqualTo(ZoneId.of("Asia/Taipei"));
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("cronqueue.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(CronQueue.class);
                    assertThat(context).doesNotHaveBean(CronQueueLifecycle.class);
                });
    }

    static class DemoJobHandler implements JobHandler<CronJobDocument> {
        @Override
        public void execute(CronJobDocument job) {
            // no-op for context bootstrap test
        }
    }
}
