package com.leadfunnel.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.*;

class SchedulingConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(SchedulingConfig.class);

    @Test
    void taskScheduler_ShouldBeLeftForTheContainerToInitialize() {
        ThreadPoolTaskScheduler scheduler = (ThreadPoolTaskScheduler) new SchedulingConfig().taskScheduler();

        assertThatThrownBy(scheduler::getScheduledExecutor).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void taskScheduler_ShouldRunOnOneNamedThreadOnceStarted() {
        contextRunner.run(context -> {
            ThreadPoolTaskScheduler scheduler = context.getBean(ThreadPoolTaskScheduler.class);

            assertThat(scheduler.getScheduledExecutor()).isNotNull();
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("ad-scheduler-");
        });
    }
}
