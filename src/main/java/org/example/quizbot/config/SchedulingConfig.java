package org.example.quizbot.config;

import org.example.quizbot.model.RotationSchedule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Time source, rotation table and the two thread pools: one that only fires daily triggers,
 * one that runs the (possibly slow) batch dispatches.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public RotationSchedule rotationSchedule(QuizBotConfigValidator validator) {
        return validator.toRotationSchedule();
    }

    @Bean
    @Primary
    public Clock clock(RotationSchedule rotationSchedule) {
        return Clock.system(rotationSchedule.zone());
    }

    @Bean(name = "rotationTaskScheduler")
    public ThreadPoolTaskScheduler rotationTaskScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setRemoveOnCancelPolicy(true);
        s.setThreadNamePrefix("rotation-");
        return s;
    }

    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
