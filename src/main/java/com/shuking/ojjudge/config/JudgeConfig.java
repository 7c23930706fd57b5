package com.shuking.ojjudge.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(JudgeProperties.class)
public class JudgeConfig {

    /**
     * 运行用例的线程池，大小即同时运行的用例数上限
     */
    @Bean
    public ThreadPoolTaskExecutor judgeTaskExecutor(JudgeProperties judgeProperties) {
        int parallelism = Math.max(1, judgeProperties.getTestParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setThreadNamePrefix("judge-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }
}
