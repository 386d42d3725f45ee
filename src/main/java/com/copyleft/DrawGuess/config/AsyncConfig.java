package com.copyleft.DrawGuess.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    public static final String OUTBOUND_EXECUTOR = "outboundExecutor";

    /**
     * 세션별 outbox 를 비우는 전송 전용 풀.
     * 느린 클라이언트가 방 명령 처리 스레드를 붙잡지 않도록 분리한다.
     */
    @Bean(name = OUTBOUND_EXECUTOR)
    public TaskExecutor outboundExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.setThreadNamePrefix("WS-Outbound-");
        executor.setWaitForTasksToCompleteOnShutdown(false);

        executor.initialize();
        return executor;
    }
}
