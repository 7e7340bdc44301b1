package com.collabim.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(ChatDbExecutorProperties.class)
public class ChatExecutorsConfig {

    /**
     * 阻塞式 DB 操作不允许跑在 Netty eventLoop 上，统一投递到该线程池。
     */
    @Bean("chatDbExecutor")
    public Executor chatDbExecutor(ChatDbExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("chat-db-");
        int core = props.corePoolSizeEffective();
        int max = Math.max(core, props.maxPoolSizeEffective());
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(props.queueCapacityEffective());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        // 已开始的落库不因停机而中断
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
