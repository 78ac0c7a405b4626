package dev.minibook.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async execution configuration.
 *
 * <p>TRADEOFF: bounded pool vs. unbounded fan-out. Each delivery is capped by
 * its own timeout, so a fixed pool with a bounded queue is enough. When the
 * queue is full the delivery is dropped and logged, never run on the caller's
 * thread.
 *
 * <p>MDC is copied onto the worker thread so delivery logs keep the acting
 * agent of the write that triggered them.
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Executor for detached webhook fan-out and delivery.
     */
    @Bean(name = "webhookExecutor")
    public TaskExecutor webhookExecutor(WebhookProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(properties.poolSize());
        executor.setMaxPoolSize(properties.poolSize());
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix("webhook-");
        executor.setRejectedExecutionHandler(new DropAndLogPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Propagates MDC context (agent) from the calling thread to the worker thread.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }

    static class DropAndLogPolicy implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Webhook executor saturated (queue={}), dropping delivery", executor.getQueue().size());
        }
    }
}
