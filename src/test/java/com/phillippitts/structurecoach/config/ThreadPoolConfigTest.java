package com.phillippitts.structurecoach.config;

import com.phillippitts.structurecoach.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateAnalysisExecutorFromDefaults() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).analysisExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(8);
            assertThat(executor.getMaxPoolSize()).isEqualTo(16);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("analysis-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateEventExecutorFromDefaults() {
        Executor executor = new ThreadPoolConfig(new ThreadPoolProperties()).eventExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("event-pool-");
        taskExecutor.shutdown();
    }

    @Test
    void analysisExecutorRejectsWhenSaturated() throws InterruptedException {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getAnalysis().setCorePoolSize(1);
        props.getAnalysis().setMaxPoolSize(1);
        props.getAnalysis().setQueueCapacity(0);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(props).analysisExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void propagatesThreadContextToWorkers() throws Exception {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).analysisExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        try {
            ThreadContext.put("practiceId", "11");
            CompletableFuture.runAsync(() -> seen.set(ThreadContext.get("practiceId")), executor)
                    .get(5, TimeUnit.SECONDS);

            assertThat(seen.get()).isEqualTo("11");
        } finally {
            executor.shutdown();
        }
    }
}
