package com.phillippitts.wfmparity.config;

import com.phillippitts.wfmparity.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void calcExecutorUsesConfiguredSizes() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

        Executor executor = config.calcExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) executor;
        assertThat(pool.getCorePoolSize()).isEqualTo(4);
        assertThat(pool.getMaxPoolSize()).isEqualTo(8);
        assertThat(pool.getThreadNamePrefix()).isEqualTo("calc-pool-");
        pool.shutdown();
    }

    @Test
    void propagatesJobIdToWorkerThreads() throws InterruptedException {
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties())
                .calcExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        ThreadContext.put("jobId", "job-42");
        pool.execute(() -> {
            seen.set(ThreadContext.get("jobId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("job-42");
        pool.shutdown();
    }
}
