package com.hargapangan.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.EVIDENCE_EXECUTOR)
    Executor evidenceExecutor;

    @Autowired
    @Qualifier(AsyncConfig.JOB_SCHEDULER)
    ThreadPoolTaskScheduler jobScheduler;

    @Test
    @DisplayName("price view caches and the region cache are created and usable")
    void cachesCreatedAndUsed() {
        for (String name : CaffeineConfig.PRICE_VIEW_CACHES) {
            assertThat(cacheManager.getCache(name)).as(name).isNotNull();
        }
        assertThat(cacheManager.getCache(CaffeineConfig.REGION_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.CURRENT_PRICES_CACHE).put("2026-03-10", "rows");
        assertThat(cacheManager.getCache(CaffeineConfig.CURRENT_PRICES_CACHE).get("2026-03-10").get()).isEqualTo("rows");
    }

    @Test
    @DisplayName("evidence executor is a two-thread pool")
    void executorCreated() {
        assertThat(evidenceExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) evidenceExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(2);
        assertThat(e.getThreadNamePrefix()).isEqualTo("evidence-");
    }

    @Test
    @DisplayName("job scheduler has one thread for each scheduled job")
    void jobSchedulerSizedToJobs() {
        assertThat(jobScheduler.getThreadNamePrefix()).isEqualTo("job-scheduler-");
        assertThat(jobScheduler.getScheduledThreadPoolExecutor().getCorePoolSize())
                .isEqualTo(AsyncConfig.SCHEDULED_JOBS.size())
                .isEqualTo(2);
    }
}
