package com.jreinhal.hragent.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for agent runs and language-model calls.
 *
 * <p>A task on one pool only waits on tasks of another pool: {@code agentExecutor} runs whole
 * pipelines, {@code scoringExecutor} runs the LLM branch of hybrid scoring, and
 * {@code llmCallExecutor} runs the gateway calls both of them wait on.</p>
 *
 * <p>A saturated pool rejects with {@link RejectedExecutionException}; the submitting stage
 * degrades to its fallback.</p>
 */
@Configuration
public class AgentExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutorConfig.class);

    static final int MIN_QUEUE = 10;
    static final int MIN_FIXED_QUEUE = 50;

    @Bean(name = {"agentExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor agentExecutor(
            @Value("${hragent.executor.core-threads:4}") int coreThreads,
            @Value("${hragent.executor.max-threads:8}") int maxThreads,
            @Value("${hragent.executor.queue-capacity:100}") int queueCapacity) {
        return newPool(new PoolSpec("agent-exec-", "agent run", coreThreads, maxThreads, queueCapacity));
    }

    @Bean(name = {"llmCallExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor llmCallExecutor(
            @Value("${hragent.executor.llm-threads:8}") int threads) {
        return newPool(PoolSpec.fixed("llm-call-", "language model call", threads));
    }

    @Bean(name = {"scoringExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor scoringExecutor(
            @Value("${hragent.executor.scoring-threads:4}") int threads) {
        return newPool(PoolSpec.fixed("scoring-", "hybrid scoring branch", threads));
    }

    static ThreadPoolExecutor newPool(PoolSpec spec) {
        AtomicInteger started = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, spec.threadPrefix() + started.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(spec.coreThreads(), spec.maxThreads(), 30L,
                TimeUnit.SECONDS, new ArrayBlockingQueue<>(spec.queueCapacity()), threads, new OverloadHandler(spec));
        executor.allowCoreThreadTimeOut(true);
        log.info("Pool for {} ready: threads {}..{}, queue {}", spec.purpose(), spec.coreThreads(),
                spec.maxThreads(), spec.queueCapacity());
        return executor;
    }

    /**
     * Sizing of one pool. Core is at least one thread, max at least core, queue at least
     * {@link #MIN_QUEUE}.
     */
    record PoolSpec(String threadPrefix, String purpose, int coreThreads, int maxThreads, int queueCapacity) {

        PoolSpec {
            coreThreads = Math.max(1, coreThreads);
            maxThreads = Math.max(coreThreads, maxThreads);
            queueCapacity = Math.max(MIN_QUEUE, queueCapacity);
        }

        /** Fixed-size pool queueing ten tasks per thread, never fewer than {@link #MIN_FIXED_QUEUE}. */
        static PoolSpec fixed(String threadPrefix, String purpose, int threads) {
            return new PoolSpec(threadPrefix, purpose, threads, threads, Math.max(MIN_FIXED_QUEUE, threads * 10));
        }
    }

    public static final class OverloadHandler implements RejectedExecutionHandler {
        private final PoolSpec spec;
        private final AtomicLong rejected = new AtomicLong();

        OverloadHandler(PoolSpec spec) {
            this.spec = spec;
        }

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            long count = this.rejected.incrementAndGet();
            log.warn("No capacity for {}: active={}, queued={}, rejected so far={}", this.spec.purpose(),
                    executor.getActiveCount(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("No capacity for " + this.spec.purpose() + " ("
                    + this.spec.queueCapacity() + " queued)");
        }

        public long rejectedCount() {
            return this.rejected.get();
        }
    }
}
