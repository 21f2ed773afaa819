package com.work.shield.core.queue;

import com.work.shield.core.config.ProofQueueConfig;
import com.work.shield.core.exception.QueueLookupException;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.prover.Prover;
import com.work.shield.core.prover.ProverFailureReason;
import com.work.shield.core.prover.ProverHandle;
import com.work.shield.core.prover.ProverStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static com.work.shield.core.support.ValidationUtils.requireNonEmpty;
import static com.work.shield.core.support.ValidationUtils.requireNonNull;

/**
 * 证明 job 队列：FIFO 准入 + 并发上限，串行化对共享树状态的证明计算。
 * <p>
 * submit 立即返回，不阻塞；最多 maxConcurrent 个 job 同时交给 {@link Prover}，
 * 其余按提交顺序等待。完成的记录保留 completedRetention 后清理（访问时惰性清理 + 定时清理）。
 * 队列不保证 job 的 oldRoot 在执行时仍是最新，依赖根的请求由调用方自行串行化。
 * </p>
 */
public class ProofJobQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProofJobQueue.class);

    private final Prover prover;
    private final ProofQueueConfig config;
    private final Clock clock;
    private final ThreadPoolExecutor workers;

    private final Map<String, ProofJob> jobs = new LinkedHashMap<>();
    private final Deque<ProofJob> pending = new ArrayDeque<>();
    private final List<ProofJob> running = new ArrayList<>();

    public ProofJobQueue(Prover prover, ProofQueueConfig config) {
        this(prover, config, Clock.systemUTC());
    }

    public ProofJobQueue(Prover prover, ProofQueueConfig config, Clock clock) {
        this.prover = requireNonNull(prover, "prover");
        this.config = requireNonNull(config, "config");
        this.clock = requireNonNull(clock, "clock");
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("proof-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        };
        // 任务只在有空闲槽位时提交，队列长度不会超过 maxConcurrent
        this.workers = new ThreadPoolExecutor(
                config.getMaxConcurrent(), config.getMaxConcurrent(),
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                tf);
    }

    public SubmitReceipt submit(ProofRequest request) {
        requireNonNull(request, "request");
        synchronized (this) {
            evictExpiredLocked(clock.instant());
            ProofJob job = new ProofJob(UUID.randomUUID().toString(), request, clock.instant());
            jobs.put(job.getId(), job);
            pending.addLast(job);
            dispatchLocked();
            SubmitReceipt receipt = new SubmitReceipt(job.getId(), job.view().getQueuePosition(),
                    running.size(), pending.size());
            log.info("proof job submitted jobId={} queuePosition={} active={} queued={}",
                    job.getId(), receipt.getQueuePosition(), receipt.getActiveJobs(), receipt.getQueuedJobs());
            return receipt;
        }
    }

    /**
     * @throws QueueLookupException job 不存在或已被清理
     */
    public synchronized ProofJobView status(String jobId) {
        requireNonEmpty(jobId, "jobId");
        evictExpiredLocked(clock.instant());
        ProofJob job = jobs.get(jobId);
        if (job == null) {
            throw new QueueLookupException(jobId);
        }
        return job.view();
    }

    public synchronized QueueStatus queueStatus() {
        List<String> queuedIds = new ArrayList<>(pending.size());
        for (ProofJob job : pending) {
            queuedIds.add(job.getId());
        }
        List<String> activeIds = new ArrayList<>(running.size());
        for (ProofJob job : running) {
            activeIds.add(job.getId());
        }
        return new QueueStatus(running.size(), pending.size(), config.getMaxConcurrent(), jobs.size(),
                queuedIds, activeIds);
    }

    /**
     * 清理超过保留期的已完成记录。
     *
     * @return 清理条数
     */
    public synchronized int evictExpired() {
        return evictExpiredLocked(clock.instant());
    }

    private int evictExpiredLocked(Instant now) {
        Instant threshold = now.minus(config.getCompletedRetention());
        int evicted = 0;
        Iterator<ProofJob> it = jobs.values().iterator();
        while (it.hasNext()) {
            ProofJob job = it.next();
            Instant completedAt = job.getCompletedAt();
            if (job.getStage().isTerminal() && completedAt != null && !completedAt.isAfter(threshold)) {
                it.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("evicted completed proof jobs count={} remaining={}", evicted, jobs.size());
        }
        return evicted;
    }

    private void dispatchLocked() {
        while (!workers.isShutdown() && running.size() < config.getMaxConcurrent() && !pending.isEmpty()) {
            ProofJob job = pending.pollFirst();
            running.add(job);
            job.start(clock.instant());
            log.info("proof job started jobId={} active={} queued={}", job.getId(), running.size(), pending.size());
            workers.execute(() -> execute(job));
        }
        int position = 1;
        for (ProofJob waiting : pending) {
            waiting.queuedAt(position++, pending.size());
        }
    }

    private void execute(ProofJob job) {
        try {
            ProverHandle handle = prover.submit(job.getRequest());
            while (true) {
                ProverStatus status = prover.poll(handle);
                synchronized (this) {
                    job.apply(status, clock.instant());
                }
                if (status.isTerminal()) {
                    if (status.getError() != null) {
                        log.warn("proof job failed jobId={} error={}", job.getId(), status.getError());
                    }
                    return;
                }
                Thread.sleep(config.getProverPollInterval().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markFailed(job, ProverFailureReason.PROCESS_ERROR.format("interrupted"));
        } catch (RuntimeException e) {
            log.warn("proof job crashed jobId={} err={}", job.getId(), e.getMessage());
            markFailed(job, ProverFailureReason.PROCESS_ERROR.format(String.valueOf(e.getMessage())));
        } finally {
            synchronized (this) {
                running.remove(job);
                log.info("proof job finished jobId={} stage={} active={} queued={}",
                        job.getId(), job.getStage(), running.size(), pending.size());
                dispatchLocked();
            }
        }
    }

    private synchronized void markFailed(ProofJob job, String error) {
        job.fail(error, clock.instant());
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
