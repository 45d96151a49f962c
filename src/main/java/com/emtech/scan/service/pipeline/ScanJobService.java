package com.emtech.scan.service.pipeline;

import com.emtech.scan.config.ScanProperties;
import com.emtech.scan.model.Document;
import com.emtech.scan.model.ScanReport;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Registry of background scans. Finished jobs are kept for polling until the retention limit is
 * exceeded, oldest first.
 */
@Service
public class ScanJobService {

    private static final Logger log = LoggerFactory.getLogger(ScanJobService.class);

    private final ScanPipeline pipeline;
    private final AsyncTaskExecutor scanExecutor;
    private final int maxJobsRetained;
    private final AtomicLong counter = new AtomicLong();
    private final Map<Long, ScanJob> jobs = new ConcurrentHashMap<>();

    public ScanJobService(ScanPipeline pipeline,
                          @Qualifier("scanExecutor") AsyncTaskExecutor scanExecutor,
                          ScanProperties properties) {
        this.pipeline = pipeline;
        this.scanExecutor = scanExecutor;
        this.maxJobsRetained = Math.max(1, properties.pipeline().maxJobsRetained());
    }

    public ScanJob submit(Document document) {
        ScanJob job = new ScanJob(counter.incrementAndGet(), document.id(), document.name());
        jobs.put(job.getId(), job);
        evictFinished();
        try {
            scanExecutor.execute(() -> run(job, document));
        } catch (RejectedExecutionException ex) {
            jobs.remove(job.getId());
            throw ex;
        }
        log.info("Queued scan job {} for document {} ({})", job.getId(), document.id(), document.name());
        return job;
    }

    public Optional<ScanJob> find(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /**
     * Requests cancellation. A queued job never starts; a running job stops issuing page work.
     *
     * @return the job, if it exists
     */
    public Optional<ScanJob> cancel(long id) {
        ScanJob job = jobs.get(id);
        if (job == null) {
            return Optional.empty();
        }
        job.getControl().cancel();
        if (!job.cancelIfQueued() && job.getState() == ScanJobState.RUNNING) {
            log.info("Cancellation requested for running scan job {}", id);
        }
        return Optional.of(job);
    }

    private void run(ScanJob job, Document document) {
        if (!job.start()) {
            log.info("Scan job {} was cancelled before it started", job.getId());
            return;
        }
        try {
            ScanReport report = pipeline.scan(document, job.getControl());
            job.finish(report);
        } catch (RuntimeException ex) {
            log.error("Scan job {} failed", job.getId(), ex);
            job.finish(ScanReport.failed(document.id(), document.name(), ex.getMessage(), null));
        }
    }

    private void evictFinished() {
        int excess = jobs.size() - maxJobsRetained;
        if (excess <= 0) {
            return;
        }
        jobs.values().stream()
                .filter(job -> job.getState().isFinished())
                .sorted(Comparator.comparing(ScanJob::getCreatedAt).thenComparingLong(ScanJob::getId))
                .limit(excess)
                .map(ScanJob::getId)
                .toList()
                .forEach(jobs::remove);
    }
}
