package org.lite.ingestion.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Background job runs of this process, so they can be observed and cancelled on shutdown.
 */
@Component
@Slf4j
public class JobRegistry {

    private final Map<String, Disposable> runningJobs = new ConcurrentHashMap<>();

    public void register(String jobId, Disposable run) {
        runningJobs.put(jobId, run);
        // The run may have finished before it could be registered
        if (run.isDisposed()) {
            runningJobs.remove(jobId, run);
        }
    }

    public void complete(String jobId) {
        runningJobs.remove(jobId);
    }

    public boolean isActive(String jobId) {
        return jobId != null && runningJobs.containsKey(jobId);
    }

    public Set<String> activeJobIds() {
        return Set.copyOf(runningJobs.keySet());
    }

    @PreDestroy
    public void shutdown() {
        if (runningJobs.isEmpty()) {
            return;
        }
        log.info("🛑 Cancelling {} running jobs", runningJobs.size());
        runningJobs.forEach((jobId, run) -> run.dispose());
        runningJobs.clear();
    }
}
