package com.e2eq.lexikon.graph.runtime;

import com.e2eq.lexikon.graph.core.BulkReinferenceJob;
import com.e2eq.lexikon.graph.core.InferenceRule;
import com.e2eq.lexikon.graph.core.ReinferenceCheckpoint;
import io.quarkus.logging.Log;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Collection;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs bulk re-inference jobs in the background, one at a time. Progress is read back from the job's
 * checkpoint.
 */
@ApplicationScoped
public class ReinferenceRunner {

    @Inject
    BulkReinferenceJob job;

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "lexikon-reinference");
        t.setDaemon(true);
        return t;
    });

    public ReinferenceCheckpoint submit(Collection<InferenceRule> rules, int maxDepth) {
        ReinferenceCheckpoint cp = job.start(rules, maxDepth);
        executor.submit(() -> runLogged(cp.jobId(), false));
        return cp;
    }

    public ReinferenceCheckpoint resume(String jobId) {
        ReinferenceCheckpoint cp = status(jobId);
        if (cp.status() != ReinferenceCheckpoint.Status.COMPLETED) {
            executor.submit(() -> runLogged(jobId, true));
        }
        return cp;
    }

    /**
     * @throws NoSuchElementException for an unknown job id
     */
    public ReinferenceCheckpoint status(String jobId) {
        return job.status(jobId)
                .orElseThrow(() -> new NoSuchElementException("Unknown re-inference job " + jobId));
    }

    private void runLogged(String jobId, boolean resume) {
        try {
            ReinferenceCheckpoint done = resume ? job.resume(jobId) : job.execute(jobId);
            Log.infof("ReinferenceRunner: job %s finished with status %s", jobId, done.status());
        } catch (RuntimeException e) {
            Log.error("ReinferenceRunner: job " + jobId + " aborted", e);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
