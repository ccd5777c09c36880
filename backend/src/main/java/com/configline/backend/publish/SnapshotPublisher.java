package com.configline.backend.publish;

import com.configline.backend.configs.ConfigChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Mirrors the project export to S3 after each committed change. Registered only when publishing
 * is enabled.
 *
 * <p>Uploads run on {@code executor}, never on the writer's thread. A project has at most one
 * queued upload; it exports whatever is committed when it runs, so commits that arrive while it
 * waits ride along.
 */
public class SnapshotPublisher implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(SnapshotPublisher.class);

    private final ProjectExportService exports;
    private final SnapshotPublishService publish;
    private final Executor executor;
    private final Set<String> queued = ConcurrentHashMap.newKeySet();

    /** Uploads on one daemon worker, which keeps a project's uploads in commit order. */
    public SnapshotPublisher(ProjectExportService exports, SnapshotPublishService publish) {
        this(exports, publish, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "snapshot-publish");
            t.setDaemon(true);
            return t;
        }));
    }

    SnapshotPublisher(ProjectExportService exports, SnapshotPublishService publish, Executor executor) {
        this.exports = exports;
        this.publish = publish;
        this.executor = executor;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onConfigChanged(ConfigChangedEvent e) {
        String projectId = e.projectId();
        if (!queued.add(projectId)) return;
        try {
            executor.execute(() -> publishLatest(projectId));
        } catch (RejectedExecutionException ex) {
            queued.remove(projectId);
            log.warn("Snapshot publish for project {} not scheduled: {}", projectId, ex.getMessage());
        }
    }

    private void publishLatest(String projectId) {
        // cleared before exporting so a commit from here on schedules another upload
        queued.remove(projectId);
        try {
            publish.publish(exports.build(projectId));
        } catch (RuntimeException ex) {
            // the next committed change republishes the whole project
            log.warn("Snapshot publish for project {} failed: {}", projectId, ex.getMessage(), ex);
        }
    }

    @Override
    public void destroy() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }
}
