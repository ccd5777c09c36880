package com.configline.backend.publish;

import com.configline.backend.configs.ConfigChangedEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SnapshotPublisherTest {

    private final QueuedExecutor executor = new QueuedExecutor();
    private final CountingExports exports = new CountingExports();
    private final SnapshotPublishServiceTest.FakeStore store = new SnapshotPublishServiceTest.FakeStore();
    private final SnapshotPublisher publisher = new SnapshotPublisher(exports,
            new SnapshotPublishService(store, "configline", "configs/", new ObjectMapper()), executor);

    @Test
    void commit_doesNotUploadOnTheWritersThread() {
        publisher.onConfigChanged(changed("p1"));

        assertEquals(0, exports.builds.size());
        assertEquals(1, executor.tasks.size());

        executor.runAll();
        assertEquals(List.of("p1"), exports.builds);
        assertTrue(store.lastJson.length > 0);
    }

    @Test
    void commitsWhileAnUploadIsQueued_shareIt() {
        publisher.onConfigChanged(changed("p1"));
        publisher.onConfigChanged(changed("p1"));
        publisher.onConfigChanged(changed("p2"));
        assertEquals(2, executor.tasks.size());

        executor.runAll();
        assertEquals(List.of("p1", "p2"), exports.builds);

        // once it ran, the next commit schedules a fresh upload
        publisher.onConfigChanged(changed("p1"));
        assertEquals(1, executor.tasks.size());
    }

    @Test
    void failedUpload_isLoggedAndNextCommitRetries() {
        exports.fail = true;
        publisher.onConfigChanged(changed("p1"));
        executor.runAll();

        exports.fail = false;
        publisher.onConfigChanged(changed("p1"));
        executor.runAll();
        assertEquals(List.of("p1", "p1"), exports.builds);
    }

    private static ConfigChangedEvent changed(String projectId) {
        return new ConfigChangedEvent(projectId, UUID.randomUUID(), "flags", false);
    }

    static class QueuedExecutor implements Executor {
        final List<Runnable> tasks = new ArrayList<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        void runAll() {
            List<Runnable> now = new ArrayList<>(tasks);
            tasks.clear();
            now.forEach(Runnable::run);
        }
    }

    static class CountingExports extends ProjectExportService {
        final List<String> builds = new ArrayList<>();
        boolean fail;

        CountingExports() {
            super(null, null, null, null);
        }

        @Override
        public ProjectExport build(String projectId) {
            builds.add(projectId);
            if (fail) throw new IllegalStateException("database unavailable");
            return new ProjectExport(projectId, List.of());
        }
    }
}
