package io.tickwork.cli;

import io.tickwork.core.config.ConfigPaths;
import io.tickwork.core.config.model.TickworkConfig;
import io.tickwork.core.job.Job;
import io.tickwork.core.snapshot.FileJobSnapshotStore;
import io.tickwork.core.snapshot.JobSnapshot;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and stored jobs")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TickworkConfig config = context.configService().load(context.configPath());
            Path jobs = ConfigPaths.resolveSnapshot(config.snapshot().path());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Tick interval: " + config.scheduler().tickIntervalMs() + " ms");
            System.out.println("Jobs file: " + jobs);
            System.out.println("Save on exit: " + config.snapshot().saveOnExit());

            JobSnapshot snapshot = new FileJobSnapshotStore(jobs).load();
            if (snapshot.savedAt() != null) {
                System.out.println("Last saved: " + snapshot.savedAt());
            }
            System.out.println("Stored jobs: " + snapshot.jobs().size());
            for (Job job : snapshot.jobs()) {
                System.out.println("  " + JobLines.format(job));
            }
            if (!snapshot.jobs().isEmpty()) {
                System.out.println("Ids and run history are from the last save; add and run reassign them on load.");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
