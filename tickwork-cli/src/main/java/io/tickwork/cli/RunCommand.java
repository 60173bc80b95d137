package io.tickwork.cli;

import io.tickwork.core.config.ConfigPaths;
import io.tickwork.core.config.model.SchedulerConfig;
import io.tickwork.core.config.model.TickworkConfig;
import io.tickwork.core.engine.JobScheduler;
import io.tickwork.core.job.Job;
import io.tickwork.core.snapshot.FileJobSnapshotStore;
import io.tickwork.core.snapshot.SnapshotService;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "run",
    description = {
        "Run the scheduler over the jobs file and report due jobs.",
        "Jobs are loaded as new jobs: ids are reassigned and run history starts empty."
    }
)
public final class RunCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    private final CliContext context;

    @Option(names = "--jobs", description = "Jobs file, defaults to the configured snapshot path")
    Path jobsFile;

    @Option(names = "--duration", description = "Seconds to run, 0 runs until interrupted", defaultValue = "0")
    long durationSeconds;

    @Option(names = "--tick-ms", description = "Tick interval override in milliseconds")
    Long tickMs;

    @Option(
        names = "--no-save",
        description = "Do not save the jobs file after the run; by default it records this run's history"
    )
    boolean noSave;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TickworkConfig config = context.configService().load(context.configPath());
            Path jobs = jobsFile != null ? jobsFile : ConfigPaths.resolveSnapshot(config.snapshot().path());
            SchedulerConfig schedulerConfig = tickMs != null ? new SchedulerConfig(tickMs) : config.scheduler();
            SnapshotService snapshots = new SnapshotService(new FileJobSnapshotStore(jobs), context.clock());

            try (JobScheduler scheduler = new JobScheduler(schedulerConfig, context.clock())) {
                List<Job> loaded = snapshots.restore(scheduler);
                System.out.println("Loaded " + loaded.size() + " job(s) from " + jobs);
                scheduler.onJobDue(new LoggingJobHandler());

                CountDownLatch shutdown = new CountDownLatch(1);
                Thread hook = new Thread(shutdown::countDown);
                Runtime.getRuntime().addShutdownHook(hook);
                scheduler.start();
                try {
                    if (durationSeconds > 0) {
                        shutdown.await(durationSeconds, TimeUnit.SECONDS);
                    } else {
                        shutdown.await();
                    }
                } finally {
                    scheduler.stop();
                    removeHook(hook);
                }

                for (Job job : scheduler.listJobs()) {
                    System.out.println(JobLines.format(job));
                }
                if (config.snapshot().saveOnExit() && !noSave) {
                    snapshots.save(scheduler);
                }
            }
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Run command interrupted");
            return 1;
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }

    private void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            LOG.debug("JVM shutdown in progress, shutdown hook left in place");
        }
    }
}
