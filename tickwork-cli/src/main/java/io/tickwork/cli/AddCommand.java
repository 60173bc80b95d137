package io.tickwork.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.tickwork.core.config.ConfigPaths;
import io.tickwork.core.config.model.TickworkConfig;
import io.tickwork.core.engine.JobScheduler;
import io.tickwork.core.job.Job;
import io.tickwork.core.job.JobInput;
import io.tickwork.core.schedule.Schedule;
import io.tickwork.core.snapshot.FileJobSnapshotStore;
import io.tickwork.core.snapshot.SnapshotService;
import io.tickwork.core.time.NaturalTimeParser;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "add",
    description = {
        "Add a job to the jobs file.",
        "Existing jobs are reloaded as new jobs: ids are reassigned and run history is cleared."
    }
)
public final class AddCommand implements Callable<Integer> {
    private final CliContext context;
    private final ObjectMapper mapper = new ObjectMapper();

    @Option(names = "--name", required = true, description = "Job name")
    String name;

    @ArgGroup(exclusive = true, multiplicity = "1")
    ScheduleOptions schedule;

    @Option(names = "--anchor", description = "Anchor for --every, epoch milliseconds")
    Long anchorMs;

    @Option(names = "--group", description = "Group id used for filtering")
    String groupId;

    @Option(names = "--description", description = "Free text description")
    String description;

    @Option(names = "--payload", description = "JSON payload forwarded to handlers")
    String payload;

    @Option(names = "--disabled", description = "Create the job disabled")
    boolean disabled;

    @Option(names = "--jobs", description = "Jobs file, defaults to the configured snapshot path")
    Path jobsFile;

    public AddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TickworkConfig config = context.configService().load(context.configPath());
            Path jobs = jobsFile != null ? jobsFile : ConfigPaths.resolveSnapshot(config.snapshot().path());
            Schedule resolved = schedule.toSchedule(anchorMs, new NaturalTimeParser(context.clock(), ZoneOffset.UTC));
            JsonNode payloadNode = payload == null ? NullNode.getInstance() : mapper.readTree(payload);

            SnapshotService snapshots = new SnapshotService(new FileJobSnapshotStore(jobs), context.clock());
            try (JobScheduler scheduler = new JobScheduler(config.scheduler(), context.clock())) {
                snapshots.restore(scheduler);
                Job job = scheduler.addJob(new JobInput(name, groupId, description, !disabled, resolved, payloadNode));
                snapshots.save(scheduler);
                System.out.println("Added job: " + JobLines.format(job));
                if (job.enabled() && !job.state().isScheduled()) {
                    System.out.println("Warning: schedule has no upcoming occurrence");
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Add command failed: " + e.getMessage());
            return 1;
        }
    }
}
