package io.tickwork.cli;

import io.tickwork.core.dispatch.JobHandler;
import io.tickwork.core.job.Job;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LoggingJobHandler implements JobHandler {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingJobHandler.class);

    @Override
    public CompletionStage<Void> handle(Job job) {
        LOG.info("Job due: {} ({}) payload={}", job.name(), job.id(), job.payload());
        System.out.println("Due: " + job.name() + " " + job.payload());
        return CompletableFuture.completedFuture(null);
    }
}
