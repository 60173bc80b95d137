package io.tickwork.core.dispatch;

import io.tickwork.core.job.Job;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HandlerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(HandlerRegistry.class);

    private final List<Registration> handlers = new CopyOnWriteArrayList<>();

    public Subscription subscribe(JobHandler handler) {
        Registration registration = new Registration(Objects.requireNonNull(handler, "handler must not be null"));
        handlers.add(registration);
        return () -> handlers.remove(registration);
    }

    public int size() {
        return handlers.size();
    }

    public CompletableFuture<DispatchResult> dispatch(Job job) {
        List<CompletableFuture<HandlerOutcome>> outcomes = new ArrayList<>();
        for (Registration registration : handlers) {
            outcomes.add(invoke(registration.handler(), job));
        }
        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> DispatchResult.of(outcomes.stream().map(CompletableFuture::join).toList()));
    }

    private CompletableFuture<HandlerOutcome> invoke(JobHandler handler, Job job) {
        CompletionStage<Void> stage;
        try {
            stage = handler.handle(job);
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (Throwable e) {
            LOG.debug("Handler failed for job {}: {}", job.id(), e.toString());
            return CompletableFuture.completedFuture(HandlerOutcome.failure(e));
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(HandlerOutcome.success());
        }
        return stage.toCompletableFuture().handle((ignored, error) -> {
            if (error == null) {
                return HandlerOutcome.success();
            }
            Throwable cause = unwrap(error);
            LOG.debug("Handler failed for job {}: {}", job.id(), cause.toString());
            return HandlerOutcome.failure(cause);
        });
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // Identity wrapper so the same handler can be subscribed twice and unsubscribed independently.
    private static final class Registration {
        private final JobHandler handler;

        private Registration(JobHandler handler) {
            this.handler = handler;
        }

        private JobHandler handler() {
            return handler;
        }
    }
}
