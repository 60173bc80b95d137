package io.tickwork.core.dispatch;

import io.tickwork.core.job.Job;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface JobHandler {

    CompletionStage<Void> handle(Job job) throws Exception;

    static JobHandler of(Callback callback) {
        return job -> {
            callback.accept(job);
            return CompletableFuture.completedFuture(null);
        };
    }

    @FunctionalInterface
    interface Callback {
        void accept(Job job) throws Exception;
    }
}
