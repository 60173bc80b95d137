package io.tickwork.core.dispatch;

import java.util.List;

public record DispatchResult(boolean anyFailed, String lastErrorMessage, int handlerCount) {

    public static DispatchResult of(List<HandlerOutcome> outcomes) {
        boolean anyFailed = false;
        String lastError = null;
        for (HandlerOutcome outcome : outcomes) {
            if (outcome.failed()) {
                anyFailed = true;
                lastError = outcome.errorMessage();
            }
        }
        return new DispatchResult(anyFailed, lastError, outcomes.size());
    }
}
