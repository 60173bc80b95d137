package io.tickwork.core.dispatch;

public record HandlerOutcome(boolean failed, String errorMessage) {

    private static final HandlerOutcome SUCCESS = new HandlerOutcome(false, null);

    public static HandlerOutcome success() {
        return SUCCESS;
    }

    public static HandlerOutcome failure(Throwable error) {
        String message = error.getMessage();
        return new HandlerOutcome(true, message != null ? message : error.toString());
    }
}
