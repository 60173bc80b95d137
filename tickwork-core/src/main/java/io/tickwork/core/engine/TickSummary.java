package io.tickwork.core.engine;

public record TickSummary(boolean skipped, int dispatched, int failed) {

    static final TickSummary SKIPPED = new TickSummary(true, 0, 0);
    static final TickSummary IDLE = new TickSummary(false, 0, 0);
}
