package io.tickwork.cli;

import picocli.CommandLine.Command;

@Command(name = "tickwork", mixinStandardHelpOptions = true, description = "In-process job scheduler")
public final class TickworkCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
