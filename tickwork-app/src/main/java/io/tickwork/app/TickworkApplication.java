package io.tickwork.app;

import io.tickwork.cli.AddCommand;
import io.tickwork.cli.CliContext;
import io.tickwork.cli.InitCommand;
import io.tickwork.cli.NextCommand;
import io.tickwork.cli.RunCommand;
import io.tickwork.cli.StatusCommand;
import io.tickwork.cli.TickworkCliCommand;
import io.tickwork.core.config.ConfigPaths;
import io.tickwork.core.config.ConfigService;
import java.nio.file.Path;
import picocli.CommandLine;

public final class TickworkApplication {
    private static final String CONFIG_PROPERTY = "tickwork.config";

    private TickworkApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(new ConfigService(), resolveConfigPath());

        CommandLine commandLine = new CommandLine(new TickworkCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("next", new NextCommand(context));
        commandLine.addSubcommand("add", new AddCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        String override = System.getProperty(CONFIG_PROPERTY, System.getenv("TICKWORK_CONFIG"));
        if (override == null || override.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return Path.of(override.trim());
    }
}
