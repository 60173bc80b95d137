package io.tickwork.cli;

import io.tickwork.core.config.ConfigService;
import io.tickwork.core.config.model.TickworkConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Create or refresh the config file")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Overwrite existing config with defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ConfigService service = context.configService();
            Path configPath = context.configPath();
            boolean existed = Files.exists(configPath);
            TickworkConfig config = existed && !overwrite ? service.load(configPath) : TickworkConfig.defaults();
            service.save(configPath, config);

            if (!existed) {
                System.out.println("Created config: " + configPath);
            } else if (overwrite) {
                System.out.println("Overwrote config with defaults: " + configPath);
            } else {
                System.out.println("Refreshed config with new defaults: " + configPath);
            }
            System.out.println(service.toPrettyJson(config));
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
