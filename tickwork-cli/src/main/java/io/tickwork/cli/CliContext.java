package io.tickwork.cli;

import io.tickwork.core.config.ConfigService;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Clock clock
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, Clock.systemUTC());
    }
}
