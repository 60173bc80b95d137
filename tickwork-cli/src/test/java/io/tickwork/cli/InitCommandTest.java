package io.tickwork.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.tickwork.core.config.ConfigService;
import io.tickwork.core.config.model.TickworkConfig;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class InitCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCreateDefaultConfig() throws Exception {
        Path configPath = tempDir.resolve(".tickwork/config.json");
        CliContext context = new CliContext(new ConfigService(), configPath);

        String output = execute(context);

        assertThat(output).contains("Created config: " + configPath).contains("\"tickIntervalMs\" : 10000");
        assertThat(new ConfigService().load(configPath)).isEqualTo(TickworkConfig.defaults());
    }

    @Test
    void shouldRefreshPartialConfigKeepingOverrides() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "scheduler": { "tickIntervalMs": 250 } }
            """);
        CliContext context = new CliContext(new ConfigService(), configPath);

        String output = execute(context);

        assertThat(output).contains("Refreshed config with new defaults");
        String written = Files.readString(configPath);
        assertThat(written).contains("\"tickIntervalMs\" : 250").contains("\"saveOnExit\" : true");
    }

    @Test
    void shouldOverwriteConfigWithDefaults() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "scheduler": { "tickIntervalMs": 250 } }
            """);
        CliContext context = new CliContext(new ConfigService(), configPath);

        String output = execute(context, "--overwrite");

        assertThat(output).contains("Overwrote config with defaults");
        assertThat(new ConfigService().load(configPath).scheduler().tickIntervalMs()).isEqualTo(10_000L);
    }

    private static String execute(CliContext context, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new InitCommand(context)).execute(args);
            assertThat(code).isZero();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
