package io.github.yok.prismlink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.prismlink.cli.CliArguments;
import io.github.yok.prismlink.cli.CommandRunner;
import io.github.yok.prismlink.config.PagingConfig;
import io.github.yok.prismlink.config.PrismConfig;
import io.github.yok.prismlink.util.ErrorHandler;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses {@code <group> <action> [arguments] [options]} with {@link CliArguments}, runs the
 * command through {@link CommandRunner} and prints its result to {@code System.out}: JSON, pretty
 * printed, or plain text for bucket error files.
 * </p>
 *
 * <p>
 * Connection settings come from {@link PrismConfig} and paging settings from
 * {@link PagingConfig}, both bound from {@code application.yml}. A failed command is reported
 * through {@link ErrorHandler} and ends the process with exit code 1.
 * </p>
 *
 * @see CommandRunner
 * @see PrismConfig
 * @see PagingConfig
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PrismConfig.class, PagingConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final CommandRunner commandRunner;
    private final ObjectMapper mapper;

    // Process exit code, set when a command fails
    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context != null) {
            int code = SpringApplication.exit(context);
            if (code != 0) {
                System.exit(code);
            }
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        CliArguments cli = CliArguments.parse(args);
        try {
            Object result = commandRunner.execute(cli);
            print(result);
            log.info("Command completed: {} {}", cli.getGroup(), cli.getAction());
        } catch (Exception e) {
            exitCode = 1;
            log.error("Fatal error occurred ({} {}): {}", cli.getGroup(), cli.getAction(),
                    e.getMessage());
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void print(Object result) throws JsonProcessingException {
        if (result == null) {
            return;
        }
        if (result instanceof CharSequence) {
            System.out.println(result);
            return;
        }
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    }
}
