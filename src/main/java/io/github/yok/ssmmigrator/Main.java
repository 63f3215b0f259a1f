package io.github.yok.ssmmigrator;

import io.github.yok.ssmmigrator.config.AwsConfig;
import io.github.yok.ssmmigrator.config.Environment;
import io.github.yok.ssmmigrator.config.MigrationConfig;
import io.github.yok.ssmmigrator.config.MigrationConfigValidator;
import io.github.yok.ssmmigrator.core.NameMapper;
import io.github.yok.ssmmigrator.core.ParameterCopier;
import io.github.yok.ssmmigrator.core.ParameterLister;
import io.github.yok.ssmmigrator.exception.ConfigLoadException;
import io.github.yok.ssmmigrator.exception.MigrationException;
import io.github.yok.ssmmigrator.store.ParameterStore;
import io.github.yok.ssmmigrator.store.SsmParameterStoreFactory;
import io.github.yok.ssmmigrator.util.ErrorHandler;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --env <label>} or {@code -e <label>} selects the environment ({@code staging},
 * {@code beta}, {@code production}). If omitted, {@code migration.environment} in
 * {@code application.yml} is used.</li>
 * <li>{@code --overwrite} or {@code -o} allows replacing destination parameters that already
 * exist.</li>
 * <li>{@code --list} or {@code -L} lists the old hierarchy of the environment instead of
 * copying.</li>
 * </ul>
 *
 * <p>
 * The credential profile follows the environment (see {@link AwsConfig#resolveProfile}). The first
 * failure stops the run; the process then exits with status 1.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see NameMapper
 * @see ParameterCopier
 * @see SsmParameterStoreFactory
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({MigrationConfig.class, AwsConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final String MODE_COPY = "copy";
    static final String MODE_LIST = "list";

    private final MigrationConfig migrationConfig;
    private final AwsConfig awsConfig;
    private final SsmParameterStoreFactory storeFactory;

    // 0 until a run fails
    private int exitCode = 0;

    /**
     * Bootstraps the application and exits with the status of the run.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String mode = MODE_COPY;
        String environmentLabel = migrationConfig.getEnvironment();
        boolean overwrite = migrationConfig.isOverwrite();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--env":
                case "-e":
                    if (i + 1 < args.length) {
                        environmentLabel = args[++i];
                    } else {
                        log.warn("{} requires a value; using [{}]", args[i], environmentLabel);
                    }
                    break;
                case "--overwrite":
                case "-o":
                    overwrite = true;
                    break;
                case "--list":
                case "-L":
                    mode = MODE_LIST;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        log.info("Mode: {}, Environment: {}, Overwrite: {}", mode, environmentLabel, overwrite);

        try {
            execute(mode, environmentLabel, overwrite);
            log.info("Run completed. Mode [{}], Environment [{}]", mode, environmentLabel);
        } catch (MigrationException e) {
            exitCode = 1;
            ErrorHandler.errorAndExit("Failed to copy parameter (operation=" + e.getOperation()
                    + "): " + e.getMessage(), e);
        } catch (RuntimeException e) {
            exitCode = 1;
            ErrorHandler.errorAndExit("Fatal error (mode=" + mode + "): " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Validates the configuration, connects with the environment's profile, and runs the mode.
     *
     * @param mode {@link #MODE_COPY} or {@link #MODE_LIST}
     * @param environmentLabel environment label
     * @param overwrite overwrite flag for copy mode
     */
    void execute(String mode, String environmentLabel, boolean overwrite) {
        Environment environment;
        try {
            new MigrationConfigValidator().validateAndNormalize(migrationConfig);
            environment = Environment.fromLabel(environmentLabel);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }

        String profile = awsConfig.resolveProfile(environment);
        log.info("Using profile [{}] for environment [{}]", profile, environment.getLabel());

        NameMapper mapper = new NameMapper(migrationConfig);
        try (ParameterStore store = storeFactory.create(profile)) {
            if (MODE_LIST.equals(mode)) {
                new ParameterLister(store).execute(mapper.oldPrefix(environment));
            } else {
                new ParameterCopier(store, overwrite).execute(mapper.map(environment));
            }
        }
    }
}
