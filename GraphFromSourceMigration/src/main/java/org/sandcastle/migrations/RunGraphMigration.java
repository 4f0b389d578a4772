package org.sandcastle.migrations;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.function.Function;

import org.sandcastle.migrations.config.DateTokens;
import org.sandcastle.migrations.config.MigrationConfig;
import org.sandcastle.migrations.graph.FatalSetupException;
import org.sandcastle.migrations.graph.MigrationException;
import org.sandcastle.migrations.graph.MigrationSettings;
import org.sandcastle.migrations.graph.metadata.EntityMetadataProvider;
import org.sandcastle.migrations.graph.run.MigrationRunner;
import org.sandcastle.migrations.graph.run.MigrationSummary;
import org.sandcastle.migrations.io.CsvEntityMetadataProvider;
import org.sandcastle.migrations.snapshot.CsvSnapshotStore;
import org.sandcastle.migrations.store.RecordTypeNameResolver;
import org.sandcastle.migrations.store.RestRecordStore;
import org.sandcastle.migrations.store.http.RestClient;

import lombok.extern.slf4j.Slf4j;

/**
 * Copies a graph of records from one store into another, as described by a JSON config file.
 */
@Slf4j
public class RunGraphMigration {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_ABORTED = 2;
    static final int EXIT_RECORD_FAILURES = 3;

    static final String USAGE = "Usage: RunGraphMigration <config.json> [--no-delete] [--resume] [--keep-dummies]";

    /** Command line flags win over the config file's settings. */
    record Arguments(Path configFile, boolean noDelete, boolean resume, boolean keepDummies) {
        static Arguments parse(String[] args) {
            Path configFile = null;
            boolean noDelete = false;
            boolean resume = false;
            boolean keepDummies = false;
            for (String arg : args) {
                switch (arg) {
                    case "--no-delete":
                        noDelete = true;
                        break;
                    case "--resume":
                        resume = true;
                        break;
                    case "--keep-dummies":
                        keepDummies = true;
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        }
                        if (configFile != null) {
                            throw new IllegalArgumentException("Only one config file may be given");
                        }
                        configFile = Path.of(arg);
                }
            }
            if (configFile == null) {
                throw new IllegalArgumentException("A config file is required");
            }
            return new Arguments(configFile, noDelete, resume, keepDummies);
        }

        MigrationSettings applyTo(MigrationSettings.MigrationSettingsBuilder settings) {
            if (noDelete) {
                settings.deleteExisting(false);
            }
            if (resume) {
                settings.resume(true);
            }
            if (keepDummies) {
                settings.purgeDummies(false);
            }
            return settings.build();
        }
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        MigrationConfig config;
        MigrationRunner.MigrationRunnerBuilder configured;
        try {
            config = MigrationConfig.load(arguments.configFile());
            configured = configure(config, arguments, Clock.systemDefaultZone());
        } catch (IOException | IllegalArgumentException e) {
            log.atError().setMessage("Invalid configuration in {}").addArgument(arguments.configFile()).setCause(e).log();
            return EXIT_USAGE;
        }

        Stores stores;
        try {
            stores = Stores.open(config, System::getenv);
        } catch (IllegalArgumentException e) {
            log.atError().setMessage("Invalid connection settings in {}").addArgument(arguments.configFile()).setCause(e).log();
            return EXIT_USAGE;
        }
        try (stores) {
            return execute(connect(configured, config, stores));
        }
    }

    static int execute(MigrationRunner runner) {
        try {
            MigrationSummary summary = runner.run();
            if (summary.hasFailures()) {
                log.warn("{} record(s) could not be migrated", summary.failures().size());
                return EXIT_RECORD_FAILURES;
            }
            return EXIT_OK;
        } catch (FatalSetupException e) {
            log.atError().setMessage("Migration aborted before completion").setCause(e).log();
            return EXIT_ABORTED;
        } catch (MigrationException e) {
            log.atError().setMessage("Migration failed").setCause(e).log();
            return EXIT_ABORTED;
        }
    }

    /** Everything that does not need a live store: plan, settings and the snapshot log. */
    static MigrationRunner.MigrationRunnerBuilder configure(MigrationConfig config, Arguments arguments, Clock clock) {
        return MigrationRunner.builder()
            .plan(config.plan().toPlan(new DateTokens(clock)))
            .settings(arguments.applyTo(config.settingsBuilder()))
            .snapshots(new CsvSnapshotStore(config.snapshotPath()));
    }

    /** Source and target REST stores, closed together once the run is over. */
    record Stores(RestRecordStore source, RestRecordStore target) implements AutoCloseable {
        static Stores open(MigrationConfig config, Function<String, String> environment) {
            var source = new RestRecordStore(restClient(config.source(), environment));
            try {
                return new Stores(source, new RestRecordStore(restClient(config.target(), environment)));
            } catch (RuntimeException e) {
                source.close();
                throw e;
            }
        }

        @Override
        public void close() {
            try {
                source.close();
            } finally {
                target.close();
            }
        }
    }

    static MigrationRunner connect(MigrationRunner.MigrationRunnerBuilder runner, MigrationConfig config, Stores stores) {
        EntityMetadataProvider metadata = config.metadataDirectory() != null
            ? new CsvEntityMetadataProvider(config.metadataDirectory())
            : stores.target();
        log.info("Migrating from {} to {}, metadata from {}", stores.source().endpoint().orElse("?"),
            stores.target().endpoint().orElse("?"), config.metadataDirectory() != null ? config.metadataDirectory() : "target describe");
        return runner
            .source(stores.source())
            .target(stores.target())
            .metadataProvider(metadata)
            .stableNameResolver(new RecordTypeNameResolver(stores.source(), stores.target()))
            .build();
    }

    private static RestClient restClient(MigrationConfig.ConnectionConfig connection, Function<String, String> environment) {
        var context = connection.toContext(environment);
        return connection.maxConnections() != null
            ? new RestClient(context, connection.maxConnections())
            : new RestClient(context);
    }
}
