package io.github.yok.hirelink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.hirelink.codec.AvroSnapshotCodec;
import io.github.yok.hirelink.codec.TabularCsvCodec;
import io.github.yok.hirelink.config.ConnectionConfig;
import io.github.yok.hirelink.config.DbUnitConfig;
import io.github.yok.hirelink.config.IngestionConfig;
import io.github.yok.hirelink.config.ObjectStorageConfig;
import io.github.yok.hirelink.config.PathsConfig;
import io.github.yok.hirelink.core.BackupRestoreService;
import io.github.yok.hirelink.core.BatchIngestionService;
import io.github.yok.hirelink.core.BatchValidator;
import io.github.yok.hirelink.core.HistoricalMigrator;
import io.github.yok.hirelink.core.TransactionalWriter;
import io.github.yok.hirelink.core.WorkforceException;
import io.github.yok.hirelink.db.DbUnitStoreSessionFactory;
import io.github.yok.hirelink.db.StoreSessionFactory;
import io.github.yok.hirelink.parser.BatchRequestParser;
import io.github.yok.hirelink.report.JdbcWorkforceReportQueries;
import io.github.yok.hirelink.report.WorkforceReportQueries;
import io.github.yok.hirelink.storage.FileArtifactStore;
import io.github.yok.hirelink.storage.ObjectStorage;
import io.github.yok.hirelink.storage.ObjectStorageFactory;
import io.github.yok.hirelink.storage.S3ObjectStorage;
import io.github.yok.hirelink.util.ErrorHandler;
import java.io.File;
import java.nio.file.Paths;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Each invocation performs exactly one operation:
 * </p>
 * <ul>
 * <li>{@code --insert <file>} or {@code -i <file>}: validated batch insert of a JSON request
 * file.</li>
 * <li>{@code --backup} or {@code -b}: write a backup artifact for every non-empty table.</li>
 * <li>{@code --restore <table>} or {@code -r <table>}: replace a table with its backup.</li>
 * <li>{@code --migrate} or {@code -m}: append the historical CSV files from object storage.</li>
 * <li>{@code --report <name>} or {@code -q <name>}: print {@code hired-per-quarter} or
 * {@code departments-above-average} as JSON, optionally for {@code --year <yyyy>} /
 * {@code -y <yyyy>}.</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link PathsConfig}, {@link DbUnitConfig}, {@link ConnectionConfig},
 * {@link IngestionConfig} and {@link ObjectStorageConfig} from {@code application.yml}. Failures
 * are reported by {@link ErrorHandler}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see DbUnitStoreSessionFactory
 * @see ObjectStorageFactory
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, DbUnitConfig.class, ConnectionConfig.class,
        IngestionConfig.class, ObjectStorageConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final PathsConfig pathsConfig;
    private final IngestionConfig ingestionConfig;
    private final StoreSessionFactory sessionFactory;
    private final ObjectStorageFactory objectStorageFactory;

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
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
        String mode = null;
        String operand = null;
        int year = WorkforceReportQueries.DEFAULT_YEAR;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--insert":
                case "-i":
                    mode = "insert";
                    operand = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--backup":
                case "-b":
                    mode = "backup";
                    break;
                case "--restore":
                case "-r":
                    mode = "restore";
                    operand = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--migrate":
                case "-m":
                    mode = "migrate";
                    break;
                case "--report":
                case "-q":
                    mode = "report";
                    operand = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--year":
                case "-y":
                    year = parseYear(i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (mode == null) {
            ErrorHandler.usage("One of --insert, --backup, --restore, --migrate or --report "
                    + "is required.");
            return;
        }
        if (operand == null && !"backup".equals(mode) && !"migrate".equals(mode)) {
            ErrorHandler.usage("An argument is required in " + mode + " mode.");
            return;
        }
        log.info("Mode: {}, Argument: {}", mode, operand);

        // Execute
        try {
            switch (mode) {
                case "insert":
                    insert(operand);
                    break;
                case "backup":
                    print(newBackupRestoreService().backupAll().getMessage());
                    break;
                case "restore":
                    print(newBackupRestoreService().restore(operand).getMessage());
                    break;
                case "migrate":
                    migrate();
                    break;
                default:
                    report(operand, year);
            }
        } catch (WorkforceException e) {
            ErrorHandler.report(e);
        } catch (Exception e) {
            ErrorHandler.fatal("Fatal error occurred in " + mode + " mode.", e);
        }
    }

    private void insert(String file) {
        BatchIngestionService service =
                new BatchIngestionService(sessionFactory, new BatchValidator(),
                        new TransactionalWriter(), ingestionConfig.getMaxBatchSize());
        print(service.insert(new BatchRequestParser().parse(Paths.get(file))).getMessage());
    }

    private void migrate() {
        ObjectStorage storage = objectStorageFactory.create();
        try {
            HistoricalMigrator migrator = new HistoricalMigrator(sessionFactory, storage,
                    new TabularCsvCodec(), new TransactionalWriter(),
                    ingestionConfig.getMigrationSourcePrefix(),
                    ingestionConfig.getMigrationChunkSize());
            print(migrator.migrateAll().getMessage());
        } finally {
            if (storage instanceof S3ObjectStorage) {
                ((S3ObjectStorage) storage).close();
            }
        }
    }

    private void report(String name, int year) throws JsonProcessingException {
        WorkforceReportQueries queries = new JdbcWorkforceReportQueries(sessionFactory);
        Object result;
        if ("hired-per-quarter".equals(name)) {
            result = queries.hiredPerQuarter(year);
        } else if ("departments-above-average".equals(name)) {
            result = queries.departmentsHiringAboveAverage(year);
        } else {
            ErrorHandler.usage("Unknown report: " + name
                    + " (expected hired-per-quarter or departments-above-average)");
            return;
        }
        print(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    }

    private BackupRestoreService newBackupRestoreService() {
        return new BackupRestoreService(sessionFactory, new AvroSnapshotCodec(),
                new FileArtifactStore(new File(pathsConfig.getBackup())),
                new TransactionalWriter(), ingestionConfig.getMigrationChunkSize());
    }

    private static int parseYear(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            ErrorHandler.usage("Invalid year: " + value);
            return WorkforceReportQueries.DEFAULT_YEAR;
        }
    }

    private static void print(String message) {
        log.info(message);
        System.out.println(message);
    }
}
