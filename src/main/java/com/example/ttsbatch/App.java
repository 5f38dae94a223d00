package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkUnit;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Runs the CLI and returns the process exit code: 0 when every unit is completed, 1 when
     * units failed or are still missing, 2 for configuration, input or manifest errors.
     */
    static int execute(String[] args) {
        // The only argument is the JSON config file.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar tts-batch-runner.jar <config.json>");
            return 2;
        }
        RunnerConfig config;
        List<WorkUnit> units;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
            units = new WorkUnitLoader().load(config.unitsFile());
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration or input: {}", ex.getMessage());
            return 2;
        } catch (IOException ex) {
            LOGGER.error("Cannot read configuration or input: {}", describe(ex));
            return 2;
        }
        try {
            return run(config, units);
        } catch (IOException ex) {
            LOGGER.error("Run stopped by I/O error: {}", describe(ex));
            return 1;
        }
    }

    private static String describe(IOException ex) {
        String message = ex instanceof JsonProcessingException
                ? ((JsonProcessingException) ex).getOriginalMessage()
                : ex.getMessage();
        return ex.getClass().getSimpleName() + ": " + message;
    }

    static int run(RunnerConfig config, List<WorkUnit> units) throws IOException {
        ArtifactSyncer syncer = config.s3SyncEnabled()
                ? new S3ArtifactSyncer(config.outputDirectory(), config.s3Bucket().orElseThrow(),
                        config.s3Prefix().orElse(""), config.s3Region())
                : ArtifactSyncer.noop();
        try (syncer; ConsoleCheckpointGate gate = new ConsoleCheckpointGate(System.in, System.out)) {
            ManifestStore manifestStore = new ManifestStore(config.manifestFile(), syncer, Clock.systemUTC());
            SegmentWriter segmentWriter = new SegmentWriter(config.outputDirectory(), syncer);
            WorkerFactory workerFactory = WorkerFactory.standard(config.workerSettings(),
                    HttpSpeechSender.perWorker(config.endpoint(), config.requestTimeout()),
                    gate, manifestStore, segmentWriter);
            ParallelCoordinator coordinator = new ParallelCoordinator(
                    workerFactory, config.coordinatorSettings(), System.out);
            ArtifactScanner scanner = new ArtifactScanner(
                    config.outputDirectory(), config.validateArtifacts() ? new Tika() : null);
            TtsBatchRunner runner = new TtsBatchRunner(
                    config, manifestStore, new ResumePlanner(manifestStore, scanner), coordinator);

            Runtime.getRuntime().addShutdownHook(new Thread(runner::abort, "abort-on-shutdown"));
            StatusRenderer renderer = new StatusRenderer();
            RunSummary summary = runner.run(units,
                    result -> System.out.print(renderer.renderSummary(result, runner.failures())));
            return summary.fullyCompleted() ? 0 : 1;
        } catch (ManifestCorruptionException ex) {
            LOGGER.error("Cannot resume: {}. Set \"resumeMode\": \"fresh\" to start over.", ex.getMessage());
            return 2;
        }
    }
}
