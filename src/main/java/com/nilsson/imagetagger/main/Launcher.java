package com.nilsson.imagetagger.main;

import com.google.inject.ConfigurationException;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import com.nilsson.imagetagger.data.SettingsRepository;
import com.nilsson.imagetagger.service.OutputPipeline;
import com.nilsson.imagetagger.service.exif.MetadataWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 <h2>Launcher</h2>
 <p>
 Command-line entry point: {@code Launcher <destinationDir> <image.png>...}
 </p>
 <p>
 Every image is submitted to the {@link OutputPipeline} worker pool. When all jobs have finished
 the pool is drained and the shared ExifTool process is closed. A shutdown hook closes it as well
 for the Ctrl+C case; closing is idempotent so whichever runs second is a no-op.
 </p>
 <p>
 Exit status is 0 when every image was tagged, 1 when any job failed or was skipped, and 2 for
 usage or startup errors.
 </p>
 */
public class Launcher {

    private static final Logger logger = LoggerFactory.getLogger(Launcher.class);

    static final int EXIT_OK = 0;
    static final int EXIT_JOB_FAILURES = 1;
    static final int EXIT_STARTUP_ERROR = 2;

    private static final long DRAIN_TIMEOUT_SECONDS = 30;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: Launcher <destinationDir> <image.png> [<image.png>...]");
            return EXIT_STARTUP_ERROR;
        }
        System.setProperty("java.awt.headless", "true");

        Injector injector;
        OutputPipeline pipeline;
        try {
            injector = Guice.createInjector(new AppModule(new SettingsRepository()));
            pipeline = injector.getInstance(OutputPipeline.class);
        } catch (IOException | CreationException | ConfigurationException | ProvisionException e) {
            logger.error("Startup failed", e);
            return EXIT_STARTUP_ERROR;
        }

        MetadataWriter metadataWriter = injector.getInstance(MetadataWriter.class);
        ExecutorService executor = injector.getInstance(ExecutorService.class);
        Runtime.getRuntime().addShutdownHook(new Thread(metadataWriter::close, "Tagger-Shutdown"));

        Path destination = Paths.get(args[0]);
        List<Path> sources = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            sources.add(Paths.get(args[i]));
        }

        try {
            int succeeded = processAll(pipeline, destination, sources);
            logger.info("Processed {} of {} file(s) into {}", succeeded, sources.size(), destination);
            return succeeded == sources.size() ? EXIT_OK : EXIT_JOB_FAILURES;
        } finally {
            shutdown(executor, metadataWriter);
        }
    }

    /**
     Submits every source and waits for all of them.

     @return the number of jobs that produced a tagged output
     */
    static int processAll(OutputPipeline pipeline, Path destination, List<Path> sources) {
        List<CompletableFuture<Boolean>> jobs = new ArrayList<>();
        for (Path source : sources) {
            jobs.add(pipeline.submit(source, destination)
                    .exceptionally(e -> {
                        logger.error("Job for {} aborted: {}", source.getFileName(), e.getMessage());
                        return false;
                    }));
        }

        int succeeded = 0;
        for (CompletableFuture<Boolean> job : jobs) {
            if (Boolean.TRUE.equals(job.join())) {
                succeeded++;
            }
        }
        return succeeded;
    }

    static void shutdown(ExecutorService executor, MetadataWriter metadataWriter) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Workers still busy after {}s, shutting down anyway", DRAIN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        } finally {
            metadataWriter.close();
        }
    }
}
