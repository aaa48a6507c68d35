package com.nilsson.imagetagger.service;

import com.nilsson.imagetagger.service.ProcessingJob.Stage;
import com.nilsson.imagetagger.service.exif.MetadataWriteException;
import com.nilsson.imagetagger.service.exif.MetadataWriter;
import com.nilsson.imagetagger.service.image.ColorProfileNormalizer;
import com.nilsson.imagetagger.service.image.WatermarkCompositor;
import com.nilsson.imagetagger.service.model.ExtractionResult;
import com.nilsson.imagetagger.service.model.ImageMetadata;
import com.nilsson.imagetagger.service.model.ImageTags;
import com.nilsson.imagetagger.service.model.PromptEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 <h2>OutputPipeline</h2>
 <p>
 Turns one generated PNG into a tagged, color-normalized copy in the destination directory.
 </p>
 <h3>Stages:</h3>
 <ol>
 <li><b>Metadata:</b> reads the PNG text chunks; an image without any is skipped.</li>
 <li><b>Prompt:</b> runs the {@link PromptExtractionService}; no prompt means skip.</li>
 <li><b>Keywords:</b> matches every prompt against the dictionary and adds the AI label when
 watermarking is on.</li>
 <li><b>Normalize / watermark:</b> writes an sRGB scratch copy, then optionally a watermarked one.</li>
 <li><b>Write:</b> copies the final scratch file next to its destination under a staging name,
 tags it with the first prompt as description and the labels as keywords, then moves it into
 place.</li>
 <li><b>Cleanup:</b> scratch files and metadata-tool backups are removed on every exit path.</li>
 </ol>
 <h3>Results:</h3>
 <p>
 Every outcome is reported as a boolean. The only exception that leaves {@link #processFile} is
 {@link OutputDirectoryException}, raised after cleanup when the destination cannot be created.
 When tagging fails the staged copy is removed and any earlier output of the same name stays as it
 was, so the destination only ever receives complete outputs.
 </p>
 */
public class OutputPipeline {

    private static final Logger logger = LoggerFactory.getLogger(OutputPipeline.class);

    public static final String AI_GENERATED_LABEL = "AI Generated";
    static final String BASE_PREFIX = "process_";
    static final String WATERMARK_PREFIX = "watermark_";
    static final String STAGING_PREFIX = ".tagging_";
    private static final String SUPPORTED_EXTENSION = ".png";

    // --- Dependencies ---
    private final MetadataService metadataService;
    private final PromptExtractionService extractionService;
    private final KeywordMatcher keywordMatcher;
    private final TempFileManager tempFiles;
    private final ColorProfileNormalizer normalizer;
    private final WatermarkCompositor watermarkCompositor;
    private final MetadataWriter metadataWriter;
    private final ProcessingOptions defaultOptions;
    private final ExecutorService executor;

    @Inject
    public OutputPipeline(MetadataService metadataService,
                          PromptExtractionService extractionService,
                          KeywordMatcher keywordMatcher,
                          TempFileManager tempFiles,
                          ColorProfileNormalizer normalizer,
                          WatermarkCompositor watermarkCompositor,
                          MetadataWriter metadataWriter,
                          ProcessingOptions defaultOptions,
                          ExecutorService executor) {
        this.metadataService = metadataService;
        this.extractionService = extractionService;
        this.keywordMatcher = keywordMatcher;
        this.tempFiles = tempFiles;
        this.normalizer = normalizer;
        this.watermarkCompositor = watermarkCompositor;
        this.metadataWriter = metadataWriter;
        this.defaultOptions = defaultOptions;
        this.executor = executor;
    }

    // ------------------------------------------------------------------------
    // Entry Points
    // ------------------------------------------------------------------------

    public boolean processFile(Path source, Path destinationDir) {
        return processFile(source, destinationDir, defaultOptions);
    }

    /**
     Processes one image.

     @param source         the generated image
     @param destinationDir directory that receives the tagged copy under the source's file name
     @param options        watermark and subfolder switches for this invocation
     @return {@code true} if a tagged copy was written
     @throws OutputDirectoryException if the destination directory cannot be created
     */
    public boolean processFile(Path source, Path destinationDir, ProcessingOptions options) {
        String filename = source.getFileName().toString();
        logger.info("Starting processing: {}", filename);

        if (!isSupported(filename)) {
            logger.warn("Skipping non-PNG file: {}", filename);
            return false;
        }

        ProcessingJob job = new ProcessingJob(source, destinationDir, tempFiles);
        boolean success;
        try (job) {
            success = run(job, options);
        }
        if (success) {
            job.advance(Stage.DONE);
        }
        return success;
    }

    /**
     Runs {@link #processFile(Path, Path)} on the worker pool.
     */
    public CompletableFuture<Boolean> submit(Path source, Path destinationDir) {
        return CompletableFuture.supplyAsync(() -> processFile(source, destinationDir), executor);
    }

    // ------------------------------------------------------------------------
    // Job Execution
    // ------------------------------------------------------------------------

    private boolean run(ProcessingJob job, ProcessingOptions options) {
        Path source = job.getSourceFile();
        String filename = source.getFileName().toString();

        try {
            ImageMetadata metadata = metadataService.readMetadata(source);
            job.advance(Stage.METADATA_READ);
            if (!metadata.hasComments()) {
                logger.warn("No comments found in metadata: {}", filename);
                return false;
            }

            ExtractionResult extraction = extractionService.extractPrompts(metadata);
            if (extraction == null) {
                logger.warn("No usable prompt found in metadata: {}", filename);
                return false;
            }
            job.advance(Stage.PROMPT_EXTRACTED);
            logger.debug("Extracted {} prompt(s) from {} via {}",
                    extraction.getPrompts().size(), filename, extraction.getStrategyId());

            Set<String> labels = matchLabels(extraction, options);
            job.advance(Stage.KEYWORDS_MATCHED);
            if (!labels.isEmpty()) {
                logger.info("Found keywords for {}: {}", filename, labels);
            }

            Path finalImage = renderScratchImage(job, options);

            Path outputDir = createOutputDir(job.getDestinationDir(), options);
            Path output = outputDir.resolve(filename);
            Path staged = outputDir.resolve(STAGING_PREFIX + filename);
            job.registerStagedOutput(staged);
            job.registerBackupTarget(staged);
            Files.copy(finalImage, staged, StandardCopyOption.REPLACE_EXISTING);

            ImageTags tags = new ImageTags(extraction.getPrimaryPrompt().getOriginalText(), new ArrayList<>(labels));
            try {
                metadataWriter.write(staged, tags);
            } catch (MetadataWriteException e) {
                job.fail();
                logger.error("Failed to write metadata for {}, leaving {} untouched", filename, output, e);
                return false;
            }
            job.advance(Stage.WRITTEN);

            Files.move(staged, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            logger.info("Successfully processed: {} ({} keywords)", filename, labels.size());
            return true;
        } catch (OutputDirectoryException e) {
            job.fail();
            logger.error("Aborting {}: {}", filename, e.getMessage());
            throw e;
        } catch (IOException | RuntimeException e) {
            job.fail();
            logger.error("Failed to process {} during {}", filename, job.getFailedAt(), e);
            return false;
        }
    }

    Set<String> matchLabels(ExtractionResult extraction, ProcessingOptions options) {
        Set<String> labels = new LinkedHashSet<>();
        for (PromptEntry prompt : extraction.getPrompts()) {
            labels.addAll(keywordMatcher.findKeywords(prompt.getOriginalText()));
        }
        if (options.isWatermarkEnabled()) {
            labels.add(AI_GENERATED_LABEL);
        }
        return labels;
    }

    private Path renderScratchImage(ProcessingJob job, ProcessingOptions options) throws IOException {
        String extension = extensionOf(job.getSourceFile().getFileName().toString());

        Path base = job.allocateTemp(BASE_PREFIX, extension);
        normalizer.normalize(job.getSourceFile(), base);
        job.advance(Stage.BASE_NORMALIZED);

        if (!options.isWatermarkEnabled()) {
            job.advance(Stage.UNWATERMARKED);
            return base;
        }

        Path watermarked = job.allocateTemp(WATERMARK_PREFIX, extension);
        watermarkCompositor.apply(base, watermarked);
        job.advance(Stage.WATERMARKED);
        return watermarked;
    }

    private Path createOutputDir(Path destinationDir, ProcessingOptions options) {
        Path outputDir = options.resolveOutputDir(destinationDir);
        try {
            return Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new OutputDirectoryException(outputDir, e);
        }
    }

    // ------------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------------

    static boolean isSupported(String filename) {
        return filename.toLowerCase(Locale.ROOT).endsWith(SUPPORTED_EXTENSION);
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot);
    }
}
