package com.nilsson.imagetagger.service;

import com.nilsson.imagetagger.data.KeywordDictionary;
import com.nilsson.imagetagger.service.exif.MetadataWriteException;
import com.nilsson.imagetagger.service.exif.MetadataWriter;
import com.nilsson.imagetagger.service.image.ColorProfileNormalizer;
import com.nilsson.imagetagger.service.image.WatermarkCompositor;
import com.nilsson.imagetagger.service.model.ExtractionResult;
import com.nilsson.imagetagger.service.model.ImageTags;
import com.nilsson.imagetagger.service.model.PromptEntry;
import com.nilsson.imagetagger.support.PngFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 End-to-end tests for {@link OutputPipeline} with real image stages and a mocked metadata writer.

 <p>This test suite validates:
 <ul>
 <li><b>Happy paths:</b> Automatic1111 and ComfyUI images produce a tagged copy with the right labels.</li>
 <li><b>Skips:</b> images without a usable prompt, and non-PNG files, produce nothing.</li>
 <li><b>Cleanup:</b> scratch files and tool backups are gone after every outcome.</li>
 <li><b>Failures:</b> a failed tag write leaves no untagged copy and keeps earlier outputs; an
 unusable destination aborts.</li>
 <li><b>Concurrency:</b> jobs running in parallel on the worker pool clean up after themselves.</li>
 </ul>
 </p>
 */
@ExtendWith(MockitoExtension.class)
class OutputPipelineTest {

    @Mock
    private MetadataWriter metadataWriter;

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private Path destinationDir;
    private Path scratchDir;
    private ExecutorService executor;
    private OutputPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        sourceDir = Files.createDirectories(tempDir.resolve("generated"));
        destinationDir = tempDir.resolve("tagged");
        scratchDir = tempDir.resolve("scratch");
        executor = Executors.newSingleThreadExecutor();

        KeywordDictionary dictionary = KeywordDictionary.ofSingleLabels(Map.of(
                "oak", "Tree: Oak",
                "mountain", "Landscape: Mountain",
                "cloudy", "Weather: Overcast"));

        pipeline = new OutputPipeline(
                new MetadataService(),
                new PromptExtractionService(),
                new KeywordMatcher(dictionary),
                new TempFileManager(scratchDir),
                new ColorProfileNormalizer(),
                new WatermarkCompositor(),
                metadataWriter,
                ProcessingOptions.defaults(),
                executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void assertScratchEmpty() throws IOException {
        if (!Files.exists(scratchDir)) return;
        try (Stream<Path> files = Files.list(scratchDir)) {
            assertEquals(List.of(), files.toList(), "Scratch directory should be empty");
        }
    }

    private Path automatic1111Image() throws IOException {
        return PngFixtures.writePng(sourceDir.resolve("barn.png"), "parameters",
                "a red barn, oak tree\nNegative prompt: blurry\nSteps: 20, Sampler: Euler a");
    }

    private ImageTags capturedTags(Path output) throws MetadataWriteException {
        ArgumentCaptor<Path> tagged = ArgumentCaptor.forClass(Path.class);
        ArgumentCaptor<ImageTags> tags = ArgumentCaptor.forClass(ImageTags.class);
        verify(metadataWriter).write(tagged.capture(), tags.capture());
        assertEquals(stagedPath(output), tagged.getValue());
        return tags.getValue();
    }

    private static Path stagedPath(Path output) {
        return output.resolveSibling(OutputPipeline.STAGING_PREFIX + output.getFileName());
    }

    private static List<String> fileNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(f -> f.getFileName().toString()).sorted().toList();
        }
    }

    // ------------------------------------------------------------------------
    // Happy Paths
    // ------------------------------------------------------------------------

    @Test
    void testParametersImageWithoutWatermark() throws IOException {
        Path source = automatic1111Image();

        boolean result = pipeline.processFile(source, destinationDir, ProcessingOptions.defaults().withWatermark(false));

        assertTrue(result);
        Path output = destinationDir.resolve("barn.png");
        assertTrue(Files.exists(output));
        assertTrue(PngFixtures.hasSrgbChunk(output));
        assertEquals(new ImageTags("a red barn, oak tree", List.of("Tree: Oak")), capturedTags(output));
        assertScratchEmpty();
    }

    @Test
    void testComfyImageWithWatermark() throws IOException {
        Path source = PngFixtures.writePng(sourceDir.resolve("peak.png"), "prompt",
                "{\"1\":{\"inputs\":{\"populated_text\":\"a mountain, cloudy sky\"}}}");

        assertTrue(pipeline.processFile(source, destinationDir));

        Path output = destinationDir.resolve("peak.png");
        ImageTags tags = capturedTags(output);
        assertEquals("a mountain, cloudy sky", tags.getDescription());
        assertEquals(List.of("Landscape: Mountain", "Weather: Overcast", OutputPipeline.AI_GENERATED_LABEL),
                tags.getKeywords());

        // Bottom-right corner carries the label box
        assertNotEquals(ImageIO.read(source.toFile()).getRGB(60, 45), ImageIO.read(output.toFile()).getRGB(60, 45));
        assertScratchEmpty();
    }

    @Test
    void testPromptWithoutMatchesStillTagsDescription() throws IOException {
        Path source = PngFixtures.writePng(sourceDir.resolve("abstract.png"), "parameters", "swirling colors");

        assertTrue(pipeline.processFile(source, destinationDir, ProcessingOptions.defaults().withWatermark(false)));

        ImageTags tags = capturedTags(destinationDir.resolve("abstract.png"));
        assertEquals("swirling colors", tags.getDescription());
        assertTrue(tags.getKeywords().isEmpty());
    }

    @Test
    void testTargetSubfolder() throws IOException {
        Path source = automatic1111Image();

        assertTrue(pipeline.processFile(source, destinationDir,
                ProcessingOptions.defaults().withTargetSubfolder("batch-01")));

        assertTrue(Files.exists(destinationDir.resolve("batch-01").resolve("barn.png")));
        assertFalse(Files.exists(destinationDir.resolve("barn.png")));
    }

    @Test
    void testSubmitRunsOnWorkerPool() throws IOException {
        Path source = automatic1111Image();

        assertTrue(pipeline.submit(source, destinationDir).join());
        assertTrue(Files.exists(destinationDir.resolve("barn.png")));
    }

    @Test
    void testMatchLabelsUnionsAllPrompts() {
        ExtractionResult extraction = new ExtractionResult("jsonPrompt", List.of(
                new PromptEntry("1", "oak"),
                new PromptEntry("2", "mountain, oak")));

        assertEquals(List.of("Tree: Oak", "Landscape: Mountain"),
                List.copyOf(pipeline.matchLabels(extraction, ProcessingOptions.defaults().withWatermark(false))));
    }

    // ------------------------------------------------------------------------
    // Skips
    // ------------------------------------------------------------------------

    @Test
    void testImageWithoutCommentsIsSkipped() throws IOException {
        Path source = PngFixtures.writePng(sourceDir.resolve("plain.png"), Map.of());

        assertFalse(pipeline.processFile(source, destinationDir));

        assertFalse(Files.exists(destinationDir.resolve("plain.png")));
        verifyNoInteractions(metadataWriter);
        assertScratchEmpty();
    }

    @Test
    void testImageWithoutUsablePromptIsSkipped() throws IOException {
        Path source = PngFixtures.writePng(sourceDir.resolve("workflow.png"), "workflow", "{\"nodes\":[]}");

        assertFalse(pipeline.processFile(source, destinationDir));
        assertFalse(Files.exists(destinationDir.resolve("workflow.png")));
        verifyNoInteractions(metadataWriter);
    }

    @Test
    void testNonPngIsSkipped() throws IOException {
        Path source = Files.writeString(sourceDir.resolve("photo.jpg"), "jpeg bytes");

        assertFalse(pipeline.processFile(source, destinationDir));
        assertFalse(Files.exists(destinationDir));
        verifyNoInteractions(metadataWriter);
    }

    @Test
    void testSupportedExtensions() {
        assertTrue(OutputPipeline.isSupported("image.PNG"));
        assertFalse(OutputPipeline.isSupported("image.webp"));
        assertEquals(".png", OutputPipeline.extensionOf("a.b.png"));
        assertEquals("", OutputPipeline.extensionOf("noext"));
    }

    // ------------------------------------------------------------------------
    // Cleanup & Failures
    // ------------------------------------------------------------------------

    @Test
    void testToolBackupIsRemoved() throws IOException {
        Path source = automatic1111Image();
        Path output = destinationDir.resolve("barn.png");
        doAnswer(invocation -> {
            Path tagged = invocation.getArgument(0);
            Files.copy(tagged, tagged.resolveSibling(tagged.getFileName() + "_original"));
            return null;
        }).when(metadataWriter).write(any(Path.class), any(ImageTags.class));

        assertTrue(pipeline.processFile(source, destinationDir));

        assertEquals(List.of("barn.png"), fileNames(destinationDir));
        assertTrue(Files.exists(output));
        assertScratchEmpty();
    }

    @Test
    void testMetadataWriteFailureRemovesUntaggedOutput() throws IOException {
        Path source = automatic1111Image();
        doThrow(new MetadataWriteException("exiftool said no")).when(metadataWriter).write(any(), any());

        assertFalse(pipeline.processFile(source, destinationDir));

        assertEquals(List.of(), fileNames(destinationDir));
        assertScratchEmpty();
    }

    @Test
    void testMetadataWriteFailureKeepsEarlierOutput() throws IOException {
        Path source = automatic1111Image();
        Path earlier = Files.writeString(Files.createDirectories(destinationDir).resolve("barn.png"),
                "tagged by an earlier run");
        doThrow(new MetadataWriteException("exiftool said no")).when(metadataWriter).write(any(), any());

        assertFalse(pipeline.processFile(source, destinationDir));

        assertEquals("tagged by an earlier run", Files.readString(earlier));
        assertEquals(List.of("barn.png"), fileNames(destinationDir));
        assertScratchEmpty();
    }

    @Test
    void testSuccessfulRunReplacesEarlierOutput() throws IOException {
        Path source = automatic1111Image();
        Path earlier = Files.writeString(Files.createDirectories(destinationDir).resolve("barn.png"), "stale");

        assertTrue(pipeline.processFile(source, destinationDir, ProcessingOptions.defaults().withWatermark(false)));

        assertNotNull(ImageIO.read(earlier.toFile()));
        assertEquals(List.of("barn.png"), fileNames(destinationDir));
    }

    @Test
    void testConcurrentJobsLeaveNoScratchFiles() throws IOException {
        ExecutorService workers = Executors.newFixedThreadPool(4);
        try {
            OutputPipeline concurrent = new OutputPipeline(
                    new MetadataService(),
                    new PromptExtractionService(),
                    new KeywordMatcher(KeywordDictionary.ofSingleLabels(Map.of("oak", "Tree: Oak"))),
                    new TempFileManager(scratchDir),
                    new ColorProfileNormalizer(),
                    new WatermarkCompositor(),
                    metadataWriter,
                    ProcessingOptions.defaults(),
                    workers);

            List<CompletableFuture<Boolean>> jobs = new ArrayList<>();
            List<String> expected = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String name = "oak_" + i + ".png";
                expected.add(name);
                Path source = PngFixtures.writePng(sourceDir.resolve(name), "parameters", "old oak number " + i);
                jobs.add(concurrent.submit(source, destinationDir));
            }

            for (CompletableFuture<Boolean> job : jobs) {
                assertTrue(job.join());
            }
            verify(metadataWriter, times(8)).write(any(Path.class), any(ImageTags.class));
            assertEquals(expected, fileNames(destinationDir));
            assertScratchEmpty();
        } finally {
            workers.shutdownNow();
        }
    }

    @Test
    void testUnreadableImageFails() throws IOException {
        Path source = Files.writeString(sourceDir.resolve("broken.png"), "truncated");

        assertFalse(pipeline.processFile(source, destinationDir));
        verifyNoInteractions(metadataWriter);
        assertScratchEmpty();
    }

    @Test
    void testUnusableDestinationAbortsAfterCleanup() throws IOException {
        Path source = automatic1111Image();
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "a file, not a directory");

        OutputDirectoryException e = assertThrows(OutputDirectoryException.class,
                () -> pipeline.processFile(source, blocker));

        assertEquals(blocker, e.getDirectory());
        verifyNoInteractions(metadataWriter);
        assertScratchEmpty();
    }
}
