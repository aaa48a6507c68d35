package com.nilsson.imagetagger.main;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.nilsson.imagetagger.data.KeywordDictionary;
import com.nilsson.imagetagger.data.KeywordDictionaryLoader;
import com.nilsson.imagetagger.data.SettingsRepository;
import com.nilsson.imagetagger.service.KeywordMatcher;
import com.nilsson.imagetagger.service.MetadataService;
import com.nilsson.imagetagger.service.OutputPipeline;
import com.nilsson.imagetagger.service.ProcessingOptions;
import com.nilsson.imagetagger.service.PromptExtractionService;
import com.nilsson.imagetagger.service.TempFileManager;
import com.nilsson.imagetagger.service.exif.ExifToolAdapter;
import com.nilsson.imagetagger.service.exif.MetadataWriter;
import com.nilsson.imagetagger.service.image.ColorProfileNormalizer;
import com.nilsson.imagetagger.service.image.WatermarkCompositor;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class AppModule extends AbstractModule {

    private final SettingsRepository settings;

    public AppModule(SettingsRepository settings) {
        this.settings = settings;
    }

    @Override
    protected void configure() {
        bind(SettingsRepository.class).toInstance(settings);
        bind(MetadataService.class).in(Singleton.class);
        bind(KeywordMatcher.class).in(Singleton.class);
        bind(ColorProfileNormalizer.class).in(Singleton.class);
        bind(WatermarkCompositor.class).in(Singleton.class);
        bind(OutputPipeline.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    public PromptExtractionService providePromptExtractionService() {
        return new PromptExtractionService();
    }

    /**
     * Loaded once at startup; a broken dictionary file aborts injector creation.
     */
    @Provides
    @Singleton
    public KeywordDictionary provideKeywordDictionary() throws IOException {
        String file = settings.get(SettingsRepository.KEYWORDS_FILE, "keywords.json");
        return new KeywordDictionaryLoader().load(Paths.get(file));
    }

    @Provides
    @Singleton
    public TempFileManager provideTempFileManager() {
        return new TempFileManager(Paths.get(settings.get(SettingsRepository.TEMP_DIRECTORY, "temp")));
    }

    /**
     * The single shared ExifTool process. Closed by the {@link Launcher} on shutdown.
     */
    @Provides
    @Singleton
    public MetadataWriter provideMetadataWriter() {
        return new ExifToolAdapter(settings.get(SettingsRepository.EXIFTOOL_PATH, "exiftool"));
    }

    @Provides
    @Singleton
    public ProcessingOptions provideProcessingOptions() {
        return new ProcessingOptions(
                settings.getBoolean(SettingsRepository.ADD_WATERMARK, true),
                settings.get(SettingsRepository.TARGET_SUBFOLDER, ""));
    }

    /**
     * Provides the worker pool jobs run on.
     * Configured with a Daemon ThreadFactory so a stuck job doesn't prevent shutdown.
     */
    @Provides
    @Singleton
    public ExecutorService provideExecutorService() {
        int configured = settings.getInt(SettingsRepository.WORKER_THREADS, 0);
        int threads = configured > 0 ? configured : Runtime.getRuntime().availableProcessors() + 2;
        return Executors.newFixedThreadPool(
                threads,
                new ThreadFactory() {
                    private final AtomicInteger count = new AtomicInteger(1);
                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r);
                        t.setDaemon(true);
                        t.setName("Tagger-Worker-" + count.getAndIncrement());
                        return t;
                    }
                }
        );
    }
}
