package com.nilsson.imagetagger.service;

import java.nio.file.Path;

/**
 Per-invocation switches for {@link OutputPipeline}.
 */
public final class ProcessingOptions {

    private final boolean watermarkEnabled;
    private final String targetSubfolder;

    public ProcessingOptions(boolean watermarkEnabled, String targetSubfolder) {
        this.watermarkEnabled = watermarkEnabled;
        this.targetSubfolder = targetSubfolder == null || targetSubfolder.isBlank() ? null : targetSubfolder.trim();
    }

    public static ProcessingOptions defaults() {
        return new ProcessingOptions(true, null);
    }

    public boolean isWatermarkEnabled() {
        return watermarkEnabled;
    }

    /**
     @return the subfolder of the destination directory outputs go to, or {@code null} for none
     */
    public String getTargetSubfolder() {
        return targetSubfolder;
    }

    public ProcessingOptions withWatermark(boolean enabled) {
        return new ProcessingOptions(enabled, targetSubfolder);
    }

    public ProcessingOptions withTargetSubfolder(String subfolder) {
        return new ProcessingOptions(watermarkEnabled, subfolder);
    }

    Path resolveOutputDir(Path destinationDir) {
        return targetSubfolder == null ? destinationDir : destinationDir.resolve(targetSubfolder);
    }

    @Override
    public String toString() {
        return "ProcessingOptions{watermark=" + watermarkEnabled + ", targetSubfolder=" + targetSubfolder + "}";
    }
}
