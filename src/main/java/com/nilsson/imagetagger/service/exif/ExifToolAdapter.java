package com.nilsson.imagetagger.service.exif;

import com.nilsson.imagetagger.service.model.ImageTags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 <h2>ExifToolAdapter</h2>
 <p>
 {@link MetadataWriter} backed by a single long-running {@code exiftool -stay_open} process.
 </p>
 <h3>Protocol:</h3>
 <ul>
 <li>Arguments are sent one per line on stdin, followed by {@code -execute}.</li>
 <li>The reply ends with a {@code {ready}} line; stderr is merged into stdout so errors arrive
 with the reply.</li>
 <li>Values are HTML-escaped and sent with {@code -E} so that multi-line prompts survive the
 line-based protocol.</li>
 </ul>
 <h3>Concurrency:</h3>
 <p>
 The process is one shared resource. A lock serializes every exchange with it, which keeps replies
 from interleaving when several jobs tag files at once. {@link #close()} takes the same lock, so an
 in-flight write finishes before the process is told to exit. Closing is guarded to run once.
 </p>
 */
public class ExifToolAdapter implements MetadataWriter {

    private static final Logger logger = LoggerFactory.getLogger(ExifToolAdapter.class);

    static final String READY_MARKER = "{ready}";
    private static final Pattern UPDATED = Pattern.compile("(\\d+) image files? updated");
    private static final long EXIT_TIMEOUT_SECONDS = 5;

    /**
     Starts the external process; replaced in tests.
     */
    @FunctionalInterface
    interface ProcessLauncher {
        Process start(List<String> command) throws IOException;
    }

    private final String executable;
    private final ProcessLauncher launcher;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // --- Process State (guarded by lock) ---
    private Process process;
    private BufferedWriter stdin;
    private BufferedReader stdout;

    public ExifToolAdapter(String executable) {
        this(executable, command -> new ProcessBuilder(command).redirectErrorStream(true).start());
    }

    ExifToolAdapter(String executable, ProcessLauncher launcher) {
        this.executable = executable;
        this.launcher = launcher;
    }

    // ------------------------------------------------------------------------
    // Writing
    // ------------------------------------------------------------------------

    @Override
    public void write(Path file, ImageTags tags) throws MetadataWriteException {
        if (closed.get()) {
            throw new MetadataWriteException("ExifTool adapter is shut down");
        }

        lock.lock();
        try {
            if (closed.get()) {
                throw new MetadataWriteException("ExifTool adapter is shut down");
            }
            ensureStarted();

            logger.debug("Writing metadata to {} ({} keywords)", file.getFileName(), tags.getKeywords().size());
            for (String arg : buildArguments(file, tags)) {
                stdin.write(arg);
                stdin.newLine();
            }
            stdin.write("-execute");
            stdin.newLine();
            stdin.flush();

            evaluate(file, readReply());
        } catch (MetadataWriteException e) {
            throw e;
        } catch (IOException e) {
            // The stream state is unknown now; start a fresh process on the next write
            discardProcess();
            throw new MetadataWriteException("ExifTool communication failed for " + file.getFileName(), e);
        } finally {
            lock.unlock();
        }
    }

    private void ensureStarted() throws IOException {
        if (process != null && process.isAlive()) return;

        List<String> command = List.of(executable, "-stay_open", "True", "-@", "-");
        logger.info("Starting ExifTool: {}", String.join(" ", command));
        process = launcher.start(command);
        stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    }

    static List<String> buildArguments(Path file, ImageTags tags) {
        List<String> args = new ArrayList<>();
        args.add("-E");
        String description = escape(tags.getDescription());
        args.add("-Description=" + description);
        args.add("-ImageDescription=" + description);
        for (String keyword : tags.getKeywords()) {
            args.add("-Keywords=" + escape(keyword));
        }
        args.add(file.toAbsolutePath().toString());
        return args;
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '\n' -> sb.append("&#xa;");
                case '\r' -> sb.append("&#xd;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private List<String> readReply() throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = stdout.readLine()) != null) {
            if (line.trim().equals(READY_MARKER)) {
                return lines;
            }
            lines.add(line);
        }
        throw new IOException("ExifTool exited before completing the request: " + lines);
    }

    static void evaluate(Path file, List<String> reply) throws MetadataWriteException {
        int updated = 0;
        for (String line : reply) {
            String trimmed = line.trim();
            if (trimmed.startsWith("Error")) {
                throw new MetadataWriteException("ExifTool failed for " + file.getFileName() + ": " + trimmed);
            }
            Matcher m = UPDATED.matcher(trimmed);
            if (m.find()) {
                updated = Integer.parseInt(m.group(1));
            }
        }
        if (updated < 1) {
            throw new MetadataWriteException("ExifTool did not update " + file.getFileName() + ": " + reply);
        }
    }

    // ------------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------------

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        lock.lock();
        try {
            if (process == null) return;
            try {
                stdin.write("-stay_open");
                stdin.newLine();
                stdin.write("False");
                stdin.newLine();
                stdin.flush();
                if (!process.waitFor(EXIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("ExifTool did not exit within {}s, destroying it", EXIT_TIMEOUT_SECONDS);
                    process.destroyForcibly();
                }
                logger.debug("ExifTool process shut down");
            } catch (IOException e) {
                logger.warn("Failed to stop ExifTool cleanly: {}", e.getMessage());
                process.destroyForcibly();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            } finally {
                process = null;
                stdin = null;
                stdout = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private void discardProcess() {
        if (process != null) {
            process.destroyForcibly();
        }
        process = null;
        stdin = null;
        stdout = null;
    }
}
