package com.reelindex.service.media;

import com.reelindex.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external media tool and collects stdout and stderr separately.
 *
 * Both streams are drained on their own threads so that the configured
 * timeout applies even when the tool stops producing output.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    /** How long to wait for the drain threads once the process has exited. */
    private static final long DRAIN_GRACE_MILLIS = 2000;

    public record Result(int exitCode, List<String> stdout, List<String> stderr) {

        public Result(int exitCode, List<String> stdout) {
            this(exitCode, stdout, List.of());
        }

        public boolean succeeded() {
            return exitCode == 0;
        }

        public String output() {
            return String.join("\n", stdout);
        }

        /** Last few diagnostic lines, for error messages. */
        public String tail() {
            List<String> lines = stderr.isEmpty() ? stdout : stderr;
            int from = Math.max(0, lines.size() - 5);
            return String.join("\n", lines.subList(from, lines.size()));
        }
    }

    private final AppConfig appConfig;

    public ProcessRunner(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    public Result run(List<String> command) throws IOException {
        log.debug("Running {}", command);
        String tool = command.get(0);
        long timeout = appConfig.getProcessTimeoutSeconds();
        Process process = new ProcessBuilder(command).start();

        List<String> stdout = Collections.synchronizedList(new ArrayList<>());
        List<String> stderr = Collections.synchronizedList(new ArrayList<>());
        Thread outDrain = drain(process.getInputStream(), stdout, tool + "-stdout");
        Thread errDrain = drain(process.getErrorStream(), stderr, tool + "-stderr");

        try {
            if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException(tool + " timed out after " + timeout + "s");
            }
            outDrain.join(DRAIN_GRACE_MILLIS);
            errDrain.join(DRAIN_GRACE_MILLIS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException(tool + " interrupted", e);
        }
        synchronized (stdout) {
            synchronized (stderr) {
                return new Result(process.exitValue(), List.copyOf(stdout), List.copyOf(stderr));
            }
        }
    }

    private static Thread drain(InputStream stream, List<String> sink, String name) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.add(line);
                }
            } catch (IOException e) {
                // the stream closes under us when a timed-out process is destroyed
                log.debug("{} drain stopped: {}", name, e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }
}
