package org.tabula.adapters;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Stdout and stderr are drained concurrently so a large
 * export cannot stall on a full pipe while the deadline is being awaited.
 */
public class ProcessCommandRunner implements CommandRunner {

    private final Logger logger;

    public ProcessCommandRunner(Logger logger) {
        this.logger = logger;
    }

    @Override
    public CommandResult run(final List<String> command, final Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        logger.log(Level.FINE, "Running {0} (deadline {1}s)", new Object[]{command, timeout.toSeconds()});
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new TimeoutException("Command " + command.get(0) + " did not finish within " + timeout.toSeconds() + "s");
        }
        try {
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException uio) throw uio.getCause();
            throw new IOException("Failed to read output of " + command.get(0), cause);
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
