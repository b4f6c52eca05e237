package org.tabula.adapters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Runs external command line tools. Separated out so adapters that shell out can be driven without the tools installed.
 */
public interface CommandRunner {

    /**
     * Runs {@code command} to completion or until {@code timeout} elapses, in which case the process is destroyed.
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException, TimeoutException;

    /**
     * @return true if {@code tool} resolves to an executable file on the {@code PATH}
     */
    default boolean isAvailable(String tool) {
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null || pathEnv.isBlank()) return false;
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, tool);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return true;
            }
        }
        return false;
    }
}
