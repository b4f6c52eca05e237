package org.tabula.adapters;

/**
 * Captured outcome of one external tool invocation.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
