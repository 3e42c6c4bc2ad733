package com.filerelay.proxy.infrastructure.command;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs a script through {@code /bin/sh -c} and collects both output streams.
 */
public class ShellCommandRunner {

    public record Result(int exitCode, String stdout, String stderr) {

        /** Both streams, stdout first; curl writes its trace to stderr. */
        public String combined() {
            String out = stdout.strip();
            String err = stderr.strip();
            if (out.isEmpty()) return err;
            if (err.isEmpty()) return out;
            return out + "\n" + err;
        }
    }

    public Result run(String script) throws IOException, InterruptedException {
        Process process = new ProcessBuilder("/bin/sh", "-c", script).start();
        process.getOutputStream().close();
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
        String stdout = read(process.getInputStream());
        int exit = process.waitFor();
        try {
            return new Result(exit, stdout, stderr.get());
        } catch (ExecutionException e) {
            throw new IOException("cannot read command error output", e.getCause());
        }
    }

    private static String read(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
