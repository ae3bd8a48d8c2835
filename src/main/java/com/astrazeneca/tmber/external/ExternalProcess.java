package com.astrazeneca.tmber.external;

import com.astrazeneca.tmber.exception.ExternalProcessException;
import htsjdk.samtools.util.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs an external tool and reads its standard output line by line. Standard error goes to a temporary file
 * and is reported when the tool exits with a non-zero code on {@link #close()}.
 */
public class ExternalProcess implements LineReader {
    private static final Log log = Log.getInstance(ExternalProcess.class);

    private final Process proc;
    private final BufferedReader reader;
    private final List<String> list;
    private final File stderrFile;

    public ExternalProcess(String... args) throws IOException {
        this(Arrays.asList(args));
    }

    public ExternalProcess(List<String> args) throws IOException {
        list = new ArrayList<>(args);
        log.debug("args: ", list);

        stderrFile = File.createTempFile("tmber", ".stderr");
        stderrFile.deleteOnExit();
        ProcessBuilder builder = new ProcessBuilder(list);
        builder.redirectError(ProcessBuilder.Redirect.to(stderrFile));
        proc = builder.start();
        reader = new BufferedReader(new InputStreamReader(proc.getInputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public String read() throws IOException {
        return reader.readLine();
    }

    /**
     * Reads the rest of standard output and waits for the tool.
     * @throws ExternalProcessException if the tool exits with a non-zero code
     */
    @Override
    public void close() throws IOException {
        try {
            while (reader.readLine() != null) {
                // drain so the tool is not blocked on a full pipe
            }
            reader.close();
            int exitValue = proc.waitFor();
            if (exitValue != 0) {
                String stderr = new String(Files.readAllBytes(stderrFile.toPath()), StandardCharsets.UTF_8);
                String command = String.join(" ", list);
                log.error("STDERR from subprocess `", command, "`:", System.lineSeparator(), stderr);
                throw new ExternalProcessException(command, exitValue, stderr);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proc.destroy();
            throw new IOException("Interrupted while waiting for " + String.join(" ", list), e);
        } finally {
            proc.getOutputStream().close();
            Files.deleteIfExists(stderrFile.toPath());
        }
    }
}
