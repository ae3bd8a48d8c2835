package com.astrazeneca.tmber.external;

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

import java.io.*;
import java.nio.charset.StandardCharsets;

/**
 * Opens text inputs for line reading. Files ending with .gz/.bgz and .bz2 are decompressed either in-process
 * (htsjdk for gzip/BGZF, commons-compress for bzip2) or by external tools found in PATH.
 */
public class InputOpener {
    private static final Log log = Log.getInstance(InputOpener.class);

    private final boolean external;
    private final ExecutableLocator locator;
    private final int threads;

    public InputOpener() {
        this(false, new ExecutableLocator(), 1);
    }

    /**
     * @param external decompress with bgzip/pigz or pbzip2/bzip2 instead of in-process streams
     * @param locator lookup of the external tools
     * @param threads threads given to the external tools that support them
     */
    public InputOpener(boolean external, ExecutableLocator locator, int threads) {
        this.external = external;
        this.locator = locator;
        this.threads = Math.max(threads, 1);
    }

    public LineReader open(File file) throws IOException {
        String path = file.getPath();
        if (isGzip(path)) {
            return external ? openGzipExternal(path) : new BufferedLineReader(new BufferedReader(
                    new InputStreamReader(IOUtil.openGzipFileForReading(file), StandardCharsets.UTF_8)));
        } else if (isBzip2(path)) {
            return external ? openBzip2External(path) : openBzip2(file);
        }
        return new BufferedLineReader(IOUtil.openFileForBufferedReading(file));
    }

    private LineReader openBzip2(File file) throws IOException {
        InputStream in = new BufferedInputStream(new FileInputStream(file));
        try {
            return new BufferedLineReader(new BufferedReader(
                    new InputStreamReader(new BZip2CompressorInputStream(in, true), StandardCharsets.UTF_8)));
        } catch (IOException | RuntimeException e) {
            try {
                in.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    private LineReader openGzipExternal(String path) throws IOException {
        String bgzip = locator.find("bgzip");
        if (bgzip != null) {
            log.debug("Decompress with bgzip: ", path);
            return new ExternalProcess(bgzip, "-@", String.valueOf(threads), "-dc", path);
        }
        String pigz = locator.locateAny("pigz");
        log.debug("Decompress with pigz: ", path);
        return new ExternalProcess(pigz, "-p", String.valueOf(threads), "-dc", path);
    }

    private LineReader openBzip2External(String path) throws IOException {
        String pbzip2 = locator.find("pbzip2");
        if (pbzip2 != null) {
            log.debug("Decompress with pbzip2: ", path);
            return new ExternalProcess(pbzip2, "-p" + threads, "-dc", path);
        }
        String bzip2 = locator.locateAny("bzip2");
        log.debug("Decompress with bzip2: ", path);
        return new ExternalProcess(bzip2, "-dc", path);
    }

    /**
     * Checks that the tools needed for the given inputs exist before any work starts.
     * @param files inputs that will be opened
     */
    public void checkTools(Iterable<File> files) {
        if (!external) {
            return;
        }
        for (File file : files) {
            if (isGzip(file.getPath())) {
                locator.locateAny("bgzip", "pigz");
            } else if (isBzip2(file.getPath())) {
                locator.locateAny("pbzip2", "bzip2");
            }
        }
    }

    static boolean isGzip(String path) {
        return path.endsWith(".gz") || path.endsWith(".bgz");
    }

    static boolean isBzip2(String path) {
        return path.endsWith(".bz2");
    }
}
