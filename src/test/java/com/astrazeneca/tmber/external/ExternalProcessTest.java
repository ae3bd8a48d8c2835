package com.astrazeneca.tmber.external;

import com.astrazeneca.tmber.exception.ExternalProcessException;
import org.testng.SkipException;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.testng.Assert.*;

public class ExternalProcessTest {
    private String shell;

    @BeforeClass
    public void findShell() {
        shell = new ExecutableLocator().find("sh");
        if (shell == null) {
            throw new SkipException("sh is not available");
        }
    }

    @Test
    public void testReadsStandardOutput() throws IOException {
        List<String> lines = new ArrayList<>();
        try (ExternalProcess process = new ExternalProcess(shell, "-c", "printf 'one\\ntwo\\n'")) {
            String line;
            while ((line = process.read()) != null) {
                lines.add(line);
            }
        }
        assertEquals(lines, Arrays.asList("one", "two"));
    }

    @Test
    public void testUnreadOutputIsDrained() throws IOException {
        try (ExternalProcess process = new ExternalProcess(shell, "-c",
                "i=0; while [ $i -lt 20000 ]; do echo line$i; i=$((i+1)); done")) {
            assertEquals(process.read(), "line0");
        }
    }

    @Test
    public void testNonZeroExitCode() throws IOException {
        ExternalProcess process = new ExternalProcess(shell, "-c", "echo partial; echo 'bad input' >&2; exit 3");
        assertEquals(process.read(), "partial");
        try {
            process.close();
            fail("A failed tool must be reported on close");
        } catch (ExternalProcessException e) {
            assertEquals(e.getExitCode(), 3);
            assertTrue(e.getStderr().contains("bad input"));
        }
    }
}
