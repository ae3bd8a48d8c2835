package com.astrazeneca.tmber;

import htsjdk.samtools.util.Log;
import org.apache.commons.cli.MissingOptionException;
import org.apache.commons.cli.ParseException;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;

import static org.testng.Assert.*;

public class CmdParserTest {
    private StringWriter helpText;
    private CmdParser parser;

    @BeforeMethod
    public void setUp() {
        helpText = new StringWriter();
        parser = new CmdParser(new PrintWriter(helpText));
    }

    @Test
    public void testTmbDefaults() throws ParseException {
        Configuration config = parser.parseParams(new String[] {"tmb", "-b", "panel.bed", "sample.vcf"});

        assertEquals(config.command, Configuration.Command.TMB);
        assertEquals(config.beds, Arrays.asList("panel.bed"));
        assertEquals(config.vcfs, Arrays.asList("sample.vcf"));
        assertEquals(config.destDir, ".");
        assertEquals(config.logLevel, Log.LogLevel.WARNING);
        assertFalse(config.printHeader);
        assertFalse(config.includeFiltered);
        assertFalse(config.useBedtools);
        assertFalse(config.externalDecompression);
        assertNull(config.sample);
        assertFalse(config.isAfFilterSet());
        assertTrue(config.threads >= 1);
    }

    @Test
    public void testTmbOptions() throws ParseException {
        Configuration config = parser.parseParams(new String[] {
                "tmb", "-b", "a.bed,b.bed", "--bed", "c.bed", "-d", "out", "-th", "4", "-h",
                "--include-filtered", "--sample", "TUMOR", "--min-af", "0.05", "--max-af", "1",
                "--bedtools", "--external-decompression", "--debug",
                "first.vcf.gz", "second.vcf"});

        assertEquals(config.beds, Arrays.asList("a.bed", "b.bed", "c.bed"));
        assertEquals(config.vcfs, Arrays.asList("first.vcf.gz", "second.vcf"));
        assertEquals(config.destDir, "out");
        assertEquals(config.threads, 4);
        assertTrue(config.printHeader);
        assertTrue(config.includeFiltered);
        assertEquals(config.sample, "TUMOR");
        assertEquals(config.minAf.doubleValue(), 0.05);
        assertEquals(config.maxAf.doubleValue(), 1.0);
        assertTrue(config.useBedtools);
        assertTrue(config.externalDecompression);
        assertEquals(config.logLevel, Log.LogLevel.DEBUG);
    }

    @Test
    public void testBedOptions() throws ParseException {
        Configuration config = parser.parseParams(new String[] {
                "bed", "--target-letters", "ACGTN", "--uppercase", "--human-autosome", "--compress",
                "--info", "genome.fa"});

        assertEquals(config.command, Configuration.Command.BED);
        assertEquals(config.fasta, "genome.fa");
        assertEquals(config.targetLetters, "ACGTN");
        assertTrue(config.uppercase);
        assertTrue(config.humanAutosome);
        assertTrue(config.compress);
        assertEquals(config.logLevel, Log.LogLevel.INFO);
    }

    @Test
    public void testBedDefaults() throws ParseException {
        Configuration config = parser.parseParams(new String[] {"bed", "genome.fa.gz"});

        assertEquals(config.targetLetters, "ACGT");
        assertFalse(config.uppercase);
        assertFalse(config.humanAutosome);
        assertFalse(config.compress);
    }

    @Test
    public void testMissingVcfPrintsUsage() {
        try {
            parser.parseParams(new String[] {"tmb", "-b", "panel.bed"});
            fail("VCF paths are required");
        } catch (ParseException e) {
            assertEquals(e.getMessage(), "Missing VCF path(s)");
        }
        assertTrue(helpText.toString().contains("tmber tmb [options]"));
        assertFalse(helpText.toString().contains("tmber bed [options]"));
    }

    @Test(expectedExceptions = MissingOptionException.class)
    public void testMissingBed() throws ParseException {
        parser.parseParams(new String[] {"tmb", "sample.vcf"});
    }

    @Test(expectedExceptions = ParseException.class)
    public void testAfWithoutSample() throws ParseException {
        parser.parseParams(new String[] {"tmb", "-b", "panel.bed", "--min-af", "0.1", "sample.vcf"});
    }

    @Test
    public void testUnknownCommandPrintsUsage() {
        try {
            parser.parseParams(new String[] {"count", "sample.vcf"});
            fail("Unknown command must be rejected");
        } catch (ParseException e) {
            assertTrue(e.getMessage().startsWith("Unknown command: count"));
        }
        assertTrue(helpText.toString().contains("tmber tmb [options]"));
        assertTrue(helpText.toString().contains("tmber bed [options]"));
    }

    @Test(expectedExceptions = ParseException.class)
    public void testBedNeedsOneFasta() throws ParseException {
        parser.parseParams(new String[] {"bed", "a.fa", "b.fa"});
    }

    @Test
    public void testHelp() throws ParseException {
        assertNull(parser.parseParams(new String[] {"tmb", "--help"}));
        assertTrue(helpText.toString().contains("--include-filtered"));
        assertFalse(helpText.toString().contains("--human-autosome"));
    }

    @Test
    public void testHelpWithoutCommand() throws ParseException {
        assertNull(parser.parseParams(new String[0]));
        assertTrue(helpText.toString().contains("--include-filtered"));
        assertTrue(helpText.toString().contains("--human-autosome"));
    }

    @Test
    public void testVersion() throws ParseException {
        assertNull(parser.parseParams(new String[] {"--version"}));
        assertTrue(helpText.toString().startsWith("tmber "));
    }
}
