package com.astrazeneca.tmber;

import com.astrazeneca.tmber.exception.ConfigurationException;
import com.astrazeneca.tmber.exception.ExecutableNotFoundException;
import com.astrazeneca.tmber.external.ExecutableLocator;
import com.astrazeneca.tmber.modes.AbstractMode;
import com.astrazeneca.tmber.modes.BedMode;
import com.astrazeneca.tmber.modes.TmbMode;
import org.testng.annotations.Test;

import static org.testng.Assert.assertTrue;

public class TmbLauncherTest {
    private final TmbLauncher launcher = new TmbLauncher(new ExecutableLocator(""));

    private static Configuration tmbConfig() {
        Configuration config = new Configuration();
        config.command = Configuration.Command.TMB;
        config.beds.add("panel.bed");
        config.vcfs.add("sample.vcf");
        return config;
    }

    @Test
    public void testTmbMode() {
        AbstractMode mode = launcher.createMode(tmbConfig());
        assertTrue(mode instanceof TmbMode);
    }

    @Test
    public void testBedMode() {
        Configuration config = new Configuration();
        config.command = Configuration.Command.BED;
        config.fasta = "genome.fa";
        assertTrue(launcher.createMode(config) instanceof BedMode);
    }

    @Test(expectedExceptions = ExecutableNotFoundException.class)
    public void testMissingBedtools() {
        Configuration config = tmbConfig();
        config.useBedtools = true;
        launcher.createMode(config);
    }

    @Test(expectedExceptions = ExecutableNotFoundException.class)
    public void testMissingDecompressionTool() {
        Configuration config = tmbConfig();
        config.vcfs.set(0, "sample.vcf.bz2");
        config.externalDecompression = true;
        launcher.createMode(config);
    }

    @Test
    public void testUncompressedInputsNeedNoTools() {
        Configuration config = tmbConfig();
        config.externalDecompression = true;
        assertTrue(launcher.createMode(config) instanceof TmbMode);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testAfFilterWithoutSample() {
        Configuration config = tmbConfig();
        config.maxAf = 0.5;
        launcher.createMode(config);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testSameVcfStemInTwoDirectories() {
        Configuration config = tmbConfig();
        config.vcfs.clear();
        config.vcfs.add("a/sample.vcf");
        config.vcfs.add("b/sample.vcf");
        launcher.createMode(config);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testMissingBeds() {
        Configuration config = tmbConfig();
        config.beds.clear();
        launcher.createMode(config);
    }
}
