package com.astrazeneca.tmber;

import com.astrazeneca.tmber.data.GenomicInterval;
import com.astrazeneca.tmber.data.RegionSet;
import com.astrazeneca.tmber.exception.EmptyRegionSetException;
import com.astrazeneca.tmber.exception.InputFormatException;
import com.astrazeneca.tmber.external.InputOpener;
import com.astrazeneca.tmber.external.IntervalListRegionMerger;
import com.astrazeneca.tmber.external.RegionMerger;
import htsjdk.samtools.util.BlockCompressedOutputStream;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static org.testng.Assert.assertEquals;

public class RegionSetBuilderTest {
    private Path tmpDir;

    @BeforeMethod
    public void setUp() throws IOException {
        tmpDir = Files.createTempDirectory("region_set_builder");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (Stream<Path> files = Files.list(tmpDir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Files.delete(file);
            }
        }
        Files.delete(tmpDir);
    }

    private File writeBed(String name, String... lines) throws IOException {
        Path bed = tmpDir.resolve(name);
        Files.write(bed, Arrays.asList(lines), StandardCharsets.UTF_8);
        return bed.toFile();
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testLinesAreNormalizedBeforeMerging() throws IOException {
        RegionMerger merger = Mockito.mock(RegionMerger.class);
        Mockito.when(merger.merge(Mockito.anyList()))
                .thenReturn(Collections.singletonList(new GenomicInterval("chr1", 100, 200)));
        File bed = writeBed("panel.bed",
                "track name=panel",
                "browser position chr1:1-1000",
                "# comment",
                "",
                "1\t100\t150\tname",
                "CHR1\t140\t200",
                "chrX\t0\t10");

        RegionSet regionSet = new RegionSetBuilder(new InputOpener(), merger).build(bed);

        ArgumentCaptor<List<GenomicInterval>> captor = ArgumentCaptor.forClass(List.class);
        Mockito.verify(merger).merge(captor.capture());
        assertEquals(captor.getValue(), Arrays.asList(
                new GenomicInterval("chr1", 100, 150),
                new GenomicInterval("chr1", 140, 200),
                new GenomicInterval("chrX", 0, 10)));
        assertEquals(regionSet.name, "panel");
        assertEquals(regionSet.size, 100);
    }

    @Test
    public void testMergedRegionSet() throws IOException {
        File bed = writeBed("exome.bed",
                "chr2\t0\t50",
                "chr1\t10\t20",
                "chr1\t15\t30",
                "chr1\t30\t40");

        RegionSet regionSet = new RegionSetBuilder(new InputOpener(), new IntervalListRegionMerger()).build(bed);

        assertEquals(regionSet.getIntervals(), Arrays.asList(
                new GenomicInterval("chr1", 10, 40),
                new GenomicInterval("chr2", 0, 50)));
        assertEquals(regionSet.size, 80);
    }

    @Test
    public void testCompressedBedName() throws IOException {
        Path bed = tmpDir.resolve("targets.bed.gz");
        try (OutputStream out = new BlockCompressedOutputStream(bed.toFile())) {
            out.write("1\t0\t1000\n".getBytes(StandardCharsets.UTF_8));
        }

        RegionSet regionSet = new RegionSetBuilder(new InputOpener(), new IntervalListRegionMerger())
                .build(bed.toFile());

        assertEquals(regionSet.name, "targets");
        assertEquals(regionSet.size, 1000);
    }

    @Test(expectedExceptions = EmptyRegionSetException.class)
    public void testEmptyBed() throws IOException {
        File bed = writeBed("empty.bed", "# nothing here");
        new RegionSetBuilder(new InputOpener(), new IntervalListRegionMerger()).build(bed);
    }

    @DataProvider(name = "malformed")
    public Object[][] malformed() {
        return new Object[][] {
                {"chr1\t100"},
                {"chr1\tstart\t200"},
                {"chr1\t200\t100"},
                {"chr1\t-5\t100"},
        };
    }

    @Test(dataProvider = "malformed", expectedExceptions = InputFormatException.class)
    public void testMalformedLine(String line) throws IOException {
        File bed = writeBed("broken.bed", "chr1\t0\t10", line);
        new RegionSetBuilder(new InputOpener(), new IntervalListRegionMerger()).build(bed);
    }
}
