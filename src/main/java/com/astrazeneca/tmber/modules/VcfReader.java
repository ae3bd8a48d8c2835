package com.astrazeneca.tmber.modules;

import com.astrazeneca.tmber.data.VariantRecord;
import com.astrazeneca.tmber.exception.ConfigurationException;
import com.astrazeneca.tmber.exception.InputFormatException;
import com.astrazeneca.tmber.exception.MissingSampleColumnException;
import com.astrazeneca.tmber.external.InputOpener;
import com.astrazeneca.tmber.external.LineReader;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.astrazeneca.tmber.data.Patterns.INTEGER_ONLY;
import static com.astrazeneca.tmber.data.Patterns.TAB;
import static com.astrazeneca.tmber.modules.VariantRecordParser.extractAf;
import static com.astrazeneca.tmber.modules.VariantRecordParser.isPassing;
import static com.astrazeneca.tmber.modules.VariantRecordParser.toRecord;

/**
 * Reads the data lines of a VCF file into a deduplicated set of {@link VariantRecord}s. Optionally keeps only
 * PASS/"." records and records whose AF in one sample column lies within [minAf, maxAf].
 */
public class VcfReader {
    private static final Log log = Log.getInstance(VcfReader.class);

    private static final int FILTER_COLUMN = 6;
    private static final int INFO_COLUMN = 7;
    private static final int FORMAT_COLUMN = 8;
    private static final int MIN_COLUMNS = 8;

    private final InputOpener opener;
    private final boolean includeFiltered;
    private final String sample;
    private final Double minAf;
    private final Double maxAf;

    /**
     * @param opener opener for plain or compressed files
     * @param includeFiltered keep records whose FILTER is neither PASS nor "."
     * @param sample sample column for the AF window, required if a bound is set
     * @param minAf lower AF bound (inclusive) or null
     * @param maxAf upper AF bound (inclusive) or null
     */
    public VcfReader(InputOpener opener, boolean includeFiltered, String sample, Double minAf, Double maxAf) {
        if ((minAf != null || maxAf != null) && sample == null) {
            throw new ConfigurationException("An allele frequency filter requires a sample column name (--sample).");
        }
        this.opener = opener;
        this.includeFiltered = includeFiltered;
        this.sample = sample;
        this.minAf = minAf;
        this.maxAf = maxAf;
    }

    public boolean isAfFilterActive() {
        return minAf != null || maxAf != null;
    }

    /**
     * @param vcf VCF file, plain or compressed
     * @return records in first-seen order with exact duplicates collapsed
     * @throws IOException if the file can't be read or its decompression fails
     * @throws MissingSampleColumnException if the AF filter is active and the sample column is absent
     */
    public Set<VariantRecord> read(File vcf) throws IOException {
        Set<VariantRecord> records = new LinkedHashSet<>();
        int sampleColumn = -1;
        int lineNumber = 0;
        int read = 0;
        try (LineReader reader = opener.open(vcf)) {
            String line;
            while ((line = reader.read()) != null) {
                lineNumber++;
                if (line.startsWith("##") || line.isEmpty()) {
                    continue;
                }
                if (line.startsWith("#")) {
                    sampleColumn = findSampleColumn(line, vcf);
                    continue;
                }
                if (isAfFilterActive() && sampleColumn < 0) {
                    throw new MissingSampleColumnException(sample, vcf.getPath());
                }
                read++;
                VariantRecord record = parseLine(line, sampleColumn, vcf.getPath(), lineNumber);
                if (record != null) {
                    records.add(record);
                }
            }
        }
        if (isAfFilterActive() && sampleColumn < 0) {
            throw new MissingSampleColumnException(sample, vcf.getPath());
        }
        log.info("Read ", read, " records from ", vcf, ", ", records.size(), " unique records kept");
        return Collections.unmodifiableSet(records);
    }

    /**
     * @return index of the sample column in the #CHROM line, -1 if no AF filter is requested
     */
    int findSampleColumn(String headerLine, File vcf) {
        if (!isAfFilterActive()) {
            return -1;
        }
        List<String> columns = Arrays.asList(TAB.split(headerLine));
        int index = columns.indexOf(sample);
        if (index <= FORMAT_COLUMN) {
            throw new MissingSampleColumnException(sample, vcf.getPath());
        }
        return index;
    }

    /**
     * @return record or null if it is filtered out
     */
    VariantRecord parseLine(String line, int sampleColumn, String source, int lineNumber) {
        String[] columns = TAB.split(line, -1);
        if (columns.length < MIN_COLUMNS) {
            throw new InputFormatException(source, lineNumber,
                    "expected at least " + MIN_COLUMNS + " columns, found " + columns.length);
        }
        if (!INTEGER_ONLY.matcher(columns[1]).matches()) {
            throw new InputFormatException(source, lineNumber, "POS is not an integer: " + columns[1]);
        }
        if (!includeFiltered && !isPassing(columns[FILTER_COLUMN])) {
            return null;
        }
        if (isAfFilterActive()) {
            String format = columns.length > FORMAT_COLUMN ? columns[FORMAT_COLUMN] : null;
            String value = sampleColumn < columns.length ? columns[sampleColumn] : null;
            Double af = extractAf(format, value);
            if (af == null || (minAf != null && af < minAf) || (maxAf != null && af > maxAf)) {
                return null;
            }
        }
        int pos;
        try {
            pos = Integer.parseInt(columns[1]);
        } catch (NumberFormatException e) {
            throw new InputFormatException(source, lineNumber, "POS is out of range: " + columns[1], e);
        }
        return toRecord(columns[0], pos, columns[3], columns[4], columns[INFO_COLUMN]);
    }
}
