/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;
import java.io.FileFilter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.pepextract.io.SafeFiles;
import org.pepextract.io.TabbedLineReader;
import org.pepextract.utils.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object is the persistent list of samples for a run.  It is built once from the alignment output directory
 * and saved to a file; each extraction task then finds its sample by index, so the index-to-sample mapping cannot
 * change if directories are added or removed while the run is in progress.
 *
 * Each sample in the alignment root is a directory named "XXXXXX_humann_temp" containing the alignment table
 * "XXXXXX_diamond_aligned.tsv", where XXXXXX is the sample ID.  The raw reads for the sample are in
 * "XXXXXX.fastq.gz" in the FASTQ directory.
 *
 * @author Bruce Parrello
 *
 */
public class SampleManifest implements Iterable<Sample> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SampleManifest.class);
    /** list of samples, in index order */
    private final List<Sample> samples;

    /** suffix for a sample directory in the alignment root */
    public static final String SAMPLE_DIR_SUFFIX = "_humann_temp";
    /** suffix for an alignment table in a sample directory */
    public static final String ALIGNMENT_SUFFIX = "_diamond_aligned.tsv";
    /** default suffix for a raw read file */
    public static final String DEFAULT_FASTQ_SUFFIX = ".fastq.gz";
    /** manifest file header */
    private static final String HEADER = "index\tsample_id\talignment_table\traw_sequences";

    /** filter for sample directories */
    private static final FileFilter SAMPLE_DIR_FILTER = new FileFilter() {
        @Override
        public boolean accept(File pathname) {
            return pathname.isDirectory() && pathname.getName().endsWith(SAMPLE_DIR_SUFFIX)
                    && pathname.getName().length() > SAMPLE_DIR_SUFFIX.length();
        }
    };

    /**
     * Construct a manifest from a list of samples.
     *
     * @param samples	samples in index order
     */
    public SampleManifest(List<Sample> samples) {
        this.samples = Collections.unmodifiableList(new ArrayList<Sample>(samples));
    }

    /**
     * Scan an alignment root directory to build a manifest.  The samples are sorted by ID.
     *
     * @param alignRoot		directory containing the sample directories
     * @param fastqDir		directory containing the raw read files
     * @param fastqSuffix	suffix of a raw read file name
     *
     * @return the manifest
     *
     * @throws ConfigurationException if the directory is invalid or contains no samples
     */
    public static SampleManifest scan(File alignRoot, File fastqDir, String fastqSuffix) throws ConfigurationException {
        if (! alignRoot.isDirectory())
            throw new ConfigurationException("Alignment root " + alignRoot + " is not found or invalid.");
        File[] sampleDirs = alignRoot.listFiles(SAMPLE_DIR_FILTER);
        if (sampleDirs == null || sampleDirs.length == 0)
            throw new ConfigurationException("No sample directories found in " + alignRoot + ".");
        // Sort by name so that the same directory contents always produce the same manifest.
        Arrays.sort(sampleDirs, Comparator.comparing(File::getName));
        List<Sample> samples = new ArrayList<Sample>(sampleDirs.length);
        for (File sampleDir : sampleDirs) {
            String sampleId = StringUtils.removeEnd(sampleDir.getName(), SAMPLE_DIR_SUFFIX);
            File alignFile = new File(sampleDir, sampleId + ALIGNMENT_SUFFIX);
            File rawFile = new File(fastqDir, sampleId + fastqSuffix);
            samples.add(new Sample(samples.size() + 1, sampleId, alignFile, rawFile));
        }
        log.info("{} samples found in {}.", samples.size(), alignRoot);
        return new SampleManifest(samples);
    }

    /**
     * Load a manifest from a file.
     *
     * @param inFile	manifest file
     *
     * @return the manifest
     *
     * @throws ConfigurationException if the file is missing or invalid
     */
    public static SampleManifest load(File inFile) throws ConfigurationException {
        if (! inFile.canRead())
            throw new ConfigurationException("Sample manifest " + inFile + " is not found or unreadable.");
        List<Sample> samples = new ArrayList<Sample>();
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            int idxCol = inStream.findField("index");
            int idCol = inStream.findField("sample_id");
            int alignCol = inStream.findField("alignment_table");
            int rawCol = inStream.findField("raw_sequences");
            for (TabbedLineReader.Line line : inStream) {
                int idx = line.getInt(idxCol);
                if (idx != samples.size() + 1)
                    throw new ConfigurationException("Sample manifest " + inFile + " is out of order at line " + line.getLineNum() + ".");
                samples.add(new Sample(idx, line.get(idCol), new File(line.get(alignCol)), new File(line.get(rawCol))));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Error reading sample manifest " + inFile + ": " + e.getMessage(), e);
        }
        if (samples.isEmpty())
            throw new ConfigurationException("Sample manifest " + inFile + " contains no samples.");
        return new SampleManifest(samples);
    }

    /**
     * Save this manifest to a file.
     *
     * @param outFile	output file
     *
     * @throws IOException
     */
    public void save(File outFile) throws IOException {
        File tempFile = SafeFiles.tempFor(outFile);
        try (PrintWriter writer = new PrintWriter(tempFile, StandardCharsets.UTF_8)) {
            writer.println(HEADER);
            for (Sample sample : this.samples)
                writer.format("%d\t%s\t%s\t%s%n", sample.getIndex(), sample.getId(),
                        sample.getAlignmentFile().getAbsolutePath(), sample.getRawFile().getAbsolutePath());
        }
        SafeFiles.commit(tempFile, outFile);
        log.info("{} samples written to manifest {}.", this.samples.size(), outFile);
    }

    /**
     * @return the sample at the specified 1-based index
     *
     * @param index		1-based sample index
     *
     * @throws ConfigurationException if the index is out of range
     */
    public Sample get(int index) throws ConfigurationException {
        if (index < 1 || index > this.samples.size())
            throw new ConfigurationException("Sample index " + index + " out of range (1-" + this.samples.size() + ").");
        return this.samples.get(index - 1);
    }

    /**
     * @return the number of samples
     */
    public int size() {
        return this.samples.size();
    }

    /**
     * @return the IDs of all the samples, in index order
     */
    public List<String> getSampleIds() {
        return this.samples.stream().map(x -> x.getId()).collect(Collectors.toList());
    }

    @Override
    public Iterator<Sample> iterator() {
        return this.samples.iterator();
    }

}
