/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;

/**
 * This object describes one sample to be processed:  its position in the manifest, its ID, the alignment table
 * produced by the alignment engine, and the raw read file.
 *
 * @author Bruce Parrello
 *
 */
public class Sample {

    // FIELDS
    /** 1-based position in the manifest */
    private final int index;
    /** sample ID */
    private final String id;
    /** alignment table file */
    private final File alignmentFile;
    /** raw sequence file */
    private final File rawFile;

    public Sample(int index, String id, File alignmentFile, File rawFile) {
        this.index = index;
        this.id = id;
        this.alignmentFile = alignmentFile;
        this.rawFile = rawFile;
    }

    /**
     * @return the 1-based manifest index
     */
    public int getIndex() {
        return this.index;
    }

    /**
     * @return the sample ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the alignment table file
     */
    public File getAlignmentFile() {
        return this.alignmentFile;
    }

    /**
     * @return the raw sequence file
     */
    public File getRawFile() {
        return this.rawFile;
    }

    @Override
    public String toString() {
        return this.id;
    }

}
