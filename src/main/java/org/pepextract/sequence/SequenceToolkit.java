/**
 *
 */
package org.pepextract.sequence;

import java.io.File;
import java.io.IOException;
import java.util.Set;

import org.pepextract.utils.DownstreamToolException;

/**
 * This is the base class for the FASTA/FASTQ manipulation toolkit.  The toolkit subsets a read file by read ID
 * and removes exact duplicate sequences.  The pipeline only depends on the input and output contracts, so the
 * work can be done in-process or by an external program.
 *
 * @author Bruce Parrello
 *
 */
public abstract class SequenceToolkit {

    /**
     * This enum contains the supported toolkit types.
     */
    public enum Type {
        /** work in-process */
        NATIVE {
            @Override
            public SequenceToolkit create(File tempDir) {
                return new NativeSequenceToolkit();
            }
        },
        /** use the seqkit program */
        SEQKIT {
            @Override
            public SequenceToolkit create(File tempDir) {
                return new SeqkitSequenceToolkit(tempDir);
            }
        };

        /**
         * @return a toolkit of this type
         *
         * @param tempDir	directory for intermediate files and tool logs
         */
        public abstract SequenceToolkit create(File tempDir);
    }

    /**
     * Extract the reads with the specified IDs from a FASTQ file and write them in FASTA format.  IDs not found
     * in the FASTQ file are ignored.
     *
     * @param fastqFile		input FASTQ file (may be gzipped)
     * @param readIds		IDs of the reads to extract
     * @param fastaFile		output FASTA file
     *
     * @return the number of reads written
     *
     * @throws IOException
     * @throws DownstreamToolException
     */
    public abstract int extractReads(File fastqFile, Set<String> readIds, File fastaFile)
            throws IOException, DownstreamToolException;

    /**
     * Copy a FASTA file, keeping only the first sequence with each distinct sequence string.  Two sequences
     * that differ by a single residue are both kept.
     *
     * @param inFile	input FASTA file
     * @param outFile	output FASTA file
     *
     * @return the number of sequences written
     *
     * @throws IOException
     * @throws DownstreamToolException
     */
    public abstract int deduplicate(File inFile, File outFile) throws IOException, DownstreamToolException;

}
