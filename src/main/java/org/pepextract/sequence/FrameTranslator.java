/**
 *
 */
package org.pepextract.sequence;

import java.io.File;
import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.pepextract.utils.DownstreamToolException;

/**
 * This is the base class for six-frame translation engines.  Each input DNA sequence produces six protein
 * sequences, one for each reading frame.  The output ID of each protein is the input ID followed by a frame tag,
 * e.g. "read17_frame=-2".  Frames 1 to 3 are forward, -1 to -3 are on the reverse complement.
 *
 * @author Bruce Parrello
 *
 */
public abstract class FrameTranslator {

    /** frame tag separating the sequence ID from the frame number */
    public static final String FRAME_TAG = "_frame=";
    /** frame numbers in output order */
    public static final int[] FRAMES = new int[] { 1, 2, 3, -1, -2, -3 };
    /** genetic code used for translation */
    public static final int GENETIC_CODE = 11;

    /**
     * This enum contains the supported translator types.
     */
    public enum Type {
        /** translate in-process */
        NATIVE {
            @Override
            public FrameTranslator create(File tempDir) {
                return new NativeFrameTranslator();
            }
        },
        /** use "seqkit translate" */
        SEQKIT {
            @Override
            public FrameTranslator create(File tempDir) {
                return new SeqkitFrameTranslator(tempDir);
            }
        };

        /**
         * @return a translator of this type
         *
         * @param tempDir	directory for tool logs
         */
        public abstract FrameTranslator create(File tempDir);
    }

    /**
     * Translate every sequence in a DNA FASTA file in all six frames.
     *
     * @param dnaFile	input DNA FASTA file
     * @param aaFile	output protein FASTA file
     *
     * @return the number of protein sequences written
     *
     * @throws IOException
     * @throws DownstreamToolException
     */
    public abstract int translate(File dnaFile, File aaFile) throws IOException, DownstreamToolException;

    /**
     * @return the ID of a translated sequence
     *
     * @param seqId		ID of the source DNA sequence
     * @param frame		frame number
     */
    public static String frameId(String seqId, int frame) {
        return seqId + FRAME_TAG + frame;
    }

    /**
     * @return the ID of the source DNA sequence for a translated-sequence ID
     *
     * @param frameId	ID of a translated sequence
     */
    public static String sourceId(String frameId) {
        return StringUtils.substringBefore(frameId, FRAME_TAG);
    }

}
