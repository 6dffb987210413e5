/**
 *
 */
package org.pepextract.sequence;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This translator works in-process using the bacterial genetic code.  Codons containing ambiguity characters
 * translate to "X", stops to "*", and an incomplete codon at the end of a frame is dropped.
 *
 * @author Bruce Parrello
 *
 */
public class NativeFrameTranslator extends FrameTranslator {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NativeFrameTranslator.class);
    /** codon translation table for genetic code 11 */
    private static final Map<String, Character> CODON_TABLE = buildTable();

    /**
     * @return the codon table for genetic code 11
     */
    private static Map<String, Character> buildTable() {
        final String bases = "TCAG";
        // Amino acids in TCAG order for the first, second and third positions.
        final String aminos = "FFLLSSSSYY**CC*WLLLLPPPPHHQQRRRRIIIMTTTTNNKKSSRRVVVVAAAADDEEGGGG";
        Map<String, Character> retVal = new HashMap<String, Character>(64);
        int idx = 0;
        for (int i = 0; i < 4; i++) {
            for (int j = 0; j < 4; j++) {
                for (int k = 0; k < 4; k++) {
                    String codon = new String(new char[] { bases.charAt(i), bases.charAt(j), bases.charAt(k) });
                    retVal.put(codon, aminos.charAt(idx));
                    idx++;
                }
            }
        }
        return retVal;
    }

    @Override
    public int translate(File dnaFile, File aaFile) throws IOException {
        int retVal = 0;
        try (FastaInputStream inStream = new FastaInputStream(dnaFile);
                FastaOutputStream outStream = new FastaOutputStream(aaFile)) {
            for (Sequence seq : inStream) {
                String dna = seq.getSequence().toUpperCase().replace('U', 'T');
                String rev = reverseComplement(dna);
                for (int frame : FRAMES) {
                    String source = (frame > 0 ? dna : rev);
                    String prot = translate(source, Math.abs(frame) - 1);
                    outStream.write(new Sequence(frameId(seq.getLabel(), frame), "", prot));
                    retVal++;
                }
            }
        }
        log.info("{} protein sequences translated from {}.", retVal, dnaFile);
        return retVal;
    }

    /**
     * @return the protein translation of a DNA string starting at the specified offset
     *
     * @param dna		upper-case DNA string
     * @param offset	offset (0-based) of the first codon
     */
    public static String translate(String dna, int offset) {
        final int n = dna.length();
        StringBuilder retVal = new StringBuilder(n / 3 + 1);
        for (int i = offset; i + 3 <= n; i += 3) {
            Character aa = CODON_TABLE.get(dna.substring(i, i + 3));
            retVal.append(aa == null ? 'X' : aa.charValue());
        }
        return retVal.toString();
    }

    /**
     * @return the reverse complement of an upper-case DNA string
     *
     * @param dna	DNA string to reverse
     */
    public static String reverseComplement(String dna) {
        final int n = dna.length();
        char[] retVal = new char[n];
        for (int i = 0; i < n; i++) {
            char c = dna.charAt(n - i - 1);
            char comp;
            switch (c) {
            case 'A' -> comp = 'T';
            case 'C' -> comp = 'G';
            case 'G' -> comp = 'C';
            case 'T' -> comp = 'A';
            default -> comp = 'N';
            }
            retVal[i] = comp;
        }
        return new String(retVal);
    }

}
