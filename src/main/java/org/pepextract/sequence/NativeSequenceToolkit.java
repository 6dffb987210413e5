/**
 *
 */
package org.pepextract.sequence;

import java.io.File;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This toolkit does all of its work in-process using the FASTA and FASTQ streams.
 *
 * @author Bruce Parrello
 *
 */
public class NativeSequenceToolkit extends SequenceToolkit {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NativeSequenceToolkit.class);

    @Override
    public int extractReads(File fastqFile, Set<String> readIds, File fastaFile) throws IOException {
        int retVal = 0;
        int readCount = 0;
        try (FastqInputStream inStream = new FastqInputStream(fastqFile);
                FastaOutputStream outStream = new FastaOutputStream(fastaFile)) {
            for (Sequence read : inStream) {
                readCount++;
                if (readIds.contains(read.getLabel())) {
                    outStream.write(read);
                    retVal++;
                }
                if (log.isDebugEnabled() && readCount % 1000000 == 0)
                    log.debug("{} reads scanned in {}, {} extracted.", readCount, fastqFile, retVal);
            }
        }
        log.info("{} of {} requested reads found among {} in {}.", retVal, readIds.size(), readCount, fastqFile);
        return retVal;
    }

    @Override
    public int deduplicate(File inFile, File outFile) throws IOException {
        Set<String> seen = new HashSet<String>();
        int inCount = 0;
        try (FastaInputStream inStream = new FastaInputStream(inFile);
                FastaOutputStream outStream = new FastaOutputStream(outFile)) {
            for (Sequence seq : inStream) {
                inCount++;
                if (seen.add(seq.getSequence()))
                    outStream.write(seq);
            }
        }
        log.info("{} unique sequences found among {} in {}.", seen.size(), inCount, inFile);
        return seen.size();
    }

}
