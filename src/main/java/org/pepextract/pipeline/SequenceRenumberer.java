/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.pepextract.sequence.FastaInputStream;
import org.pepextract.sequence.FastaOutputStream;
import org.pepextract.sequence.Sequence;
import org.pepextract.sequence.validate.ValidationHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object converts accepted translated sequences to the final output format.  The first pass maps each
 * accepted query to the canonical subject ID of its first accepted hit, and collects the translated sequences for
 * those queries in file order, relabeled with the canonical ID.  The second pass numbers the sequences for each
 * canonical ID in the order they were collected, producing headers of the form "ID_N GN=ID_N".
 *
 * The numbering depends on the order of the translated file, so it is only stable if that order is.
 *
 * @author Bruce Parrello
 *
 */
public class SequenceRenumberer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SequenceRenumberer.class);
    /** map of query IDs to canonical subject IDs */
    private final Map<String, String> bestHits;

    /**
     * Construct a renumberer for a set of accepted hits.
     *
     * @param hits	accepted hits, in filter order
     */
    public SequenceRenumberer(List<ValidationHit> hits) {
        this.bestHits = new LinkedHashMap<String, String>(hits.size() * 4 / 3 + 1);
        for (ValidationHit hit : hits)
            this.bestHits.putIfAbsent(hit.getQueryId(), hit.getCanonicalSubject());
    }

    /**
     * @return the map of query IDs to canonical subject IDs
     */
    public Map<String, String> getBestHits() {
        return Collections.unmodifiableMap(this.bestHits);
    }

    /**
     * Collect the translated sequences for the accepted queries, relabeled with their canonical IDs.  The
     * sequences are also written unmodified to an optional output stream.
     *
     * @param translatedFile	translated protein FASTA file
     * @param rawStream			stream for the unmodified sequences, or NULL
     *
     * @return the relabeled sequences, in file order
     *
     * @throws IOException
     */
    public List<Sequence> mapSequences(File translatedFile, FastaOutputStream rawStream) throws IOException {
        List<Sequence> retVal = new ArrayList<Sequence>(this.bestHits.size());
        try (FastaInputStream inStream = new FastaInputStream(translatedFile)) {
            for (Sequence seq : inStream) {
                String canonical = this.bestHits.get(seq.getLabel());
                if (canonical != null) {
                    if (rawStream != null)
                        rawStream.write(seq);
                    retVal.add(new Sequence(canonical, "", seq.getSequence()));
                }
            }
        }
        log.info("{} translated sequences mapped to {} accepted queries.", retVal.size(), this.bestHits.size());
        return retVal;
    }

    /**
     * Number the relabeled sequences.  Each canonical ID has its own counter starting at 1.
     *
     * @param mapped	sequences labeled with canonical IDs
     *
     * @return the sequences in final output format
     */
    public static List<Sequence> renumber(List<Sequence> mapped) {
        Map<String, Integer> counters = new HashMap<String, Integer>();
        List<Sequence> retVal = new ArrayList<Sequence>(mapped.size());
        for (Sequence seq : mapped) {
            int num = counters.merge(seq.getLabel(), 1, Integer::sum);
            String label = seq.getLabel() + "_" + num;
            retVal.add(new Sequence(label, "GN=" + label, seq.getSequence()));
        }
        return retVal;
    }

}
