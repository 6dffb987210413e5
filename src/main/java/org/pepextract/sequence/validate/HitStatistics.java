/**
 *
 */
package org.pepextract.sequence.validate;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.pepextract.pipeline.TargetSet;
import org.pepextract.sequence.FrameTranslator;

/**
 * This object computes the summary counts for a set of accepted hits.  All counts are simple tallies over the hit
 * list, so the results depend only on the hits, the target set, and the length cutoff.
 *
 * @author Bruce Parrello
 *
 */
public class HitStatistics {

    // FIELDS
    /** canonical subject IDs with at least one accepted hit */
    private final SortedSet<String> matchedTargets;
    /** matched IDs that were in the target set */
    private final SortedSet<String> originalMatched;
    /** matched IDs that were not in the target set */
    private final SortedSet<String> newlyDiscovered;
    /** number of distinct translated sequences (sequence/frame pairs) with an accepted hit */
    private final int framesWithHits;
    /** number of distinct source DNA sequences with an accepted hit */
    private final int sequencesWithHits;
    /** number of frames searched */
    private final int framesSearched;
    /** number of accepted hits */
    private final int hitCount;
    /** number of hits with 100% identity */
    private final int perfectHits;
    /** number of hits with at least 95% identity */
    private final int highQualityHits;

    /** identity of a perfect hit */
    public static final double PERFECT_IDENTITY = 100.0;
    /** identity of a high-quality hit */
    public static final double HIGH_IDENTITY = 95.0;

    /**
     * Compute the statistics for a set of accepted hits.
     *
     * @param hits			accepted hits
     * @param targets		original target set
     * @param minLength		minimum alignment length
     * @param uniqueInputs	number of unique DNA sequences that were translated (0 if unknown)
     */
    public HitStatistics(Collection<ValidationHit> hits, TargetSet targets, int minLength, int uniqueInputs) {
        this.matchedTargets = new TreeSet<String>();
        Set<String> frames = new HashSet<String>();
        Set<String> sources = new HashSet<String>();
        int perfect = 0;
        int high = 0;
        for (ValidationHit hit : hits) {
            this.matchedTargets.add(hit.getCanonicalSubject());
            frames.add(hit.getQueryId());
            sources.add(FrameTranslator.sourceId(hit.getQueryId()));
            if (hit.getLength() >= minLength) {
                if (hit.getPercentIdentity() == PERFECT_IDENTITY)
                    perfect++;
                if (hit.getPercentIdentity() >= HIGH_IDENTITY)
                    high++;
            }
        }
        this.originalMatched = new TreeSet<String>();
        this.newlyDiscovered = new TreeSet<String>();
        for (String target : this.matchedTargets) {
            if (targets.contains(target))
                this.originalMatched.add(target);
            else
                this.newlyDiscovered.add(target);
        }
        this.framesWithHits = frames.size();
        this.sequencesWithHits = sources.size();
        this.framesSearched = FrameTranslator.FRAMES.length * uniqueInputs;
        this.hitCount = hits.size();
        this.perfectHits = perfect;
        this.highQualityHits = high;
    }

    /**
     * @return the canonical IDs of all targets with accepted hits
     */
    public SortedSet<String> getMatchedTargets() {
        return Collections.unmodifiableSortedSet(this.matchedTargets);
    }

    /**
     * @return the matched IDs that were in the original target set
     */
    public SortedSet<String> getOriginalMatched() {
        return Collections.unmodifiableSortedSet(this.originalMatched);
    }

    /**
     * @return the matched IDs that were not in the original target set
     */
    public SortedSet<String> getNewlyDiscovered() {
        return Collections.unmodifiableSortedSet(this.newlyDiscovered);
    }

    /**
     * @return the number of translated frames with at least one accepted hit
     */
    public int getFramesWithHits() {
        return this.framesWithHits;
    }

    /**
     * @return the number of source DNA sequences with at least one accepted hit
     */
    public int getSequencesWithHits() {
        return this.sequencesWithHits;
    }

    /**
     * @return the number of frames searched
     */
    public int getFramesSearched() {
        return this.framesSearched;
    }

    /**
     * @return the number of accepted hits
     */
    public int getHitCount() {
        return this.hitCount;
    }

    /**
     * @return the number of accepted hits with 100% identity
     */
    public int getPerfectHits() {
        return this.perfectHits;
    }

    /**
     * @return the number of accepted hits with at least 95% identity
     */
    public int getHighQualityHits() {
        return this.highQualityHits;
    }

}
