/**
 *
 */
package org.pepextract.sequence.validate;

import java.util.List;
import java.util.stream.Collectors;

import org.pepextract.pipeline.TargetSet;

/**
 * This object filters validation hits.  A hit is accepted if its canonical subject ID is in the target set, its
 * percent identity is at least the cutoff, and its alignment length is at least the minimum.  Filtering has no
 * side effects and preserves the order of the input.
 *
 * @author Bruce Parrello
 *
 */
public class HitFilter {

    // FIELDS
    /** target IDs of interest */
    private final TargetSet targets;
    /** minimum percent identity */
    private final double minIdentity;
    /** minimum alignment length */
    private final int minLength;

    /**
     * Construct a hit filter.
     *
     * @param targets		target ID set
     * @param minIdentity	minimum percent identity (0 to 100)
     * @param minLength		minimum alignment length (at least 1)
     */
    public HitFilter(TargetSet targets, double minIdentity, int minLength) {
        if (minIdentity < 0.0 || minIdentity > 100.0)
            throw new IllegalArgumentException("Percent identity cutoff must be between 0 and 100.");
        if (minLength < 1)
            throw new IllegalArgumentException("Minimum length must be a positive integer.");
        this.targets = targets;
        this.minIdentity = minIdentity;
        this.minLength = minLength;
    }

    /**
     * @return TRUE if the specified hit is acceptable
     *
     * @param hit	hit to check
     */
    public boolean accept(ValidationHit hit) {
        return this.targets.contains(hit.getCanonicalSubject()) && hit.getPercentIdentity() >= this.minIdentity
                && hit.getLength() >= this.minLength;
    }

    /**
     * @return the acceptable hits from a list, in their original order
     *
     * @param hits	list of hits to filter
     */
    public List<ValidationHit> filter(List<ValidationHit> hits) {
        return hits.stream().filter(x -> this.accept(x)).collect(Collectors.toList());
    }

    /**
     * @return the minimum percent identity
     */
    public double getMinIdentity() {
        return this.minIdentity;
    }

    /**
     * @return the minimum alignment length
     */
    public int getMinLength() {
        return this.minLength;
    }

}
