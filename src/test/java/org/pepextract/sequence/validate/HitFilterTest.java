/**
 *
 */
package org.pepextract.sequence.validate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.pepextract.pipeline.TargetSet;
import org.pepextract.utils.ConfigurationException;

import junit.framework.TestCase;

/**
 * Test the hit filter and the hit statistics.
 *
 * @author Bruce Parrello
 *
 */
public class HitFilterTest extends TestCase {

    /**
     * @return the query IDs of a list of hits
     *
     * @param hits	hits to scan
     */
    private static List<String> queries(List<ValidationHit> hits) {
        return hits.stream().map(x -> x.getQueryId()).collect(Collectors.toList());
    }

    /**
     * test the basic filter rules
     */
    public void testFilter() {
        TargetSet targets = new TargetSet(Arrays.asList("X1"));
        List<ValidationHit> hits = Arrays.asList(new ValidationHit("q1", "X1|foo", 100.0, 50, 1e-20, 90.0),
                new ValidationHit("q2", "X1|foo", 80.0, 50, 1e-10, 50.0));
        HitFilter filter = new HitFilter(targets, 90.0, 7);
        List<ValidationHit> accepted = filter.filter(hits);
        assertThat(queries(accepted), contains("q1"));
        HitStatistics stats = new HitStatistics(accepted, targets, 7, 1);
        assertThat(stats.getMatchedTargets(), contains("X1"));
        assertThat(stats.getOriginalMatched(), contains("X1"));
        assertThat(stats.getNewlyDiscovered(), empty());
        // Boundary values are accepted.
        assertTrue(filter.accept(new ValidationHit("q3", "X1", 90.0, 7, 1.0, 1.0)));
        assertFalse(filter.accept(new ValidationHit("q4", "X1", 89.99, 7, 1.0, 1.0)));
        assertFalse(filter.accept(new ValidationHit("q5", "X1", 95.0, 6, 1.0, 1.0)));
        assertFalse(filter.accept(new ValidationHit("q6", "X10|X1", 95.0, 60, 1.0, 1.0)));
        assertThat(filter.getMinIdentity(), equalTo(90.0));
        assertThat(filter.getMinLength(), equalTo(7));
    }

    /**
     * test filtering the hits in a file
     *
     * @throws IOException
     * @throws ConfigurationException
     */
    public void testFileFilter() throws IOException, ConfigurationException {
        TargetSet targets = TargetSet.load(new File("data", "targets.txt"));
        List<ValidationHit> hits = ValidationHitFile.read(new File("data", "hits.tsv"));
        assertThat(hits.size(), equalTo(5));
        assertThat(ValidationHitFile.count(new File("data", "hits.tsv")), equalTo(5));
        HitFilter filter = new HitFilter(targets, 90.0, 7);
        List<ValidationHit> accepted = filter.filter(hits);
        assertThat(queries(accepted), contains("q1_frame=1", "q1_frame=2"));
        // Every accepted hit satisfies the rules, and filtering again changes nothing.
        for (ValidationHit hit : accepted) {
            assertTrue(targets.contains(hit.getCanonicalSubject()));
            assertThat(hit.getPercentIdentity(), greaterThanOrEqualTo(90.0));
            assertThat(hit.getLength(), greaterThanOrEqualTo(7));
        }
        assertThat(filter.filter(accepted), equalTo(accepted));
        HitStatistics stats = new HitStatistics(accepted, targets, 7, 4);
        assertThat(stats.getMatchedTargets(), contains("X1", "X2"));
        assertThat(stats.getNewlyDiscovered(), empty());
        assertThat(stats.getFramesWithHits(), equalTo(2));
        assertThat(stats.getSequencesWithHits(), equalTo(1));
        assertThat(stats.getPerfectHits(), equalTo(1));
        assertThat(stats.getHighQualityHits(), equalTo(2));
    }

    /**
     * test statistics on unfiltered hits
     *
     * @throws IOException
     * @throws ConfigurationException
     */
    public void testStatistics() throws IOException, ConfigurationException {
        TargetSet targets = TargetSet.load(new File("data", "targets.txt"));
        List<ValidationHit> hits = ValidationHitFile.read(new File("data", "hits.tsv"));
        HitStatistics stats = new HitStatistics(hits, targets, 7, 4);
        assertThat(stats.getMatchedTargets(), contains("X1", "X2", "Z7"));
        assertThat(stats.getOriginalMatched(), contains("X1", "X2"));
        assertThat(stats.getNewlyDiscovered(), contains("Z7"));
        assertThat(stats.getFramesWithHits(), equalTo(5));
        assertThat(stats.getSequencesWithHits(), equalTo(4));
        assertThat(stats.getFramesSearched(), equalTo(24));
        assertThat(stats.getHitCount(), equalTo(5));
        assertThat(stats.getPerfectHits(), equalTo(1));
        assertThat(stats.getHighQualityHits(), equalTo(3));
    }

    /**
     * test invalid thresholds
     */
    public void testThresholds() {
        TargetSet targets = new TargetSet(Arrays.asList("X1"));
        try {
            new HitFilter(targets, 101.0, 7);
            fail("Invalid identity accepted.");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("identity"));
        }
        try {
            new HitFilter(targets, 90.0, 0);
            fail("Invalid length accepted.");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("length"));
        }
    }

}
