/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;
import org.pepextract.utils.ConfigurationException;

/**
 * This is an immutable set of canonical target IDs.  The canonical form of an ID is the portion before the first
 * vertical bar, so "UniRef50_A0A017|tax" and "UniRef50_A0A017" are the same target.
 *
 * @author Bruce Parrello
 *
 */
public class TargetSet implements Iterable<String> {

    // FIELDS
    /** canonical IDs in the set */
    private final Set<String> ids;

    /** delimiter before an ID suffix */
    public static final String SUFFIX_DELIM = "|";

    /**
     * Create a target set from a collection of IDs.  The IDs are canonicalized.
     *
     * @param rawIds	IDs to put in the set
     */
    public TargetSet(Collection<String> rawIds) {
        Set<String> idSet = new HashSet<String>(rawIds.size() * 4 / 3 + 1);
        for (String rawId : rawIds) {
            String id = canonical(rawId);
            if (! id.isEmpty())
                idSet.add(id);
        }
        this.ids = Collections.unmodifiableSet(idSet);
    }

    /**
     * Load a target set from a file containing one ID per line.  Blank lines are skipped.
     *
     * @param inFile	file of target IDs
     *
     * @return the target set
     *
     * @throws ConfigurationException if the file is missing or unreadable
     */
    public static TargetSet load(File inFile) throws ConfigurationException {
        if (inFile == null || ! inFile.isFile() || ! inFile.canRead())
            throw new ConfigurationException("Targets file " + inFile + " is not found or unreadable.");
        Set<String> rawIds = new HashSet<String>();
        try (LineIterator iter = FileUtils.lineIterator(inFile, StandardCharsets.UTF_8.name())) {
            while (iter.hasNext())
                rawIds.add(iter.next());
        } catch (IOException e) {
            throw new ConfigurationException("Error reading targets file " + inFile + ": " + e.getMessage(), e);
        }
        return new TargetSet(rawIds);
    }

    /**
     * @return the canonical form of an ID
     *
     * @param id	ID to convert
     */
    public static String canonical(String id) {
        return StringUtils.strip(StringUtils.substringBefore(id, SUFFIX_DELIM));
    }

    /**
     * @return TRUE if the specified canonical ID is in the set
     *
     * @param id	canonical ID to check
     */
    public boolean contains(String id) {
        return this.ids.contains(id);
    }

    /**
     * @return the number of IDs in the set
     */
    public int size() {
        return this.ids.size();
    }

    /**
     * @return TRUE if the set is empty
     */
    public boolean isEmpty() {
        return this.ids.isEmpty();
    }

    @Override
    public Iterator<String> iterator() {
        return this.ids.iterator();
    }

}
