/**
 *
 */
package org.pepextract.sequence.validate;

import java.io.File;
import java.io.IOException;

import org.pepextract.utils.DownstreamToolException;

/**
 * This interface describes a validation engine.  The engine searches translated protein sequences against a
 * reference database and writes one hit per line in the six-column format read by {@link ValidationHitFile}.
 * The output is ordered by query, then by the engine's internal ranking.
 *
 * @author Bruce Parrello
 *
 */
public interface ValidationEngine {

    /**
     * Search the query sequences against the reference database.
     *
     * @param queryFile		protein FASTA file of query sequences
     * @param outFile		output file for the hits
     * @param parms			search parameters
     *
     * @return the number of hits written
     *
     * @throws IOException
     * @throws DownstreamToolException
     */
    int search(File queryFile, File outFile, ValidationParms parms) throws IOException, DownstreamToolException;

}
