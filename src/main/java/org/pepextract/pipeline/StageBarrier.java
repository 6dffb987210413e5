/**
 *
 */
package org.pepextract.pipeline;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeoutException;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object waits for every unit of a stage to reach a terminal state.  It polls the completion record store;
 * there is no limit on the wait other than the one supplied by the caller.
 *
 * @author Bruce Parrello
 *
 */
public class StageBarrier {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(StageBarrier.class);
    /** completion record store */
    private final CompletionRecordStore store;
    /** stage being waited on */
    private final String stage;
    /** units expected to finish */
    private final List<String> units;

    /** maximum number of unit IDs to list in a message */
    private static final int MAX_LISTED = 10;

    /**
     * Construct a barrier.
     *
     * @param store		completion record store
     * @param stage		stage identifier
     * @param units		IDs of the units that must finish
     */
    public StageBarrier(CompletionRecordStore store, String stage, Collection<String> units) {
        this.store = store;
        this.stage = stage;
        this.units = new ArrayList<String>(units);
    }

    /**
     * @return TRUE if every expected unit has a terminal record
     *
     * @throws IOException
     */
    public boolean isOpen() throws IOException {
        return this.store.isTerminal(this.stage, this.units);
    }

    /**
     * Wait for every expected unit to finish.
     *
     * @param pollInterval	time between checks
     * @param timeout		maximum time to wait; zero means check once
     *
     * @throws TimeoutException if the timeout expires with units unfinished
     * @throws InterruptedException
     * @throws IOException
     */
    public void await(Duration pollInterval, Duration timeout) throws TimeoutException, InterruptedException, IOException {
        final long start = System.currentTimeMillis();
        final long limit = start + timeout.toMillis();
        List<String> unfinished = this.store.getUnfinished(this.stage, this.units);
        int lastCount = -1;
        while (! unfinished.isEmpty()) {
            long now = System.currentTimeMillis();
            if (now >= limit)
                throw new TimeoutException(unfinished.size() + " of " + this.units.size() + " " + this.stage
                        + " units have not finished: " + describe(unfinished) + ".");
            if (unfinished.size() != lastCount) {
                log.info("Waiting for {} of {} {} units to finish.", unfinished.size(), this.units.size(), this.stage);
                lastCount = unfinished.size();
            }
            Thread.sleep(Math.min(pollInterval.toMillis(), limit - now));
            unfinished = this.store.getUnfinished(this.stage, this.units);
        }
        log.info("All {} {} units have finished.", this.units.size(), this.stage);
    }

    /**
     * @return a printable list of unit IDs, abbreviated if it is long
     *
     * @param ids	list of unit IDs
     */
    private static String describe(List<String> ids) {
        String retVal;
        if (ids.size() <= MAX_LISTED)
            retVal = StringUtils.join(ids, ", ");
        else
            retVal = StringUtils.join(ids.subList(0, MAX_LISTED), ", ") + ", ...";
        return retVal;
    }

}
