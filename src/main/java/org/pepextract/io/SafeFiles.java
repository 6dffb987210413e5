/**
 *
 */
package org.pepextract.io;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

/**
 * Utilities for publishing output files atomically.  Output is written to a temporary file in the same
 * directory as the target and then moved into place, so a reader never sees a partially-written file.
 *
 * @author Bruce Parrello
 *
 */
public class SafeFiles {

    /** suffix for in-progress files */
    public static final String TEMP_SUFFIX = ".partial";

    /**
     * @return the in-progress file to use when writing the specified target
     *
     * @param target	file that will eventually hold the output
     */
    public static File tempFor(File target) {
        return new File(target.getParentFile(), "." + target.getName() + TEMP_SUFFIX);
    }

    /**
     * Move a completed temporary file over its target.
     *
     * @param temp		completed temporary file
     * @param target	target file
     *
     * @throws IOException
     */
    public static void commit(File temp, File target) throws IOException {
        try {
            Files.move(temp.toPath(), target.toPath(), StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            // Fall back to a plain rename where atomic moves are unsupported.
            Files.move(temp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * @return TRUE if the specified file exists and is non-empty
     *
     * @param file	file to check
     */
    public static boolean isNonEmpty(File file) {
        return file != null && file.isFile() && file.length() > 0;
    }

}
