/**
 *
 */
package org.pepextract.sequence;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.commons.lang3.StringUtils;

/**
 * This class iterates through the sequences in a FASTA file.  Sequence data can span multiple lines.
 *
 * @author Bruce Parrello
 *
 */
public class FastaInputStream implements Iterable<Sequence>, Iterator<Sequence>, Closeable, AutoCloseable {

    // FIELDS
    /** underlying reader */
    private final BufferedReader reader;
    /** next header line, or NULL at end-of-file */
    private String nextHeader;

    /**
     * Open a FASTA file for input.
     *
     * @param inFile	file to read
     *
     * @throws IOException
     */
    public FastaInputStream(File inFile) throws IOException {
        this.reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8);
        // Skip to the first header.
        String line = this.reader.readLine();
        while (line != null && ! line.startsWith(">"))
            line = this.reader.readLine();
        this.nextHeader = line;
    }

    @Override
    public Iterator<Sequence> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        return this.nextHeader != null;
    }

    @Override
    public Sequence next() {
        if (this.nextHeader == null)
            throw new NoSuchElementException("Attempt to read past end of FASTA file.");
        String header = StringUtils.strip(this.nextHeader.substring(1));
        String label = StringUtils.substringBefore(header, " ");
        String comment = StringUtils.strip(StringUtils.substringAfter(header, " "));
        StringBuilder seq = new StringBuilder(150);
        try {
            String line = this.reader.readLine();
            while (line != null && ! line.startsWith(">")) {
                seq.append(StringUtils.strip(line));
                line = this.reader.readLine();
            }
            this.nextHeader = line;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new Sequence(label, comment, seq.toString());
    }

    @Override
    public void close() {
        try {
            this.reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Count the sequences in a FASTA file.  A missing file has no sequences.
     *
     * @param inFile	FASTA file to scan
     *
     * @return the number of header lines in the file
     *
     * @throws IOException
     */
    public static int count(File inFile) throws IOException {
        int retVal = 0;
        if (inFile.isFile()) {
            try (BufferedReader counter = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8)) {
                String line = counter.readLine();
                while (line != null) {
                    if (line.startsWith(">"))
                        retVal++;
                    line = counter.readLine();
                }
            }
        }
        return retVal;
    }

}
