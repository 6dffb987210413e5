/**
 *
 */
package org.pepextract.sequence;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

import org.apache.commons.lang3.StringUtils;

/**
 * This class iterates through the reads in a FASTQ file.  Each read is four lines: a header beginning with "@",
 * the sequence, a separator line beginning with "+", and the quality string.  The quality is discarded.  If the
 * file name ends in ".gz" it is decompressed on the fly.
 *
 * @author Bruce Parrello
 *
 */
public class FastqInputStream implements Iterable<Sequence>, Iterator<Sequence>, Closeable, AutoCloseable {

    // FIELDS
    /** underlying reader */
    private final BufferedReader reader;
    /** input file, for error messages */
    private final File inFile;
    /** next header line, or NULL at end-of-file */
    private String nextHeader;

    /**
     * Open a FASTQ file for input.
     *
     * @param inFile	file to read
     *
     * @throws IOException
     */
    public FastqInputStream(File inFile) throws IOException {
        this.inFile = inFile;
        InputStream byteStream = new FileInputStream(inFile);
        InputStream dataStream;
        if (inFile.getName().endsWith(".gz"))
            dataStream = new GZIPInputStream(byteStream);
        else
            dataStream = byteStream;
        this.reader = new BufferedReader(new InputStreamReader(dataStream, StandardCharsets.UTF_8));
        this.nextHeader = this.skipBlank();
    }

    /**
     * @return the next non-blank line, or NULL at end-of-file
     *
     * @throws IOException
     */
    private String skipBlank() throws IOException {
        String retVal = this.reader.readLine();
        while (retVal != null && retVal.isBlank())
            retVal = this.reader.readLine();
        return retVal;
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
            throw new NoSuchElementException("Attempt to read past end of " + this.inFile + ".");
        try {
            if (! this.nextHeader.startsWith("@"))
                throw new IOException("Invalid FASTQ header \"" + this.nextHeader + "\" in " + this.inFile + ".");
            String header = StringUtils.strip(this.nextHeader.substring(1));
            String sequence = this.reader.readLine();
            String marker = this.reader.readLine();
            String quality = this.reader.readLine();
            if (sequence == null || marker == null || quality == null)
                throw new IOException("Truncated FASTQ record " + header + " in " + this.inFile + ".");
            this.nextHeader = this.skipBlank();
            return new Sequence(StringUtils.substringBefore(header, " "),
                    StringUtils.strip(StringUtils.substringAfter(header, " ")), StringUtils.strip(sequence));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() {
        try {
            this.reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
