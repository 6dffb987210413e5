/**
 *
 */
package org.pepextract.sequence;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collection;

/**
 * This class writes sequences to a FASTA file.  Each sequence is written on a single line after its header.
 *
 * @author Bruce Parrello
 *
 */
public class FastaOutputStream implements Closeable, AutoCloseable {

    // FIELDS
    /** underlying writer */
    private final BufferedWriter writer;
    /** number of sequences written */
    private int count;

    /**
     * Open a FASTA file for output.
     *
     * @param outFile	file to write
     *
     * @throws IOException
     */
    public FastaOutputStream(File outFile) throws IOException {
        this.writer = Files.newBufferedWriter(outFile.toPath(), StandardCharsets.UTF_8);
        this.count = 0;
    }

    /**
     * Create a FASTA output stream on an open output stream.
     *
     * @param outStream		target output stream
     */
    public FastaOutputStream(OutputStream outStream) {
        this.writer = new BufferedWriter(new OutputStreamWriter(outStream, StandardCharsets.UTF_8));
        this.count = 0;
    }

    /**
     * Write a sequence.
     *
     * @param seq	sequence to write
     *
     * @throws IOException
     */
    public void write(Sequence seq) throws IOException {
        this.writer.write('>');
        this.writer.write(seq.getLabel());
        if (! seq.getComment().isEmpty()) {
            this.writer.write(' ');
            this.writer.write(seq.getComment());
        }
        this.writer.write('\n');
        this.writer.write(seq.getSequence());
        this.writer.write('\n');
        this.count++;
    }

    /**
     * Write a collection of sequences.
     *
     * @param seqs	sequences to write
     *
     * @throws IOException
     */
    public void write(Collection<Sequence> seqs) throws IOException {
        for (Sequence seq : seqs)
            this.write(seq);
    }

    /**
     * @return the number of sequences written
     */
    public int getCount() {
        return this.count;
    }

    @Override
    public void close() {
        try {
            this.writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
