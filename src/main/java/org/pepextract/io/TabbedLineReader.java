/**
 *
 */
package org.pepextract.io;

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
 * This class reads a tab-delimited file one line at a time.  The file can have a header line, in which case the
 * field names can be used to find column indices, or it can be headerless with a fixed minimum number of columns.
 * Blank lines and lines beginning with "#" are skipped in headerless mode.
 *
 * @author Bruce Parrello
 *
 */
public class TabbedLineReader implements Iterable<TabbedLineReader.Line>, Iterator<TabbedLineReader.Line>, Closeable, AutoCloseable {

    // FIELDS
    /** underlying reader */
    private final BufferedReader reader;
    /** input file name, for error messages */
    private final String name;
    /** header labels (empty if headerless) */
    private final String[] labels;
    /** minimum number of fields per line */
    private final int minFields;
    /** next line to return, or NULL at end-of-file */
    private Line nextLine;
    /** number of the last line read */
    private int lineNum;

    /**
     * This object represents one data line of the file.
     */
    public class Line {

        /** original text of the line */
        private final String text;
        /** fields in the line */
        private final String[] fields;
        /** line number in the file */
        private final int num;

        protected Line(String text, int num) {
            this.text = text;
            this.fields = StringUtils.splitPreserveAllTokens(text, '\t');
            this.num = num;
        }

        /**
         * @return the original text of the line, without the line terminator
         */
        public String getText() {
            return this.text;
        }

        /**
         * @return the string in the specified column (empty if the column is past the end of the line)
         *
         * @param idx	index (0-based) of the desired column
         */
        public String get(int idx) {
            return (idx < this.fields.length ? this.fields[idx] : "");
        }

        /**
         * @return the integer in the specified column
         *
         * @param idx	index (0-based) of the desired column
         *
         * @throws IOException if the column is not numeric
         */
        public int getInt(int idx) throws IOException {
            try {
                return Integer.parseInt(this.get(idx).trim());
            } catch (NumberFormatException e) {
                throw new IOException("Invalid integer \"" + this.get(idx) + "\" in line " + this.num + " of " + TabbedLineReader.this.name + ".");
            }
        }

        /**
         * @return the floating-point number in the specified column
         *
         * @param idx	index (0-based) of the desired column
         *
         * @throws IOException if the column is not numeric
         */
        public double getDouble(int idx) throws IOException {
            try {
                return Double.parseDouble(this.get(idx).trim());
            } catch (NumberFormatException e) {
                throw new IOException("Invalid number \"" + this.get(idx) + "\" in line " + this.num + " of " + TabbedLineReader.this.name + ".");
            }
        }

        /**
         * @return the number of fields in this line
         */
        public int size() {
            return this.fields.length;
        }

        /**
         * @return the line number of this line in the file
         */
        public int getLineNum() {
            return this.num;
        }

    }

    /**
     * Open a tab-delimited file with a header line.
     *
     * @param inFile	file to read
     *
     * @throws IOException
     */
    public TabbedLineReader(File inFile) throws IOException {
        this.reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8);
        this.name = inFile.toString();
        this.minFields = 0;
        String header = this.reader.readLine();
        if (header == null)
            throw new IOException("File " + inFile + " is empty.");
        this.labels = StringUtils.splitPreserveAllTokens(header, '\t');
        this.lineNum = 1;
        this.readAhead();
    }

    /**
     * Open a headerless tab-delimited file.  Lines with too few fields are skipped.
     *
     * @param inFile	file to read
     * @param fields	minimum number of fields required in a data line
     *
     * @throws IOException
     */
    public TabbedLineReader(File inFile, int fields) throws IOException {
        this.reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8);
        this.name = inFile.toString();
        this.minFields = fields;
        this.labels = new String[0];
        this.lineNum = 0;
        this.readAhead();
    }

    /**
     * Read the next acceptable line into the look-ahead buffer.
     */
    private void readAhead() {
        this.nextLine = null;
        try {
            String text = this.reader.readLine();
            while (text != null && this.nextLine == null) {
                this.lineNum++;
                if (this.labels.length == 0 && (text.isBlank() || text.startsWith("#")))
                    text = this.reader.readLine();
                else {
                    Line line = new Line(StringUtils.stripEnd(text, "\r"), this.lineNum);
                    if (line.size() < this.minFields)
                        text = this.reader.readLine();
                    else
                        this.nextLine = line;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return the index of the named column
     *
     * @param fieldName		name of the desired column
     *
     * @throws IOException if the column is not found
     */
    public int findField(String fieldName) throws IOException {
        int retVal = -1;
        for (int i = 0; i < this.labels.length && retVal < 0; i++) {
            if (this.labels[i].equals(fieldName))
                retVal = i;
        }
        if (retVal < 0)
            throw new IOException("Field \"" + fieldName + "\" not found in " + this.name + ".");
        return retVal;
    }

    @Override
    public Iterator<Line> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        return this.nextLine != null;
    }

    @Override
    public Line next() {
        if (this.nextLine == null)
            throw new NoSuchElementException("Attempt to read past end of " + this.name + ".");
        Line retVal = this.nextLine;
        this.readAhead();
        return retVal;
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
