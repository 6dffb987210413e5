/**
 *
 */
package org.pepextract.reports;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.pepextract.pipeline.CompletionRecord;

/**
 * This report lists the completion records for a stage in a tab-delimited table.  There is one row per unit.  The
 * first column is the unit ID, and the remaining columns are every field found in any of the records, in the order
 * they were first seen.  A field missing from a record is shown as "NA".
 *
 * @author Bruce Parrello
 *
 */
public class SummaryTableReporter extends BaseReporter {

    /** value displayed for a missing field */
    public static final String NOT_AVAILABLE = "NA";
    /** heading for the unit column */
    public static final String UNIT_COLUMN = CompletionRecord.SAMPLE;

    public SummaryTableReporter(OutputStream output) {
        super(output);
    }

    public SummaryTableReporter(PrintWriter writer) {
        super(writer);
    }

    /**
     * @return the column names for a set of records, excluding the unit column
     *
     * @param records	records to be listed
     */
    public static List<String> computeColumns(Collection<CompletionRecord> records) {
        Set<String> retVal = new LinkedHashSet<String>();
        for (CompletionRecord record : records)
            retVal.addAll(record.getFields().keySet());
        retVal.remove(UNIT_COLUMN);
        return new ArrayList<String>(retVal);
    }

    /**
     * Write the table.
     *
     * @param records	records to list, in output order
     */
    public void write(Collection<CompletionRecord> records) {
        List<String> columns = computeColumns(records);
        StringBuilder line = new StringBuilder(200);
        line.append(UNIT_COLUMN);
        for (String column : columns)
            line.append('\t').append(column);
        this.println(line.toString());
        for (CompletionRecord record : records) {
            line.setLength(0);
            line.append(record.getUnit() == null ? NOT_AVAILABLE : record.getUnit());
            for (String column : columns) {
                String value = record.get(column);
                line.append('\t').append(value == null || value.isEmpty() ? NOT_AVAILABLE : value);
            }
            this.println(line.toString());
        }
    }

}
