/**
 *
 */
package org.pepextract.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * This object is a durable status record for a completed unit of work.  A unit is either one sample within a stage
 * or the stage as a whole.  The record is a list of "KEY: value" lines, so it can be read by a person or parsed by
 * the next stage.  Every record has a STAGE and a STATUS line, and a SAMPLE line if it belongs to a sample.
 *
 * Records are immutable; use a {@link Builder} to create one.
 *
 * @author Bruce Parrello
 *
 */
public class CompletionRecord {

    // FIELDS
    /** stage identifier */
    private final String stage;
    /** unit identifier (sample ID), or NULL for a stage-level record */
    private final String unit;
    /** terminal status */
    private final CompletionStatus status;
    /** all the fields, in output order */
    private final Map<String, String> fields;

    /** key for the stage identifier */
    public static final String STAGE = "STAGE";
    /** key for the sample ID */
    public static final String SAMPLE = "SAMPLE";
    /** key for the status */
    public static final String STATUS = "STATUS";

    /**
     * This class is used to build a completion record.
     */
    public static class Builder {

        /** stage identifier */
        private final String stage;
        /** unit identifier */
        private final String unit;
        /** terminal status */
        private final CompletionStatus status;
        /** fields other than the identifying ones */
        private final Map<String, String> fields;

        /**
         * Start building a completion record.
         *
         * @param stage		stage identifier
         * @param unit		sample ID, or NULL for a stage-level record
         * @param status	terminal status
         */
        public Builder(String stage, String unit, CompletionStatus status) {
            this.stage = stage;
            this.unit = unit;
            this.status = status;
            this.fields = new LinkedHashMap<String, String>();
        }

        /**
         * Add a field to the record.
         *
         * @param key		field name
         * @param value		field value
         */
        public Builder put(String key, Object value) {
            if (key.equals(STAGE) || key.equals(SAMPLE) || key.equals(STATUS) || key.contains(":"))
                throw new IllegalArgumentException("Invalid completion record key \"" + key + "\".");
            // Values are single-line.
            String text = StringUtils.normalizeSpace(String.valueOf(value));
            this.fields.put(key, text);
            return this;
        }

        /**
         * @return the completed record
         */
        public CompletionRecord build() {
            Map<String, String> allFields = new LinkedHashMap<String, String>();
            allFields.put(STAGE, this.stage);
            if (this.unit != null)
                allFields.put(SAMPLE, this.unit);
            allFields.put(STATUS, this.status.name());
            allFields.putAll(this.fields);
            return new CompletionRecord(this.stage, this.unit, this.status, allFields);
        }

    }

    /**
     * Construct a completion record.
     *
     * @param stage		stage identifier
     * @param unit		unit identifier (or NULL)
     * @param status	terminal status
     * @param fields	all fields, in order
     */
    private CompletionRecord(String stage, String unit, CompletionStatus status, Map<String, String> fields) {
        this.stage = stage;
        this.unit = unit;
        this.status = status;
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Parse a completion record from its text lines.  A record with a line that is not a key-value pair, with no
     * stage or status, or with an unknown status is treated as incomplete.
     *
     * @param lines		lines of the record
     *
     * @return the record, or an empty result if the record is malformed
     */
    public static Optional<CompletionRecord> parse(List<String> lines) {
        Map<String, String> fields = new LinkedHashMap<String, String>();
        boolean valid = true;
        for (int i = 0; valid && i < lines.size(); i++) {
            String line = lines.get(i);
            if (! line.isBlank()) {
                int colon = line.indexOf(':');
                if (colon <= 0)
                    valid = false;
                else
                    fields.put(line.substring(0, colon).strip(), line.substring(colon + 1).strip());
            }
        }
        Optional<CompletionRecord> retVal = Optional.empty();
        if (valid) {
            String stage = fields.get(STAGE);
            String statusName = fields.get(STATUS);
            if (! StringUtils.isBlank(stage) && statusName != null) {
                try {
                    CompletionStatus status = CompletionStatus.valueOf(statusName);
                    retVal = Optional.of(new CompletionRecord(stage, fields.get(SAMPLE), status, fields));
                } catch (IllegalArgumentException e) {
                    // An unknown status means this is not a terminal record.
                    retVal = Optional.empty();
                }
            }
        }
        return retVal;
    }

    /**
     * @return the record as a list of text lines
     */
    public List<String> toLines() {
        List<String> retVal = new ArrayList<String>(this.fields.size());
        for (Map.Entry<String, String> field : this.fields.entrySet())
            retVal.add(field.getKey() + ": " + field.getValue());
        return retVal;
    }

    /**
     * @return the stage identifier
     */
    public String getStage() {
        return this.stage;
    }

    /**
     * @return the unit identifier, or NULL for a stage-level record
     */
    public String getUnit() {
        return this.unit;
    }

    /**
     * @return the terminal status
     */
    public CompletionStatus getStatus() {
        return this.status;
    }

    /**
     * @return the value of a field, or NULL if it is not present
     *
     * @param key	name of the field
     */
    public String get(String key) {
        return this.fields.get(key);
    }

    /**
     * @return the integer value of a field, or 0 if it is not present or not numeric
     *
     * @param key	name of the field
     */
    public int getInt(String key) {
        return NumberUtils.toInt(this.fields.get(key), 0);
    }

    /**
     * @return all the fields of the record, in order
     */
    public Map<String, String> getFields() {
        return this.fields;
    }

    @Override
    public String toString() {
        return this.stage + (this.unit == null ? "" : "/" + this.unit) + ": " + this.status;
    }

}
