///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The header of an HDU: an ordered sequence of 80-character records.
 * <p>
 * Instances of this class are immutable. A header is built with a {@link Header.Builder}, which terminates it with an
 * END record and pads it to a whole number of blocks when it is sealed:
 * </p>
 * <pre>
 * Header header = Header.builder().
 *     add(HeaderRecord.logical("SIMPLE", true, "file does conform to FITS standard")).
 *     add(HeaderRecord.integer("BITPIX", 8, "number of bits per data pixel")).
 *     add(HeaderRecord.integer("NAXIS", 0, "number of data axes")).
 *     seal();
 * </pre>
 * <p>
 * A header that is read from a file is taken as it is, so that it can be validated.
 * </p>
 */
public final class Header {

    private final List<String> records;

    /**
     * A builder class for {@link Header}.  Records are appended in order; {@link #seal()} completes the header.
     */
    public static final class Builder {
        private List<String> records;

        private Builder() {
            records = new ArrayList<>();
        }

        private void checkNotSealed() {
            if (records == null) {
                throw new IllegalStateException("header has already been sealed");
            }
        }

        /**
         * Appends a record.
         *
         * @param record
         *     The record, typically created by one of the {@link HeaderRecord} methods.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code record} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code record} is not 80 characters of ASCII text or if it is an END record.
         * @throws IllegalStateException
         *     if this builder has already been sealed.
         */
        public Builder add(String record) {
            ArgumentUtil.checkNotNull(record, "record");
            checkNotSealed();
            if (record.length() != HeaderRecord.LENGTH || !ArgumentUtil.isAsciiText(record)) {
                throw new IllegalArgumentException("record must be 80 characters of ASCII text");
            }
            if (record.equals(HeaderRecord.END)) {
                throw new IllegalArgumentException("the END record is added when the header is sealed");
            }
            records.add(record);
            return this;
        }

        /**
         * Completes the header by appending the END record and enough blank records to fill the last block.
         * <p>
         * This builder cannot be used after it has been sealed.
         * </p>
         *
         * @return The header. Its number of records is a multiple of 36.
         *
         * @throws IllegalStateException
         *     if this builder has already been sealed.
         */
        public Header seal() {
            checkNotSealed();
            records.add(HeaderRecord.END);
            while (records.size() % BlockAddressing.RECORDS_PER_BLOCK != 0) {
                records.add(HeaderRecord.BLANK);
            }

            Header header = new Header(records);
            records = null;
            return header;
        }
    }

    private Header(List<String> records) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    /**
     * Creates a builder for a header.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a header from records exactly as they were read, without enforcing any invariant.
     *
     * @param records
     *     The records.
     *
     * @return The header.
     *
     * @throws NullPointerException
     *     if {@code records} is {@code null} or contains {@code null}.
     */
    public static Header of(List<String> records) {
        ArgumentUtil.checkNotNull(records, "records");
        for (String record : records) {
            if (record == null) {
                throw new NullPointerException("records must not contain null");
            }
        }
        return new Header(records);
    }

    /**
     * Gets the records of this header, including the END record and the blank records that follow it.
     *
     * @return An unmodifiable list of records.
     */
    public List<String> records() {
        return records;
    }

    /**
     * Gets the number of records in this header.
     *
     * @return The number of records.
     */
    public int size() {
        return records.size();
    }

    /**
     * Gets the keyword of a record.
     *
     * @param index
     *     The 0-based index of the record.
     *
     * @return The keyword, without trailing spaces.
     */
    public String keyword(int index) {
        return HeaderRecord.keyword(records.get(index));
    }

    /**
     * Gets the index of the first record with a given keyword that comes before the END record.
     *
     * @param keyword
     *     The keyword to find.
     *
     * @return The 0-based index, or -1 if there is no such record.
     */
    public int indexOf(String keyword) {
        for (int i = 0; i < records.size(); i++) {
            String recordKeyword = keyword(i);
            if (recordKeyword.equals(keyword)) {
                return i;
            }
            if (recordKeyword.equals("END")) {
                break;
            }
        }
        return -1;
    }

    /**
     * Gets the parsed value of the first record with a given keyword.
     *
     * @param keyword
     *     The keyword to find.
     *
     * @return The value as returned by {@link HeaderRecord#value}, or {@code null} if there is no such record.
     *
     * @throws FitsFormatException
     *     if the value cannot be parsed.
     */
    public Object value(String keyword) throws FitsFormatException {
        int index = indexOf(keyword);
        return index < 0 ? null : HeaderRecord.value(records.get(index));
    }

    /**
     * Gets the value of a mandatory integer keyword.
     *
     * @param keyword
     *     The keyword to find.
     *
     * @return The value.
     *
     * @throws FitsFormatException
     *     if there is no such record or if its value is not an integer that fits in a {@code long}.
     */
    public long integerValue(String keyword) throws FitsFormatException {
        Object value = value(keyword);
        if (!(value instanceof Long)) {
            throw new FitsFormatException("header has no integer value for keyword " + keyword);
        }
        return (Long) value;
    }

    /**
     * Gets the value of an optional numeric keyword.
     *
     * @param keyword
     *     The keyword to find.
     * @param defaultValue
     *     The value to return if the keyword is absent.
     *
     * @return The value.
     *
     * @throws FitsFormatException
     *     if the record's value is not a number.
     */
    public BigDecimal decimalValue(String keyword, BigDecimal defaultValue) throws FitsFormatException {
        Object value = value(keyword);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        throw new FitsFormatException("header has no numeric value for keyword " + keyword);
    }

    /**
     * Gets the value of a mandatory string keyword.
     *
     * @param keyword
     *     The keyword to find.
     *
     * @return The value, without trailing spaces.
     *
     * @throws FitsFormatException
     *     if there is no such record or if its value is not a string.
     */
    public String stringValue(String keyword) throws FitsFormatException {
        Object value = value(keyword);
        if (!(value instanceof String)) {
            throw new FitsFormatException("header has no string value for keyword " + keyword);
        }
        return (String) value;
    }

    private static boolean hasIndexSuffix(String keyword, String prefix) {
        if (!keyword.startsWith(prefix) || keyword.length() == prefix.length()) {
            return false;
        }
        for (int i = prefix.length(); i < keyword.length(); i++) {
            char c = keyword.charAt(i);
            if (c < '0' || '9' < c) {
                return false;
            }
        }
        return true;
    }

    private boolean startsWith(String keyword) {
        return !records.isEmpty() && keyword(0).equals(keyword);
    }

    private boolean isAsciiTable() {
        if (!startsWith("XTENSION") || !HeaderRecord.hasValue(records.get(0))) {
            return false;
        }
        String field = records.get(0).substring(HeaderRecord.KEYWORD_LENGTH + 2).stripLeading();
        return field.startsWith("'TABLE ") || field.startsWith("'TABLE'");
    }

    /**
     * Gets whether a keyword is one that describes the structure of this header's HDU.  These keywords can't be
     * added, edited, deleted, or renamed.
     * <p>
     * The mandatory keywords are {@code SIMPLE} (for a primary HDU) or {@code XTENSION}, {@code PCOUNT}, and
     * {@code GCOUNT} (for an extension), {@code BITPIX}, {@code NAXIS}, {@code NAXISn}, and {@code END}.  An ASCII
     * table also has {@code TFIELDS}, {@code TBCOLn}, and {@code TFORMn}.
     * </p>
     *
     * @param keyword
     *     The keyword.
     *
     * @return {@code true}, if the keyword is mandatory; {@code false}, otherwise.
     *
     * @throws NullPointerException
     *     if {@code keyword} is {@code null}.
     */
    public boolean isMandatory(String keyword) {
        ArgumentUtil.checkNotNull(keyword, "keyword");
        switch (keyword) {
        case "BITPIX":
        case "NAXIS":
        case "END":
            return true;
        case "SIMPLE":
            return !startsWith("XTENSION");
        case "XTENSION":
        case "PCOUNT":
        case "GCOUNT":
            return !startsWith("SIMPLE");
        case "TFIELDS":
            return isAsciiTable();
        default:
            return hasIndexSuffix(keyword, "NAXIS") ||
                (isAsciiTable() && (hasIndexSuffix(keyword, "TBCOL") || hasIndexSuffix(keyword, "TFORM")));
        }
    }

    /**
     * Gets the records of this header whose keywords are mandatory, in order.
     */
    List<String> mandatoryRecords() {
        List<String> mandatoryRecords = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            if (isMandatory(keyword(i))) {
                mandatoryRecords.add(records.get(i));
            }
        }
        return mandatoryRecords;
    }

    private static boolean isCommentary(String keyword) {
        return keyword.isEmpty() || keyword.equals("COMMENT") || keyword.equals("HISTORY");
    }

    private int endIndex() {
        int endIndex = indexOf("END");
        if (endIndex < 0) {
            throw new IllegalStateException("header has no END record");
        }
        return endIndex;
    }

    private int checkedIndexOf(String keyword) {
        ArgumentUtil.checkNotNull(keyword, "keyword");
        int index = indexOf(keyword);
        if (index < 0) {
            throw new IllegalArgumentException("keyword " + keyword + " not found");
        }
        return index;
    }

    private void checkNotMandatory(String keyword, String operation) {
        if (isMandatory(keyword)) {
            throw new IllegalArgumentException("mandatory keyword " + keyword + " cannot be " + operation);
        }
    }

    private void checkNotInUse(String keyword) {
        if (!isCommentary(keyword) && 0 <= indexOf(keyword)) {
            throw new IllegalArgumentException("keyword " + keyword + " is already in use");
        }
    }

    // Rebuilds the header from the records before END, so that it is terminated and padded again.
    private Header rebuild(List<String> recordsBeforeEnd) {
        Builder builder = builder();
        for (String record : recordsBeforeEnd) {
            builder.add(record);
        }
        return builder.seal();
    }

    /**
     * Creates a copy of this header with a record added just before the END record.
     * <p>
     * If the new record doesn't fit in the last block, the header grows by a block.  {@code COMMENT},
     * {@code HISTORY}, and blank keywords may be repeated; any other keyword must not already be in use.
     * </p>
     *
     * @param record
     *     The record to add, typically created by one of the {@link HeaderRecord} methods.
     *
     * @return The new header.
     *
     * @throws NullPointerException
     *     if {@code record} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code record} is not 80 characters of ASCII text, if its keyword is mandatory, or if its keyword is
     *     already in use.
     * @throws IllegalStateException
     *     if this header has no END record.
     */
    public Header addKey(String record) {
        ArgumentUtil.checkNotNull(record, "record");
        String keyword = HeaderRecord.keyword(record);
        checkNotMandatory(keyword, "added");
        checkNotInUse(keyword);

        List<String> newRecords = new ArrayList<>(records.subList(0, endIndex()));
        newRecords.add(record);
        return rebuild(newRecords);
    }

    /**
     * Creates a copy of this header in which the first record with a given keyword is replaced.  The replacement
     * keeps the position of the record it replaces.
     *
     * @param record
     *     The new record, typically created by one of the {@link HeaderRecord} methods.  Its keyword identifies the
     *     record to replace.
     *
     * @return The new header.
     *
     * @throws NullPointerException
     *     if {@code record} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code record} is not 80 characters of ASCII text, if its keyword is mandatory, or if this header has
     *     no record with its keyword.
     * @throws IllegalStateException
     *     if this header has no END record.
     */
    public Header editKey(String record) {
        ArgumentUtil.checkNotNull(record, "record");
        String keyword = HeaderRecord.keyword(record);
        int index = checkedIndexOf(keyword);
        checkNotMandatory(keyword, "edited");

        List<String> newRecords = new ArrayList<>(records.subList(0, endIndex()));
        newRecords.set(index, record);
        return rebuild(newRecords);
    }

    /**
     * Creates a copy of this header without the first record with a given keyword.  If the header then fits in
     * fewer blocks, it shrinks.
     *
     * @param keyword
     *     The keyword of the record to delete.
     *
     * @return The new header.
     *
     * @throws NullPointerException
     *     if {@code keyword} is {@code null}.
     * @throws IllegalArgumentException
     *     if the keyword is mandatory or if this header has no record with the keyword.
     * @throws IllegalStateException
     *     if this header has no END record.
     */
    public Header deleteKey(String keyword) {
        int index = checkedIndexOf(keyword);
        checkNotMandatory(keyword, "deleted");

        List<String> newRecords = new ArrayList<>(records.subList(0, endIndex()));
        newRecords.remove(index);
        return rebuild(newRecords);
    }

    /**
     * Creates a copy of this header in which the first record with a given keyword is given a new keyword.  The
     * value and comment of the record are kept.
     *
     * @param oldKeyword
     *     The keyword of the record to rename.
     * @param newKeyword
     *     The new keyword.  This must be at most 8 characters, each an uppercase letter, a digit, a hyphen, or an
     *     underscore.
     *
     * @return The new header.
     *
     * @throws NullPointerException
     *     if either keyword is {@code null}.
     * @throws IllegalArgumentException
     *     if either keyword is mandatory, if this header has no record with {@code oldKeyword}, if
     *     {@code newKeyword} is not permitted, or if {@code newKeyword} is already in use.
     * @throws IllegalStateException
     *     if this header has no END record.
     */
    public Header renameKey(String oldKeyword, String newKeyword) {
        int index = checkedIndexOf(oldKeyword);
        checkNotMandatory(oldKeyword, "renamed");
        HeaderRecord.checkKeyword(newKeyword);
        checkNotMandatory(newKeyword, "added");
        checkNotInUse(newKeyword);

        String record = records.get(index);
        String renamedRecord = newKeyword + " ".repeat(HeaderRecord.KEYWORD_LENGTH - newKeyword.length()) +
            record.substring(HeaderRecord.KEYWORD_LENGTH);

        List<String> newRecords = new ArrayList<>(records.subList(0, endIndex()));
        newRecords.set(index, renamedRecord);
        return rebuild(newRecords);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (String record : records) {
            builder.append(record.stripTrailing()).append('\n');
            if (HeaderRecord.keyword(record).equals("END")) {
                break;
            }
        }
        return builder.toString();
    }
}
