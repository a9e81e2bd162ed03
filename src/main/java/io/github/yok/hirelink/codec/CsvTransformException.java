package io.github.yok.hirelink.codec;

import lombok.Getter;

/**
 * Thrown when a CSV record cannot be turned into a typed row.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class CsvTransformException extends Exception {

    private static final long serialVersionUID = 1L;

    // 1-based record number in the source text
    private final long recordNumber;

    /**
     * Creates an exception for one record.
     *
     * @param recordNumber 1-based record number
     * @param message what is wrong with the record
     */
    public CsvTransformException(long recordNumber, String message) {
        super("record " + recordNumber + ": " + message);
        this.recordNumber = recordNumber;
    }

    /**
     * Creates an exception for text that is not parseable CSV at all.
     *
     * @param message description
     * @param cause parser failure
     */
    public CsvTransformException(String message, Throwable cause) {
        super(message, cause);
        this.recordNumber = -1;
    }
}
