package com.finops.costanomaly.rootcause;

/**
 * A resource snapshot that cannot be attributed (missing record, negative or non-finite cost).
 */
public class InvalidResourceRecordException extends RuntimeException {

    public InvalidResourceRecordException(String message) {
        super(message);
    }
}
