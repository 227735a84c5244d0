package com.tony.fantasyGolf.exception;

/**
 * Échec d'un collaborateur externe (base, fournisseur de classements). Toujours ré-essayable.
 */
public class RecordFetchException extends RuntimeException {

    public RecordFetchException(String message) {
        super(message);
    }

    public RecordFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
