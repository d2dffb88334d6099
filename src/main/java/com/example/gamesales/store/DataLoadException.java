package com.example.gamesales.store;

/**
 * Raised when a dataset cannot be turned into a {@link RecordStore}: the
 * source is unreadable, a required column is missing, or a value in a
 * numeric column cannot be parsed. No partial store is ever produced.
 */
public class DataLoadException extends Exception {

    public DataLoadException(String message) {
        super(message);
    }

    public DataLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
