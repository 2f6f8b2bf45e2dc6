package com.raftlog.codec;

public class LogEntryFormatException extends RuntimeException {

    public LogEntryFormatException(String message) {
        super(message);
    }

    public LogEntryFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
