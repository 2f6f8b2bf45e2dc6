package com.raftlog.command;

import java.util.Optional;

public class CommandDecodeException extends RuntimeException {

    private final String commandType;

    public CommandDecodeException(String message) {
        this(null, message, null);
    }

    public CommandDecodeException(String commandType, String message) {
        this(commandType, message, null);
    }

    public CommandDecodeException(String commandType, String message, Throwable cause) {
        super(message, cause);
        this.commandType = commandType;
    }

    public Optional<String> commandType() {
        return Optional.ofNullable(commandType);
    }
}
