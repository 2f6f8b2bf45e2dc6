package com.raftlog.command;

public class UnknownCommandTypeException extends CommandDecodeException {

    public UnknownCommandTypeException(String commandType) {
        super(commandType, "No decoder registered for command type '" + commandType + "'");
    }
}
