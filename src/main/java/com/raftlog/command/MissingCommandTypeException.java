package com.raftlog.command;

public class MissingCommandTypeException extends CommandDecodeException {

    public MissingCommandTypeException() {
        super("Encoded command has no \"type\" field");
    }
}
