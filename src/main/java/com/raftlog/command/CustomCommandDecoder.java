package com.raftlog.command;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds a custom command from the {@code "command"} body of an encoded entry (a missing node when there is none).
 */
@FunctionalInterface
public interface CustomCommandDecoder<T extends CustomCommand> {
    T decode(JsonNode body);
}
