package com.raftlog.command;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Capability every application-defined command must provide to travel inside the replicated log.
 *
 * <p>The log entry machinery never looks inside a custom command. It only asks for the wire tag, used both as the {@code "type"} discriminator of an encoded entry and as the key under which a {@link CustomCommandDecoder} is registered in a {@link CommandRegistry}, and for the command's own JSON body.</p>
 *
 * <p>The tag must be a constant for the implementing type and must not be one of the tags reserved for membership changes ({@value Command#SINGLE_CONFIGURATION}, {@value Command#JOINT_CONFIGURATION}).</p>
 *
 * <p>Implementations are expected to be immutable values with structural {@code equals}, {@code hashCode} and a readable {@code toString}; {@link Command.Custom} forwards to them. Records are the natural fit.</p>
 */
public interface CustomCommand {

    /**
     * @return the stable wire tag of this command type
     */
    String commandType();

    /**
     * Encodes the command body. The result is placed verbatim under the {@code "command"} field of the entry.
     *
     * @return the JSON body of this command
     */
    JsonNode toJson();
}
