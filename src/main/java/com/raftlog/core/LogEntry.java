package com.raftlog.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raftlog.command.Command;
import com.raftlog.command.CommandDecodeException;
import com.raftlog.command.CommandRegistry;
import com.raftlog.command.CustomCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Single entry of the replicated log.
 *
 * <p>Each {@code LogEntry} pairs the term in which the leader created it with an optional {@link Command}. An entry without a command is a no-op slot, as appended by a new leader or used as a heartbeat.</p>
 *
 * <p>The encoded form is a flat JSON object: {@code "term"} is always present, and when the entry carries a command its {@code "type"} discriminator and {@code "command"} body sit next to it.</p>
 *
 * <p>Decoding is lenient on purpose. A missing or non-numeric term reads as {@code 0}, and a command that cannot be decoded is dropped (and logged) instead of failing the entry, so that a partial record never blocks the log. Callers that need the failure decode the command directly with {@link Command#fromJson}.</p>
 *
 * @param <T> Base type of the application commands that may appear in the log.
 */
public record LogEntry<T extends CustomCommand>(long term, Command<T> command) {
    private static final Logger logger = LoggerFactory.getLogger(LogEntry.class);

    public static final String TERM_FIELD = "term";

    public LogEntry {
        if (term < 0) {
            throw new IllegalArgumentException("Term is unsigned, got " + term);
        }
    }

    public static <T extends CustomCommand> LogEntry<T> noop(long term) {
        return new LogEntry<>(term, null);
    }

    public static <T extends CustomCommand> LogEntry<T> of(long term, Command<T> command) {
        return new LogEntry<>(term, command);
    }

    public boolean hasCommand() {
        return command != null;
    }

    public Optional<Command<T>> commandIfPresent() {
        return Optional.ofNullable(command);
    }

    public ObjectNode toJson() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        if (command != null) {
            json.set(Command.COMMAND_FIELD, command.toJson());
        }
        json.put(TERM_FIELD, term);
        if (command != null) {
            json.put(Command.TYPE_FIELD, command.commandType());
        }
        return json;
    }

    /**
     * Rebuilds an entry from its encoded form. Never fails.
     *
     * @param json encoded entry
     * @param registry decoders for application commands
     * @return the decoded entry, without a command if none could be decoded
     */
    public static <T extends CustomCommand> LogEntry<T> fromJson(JsonNode json, CommandRegistry<T> registry) {
        if (json == null || !json.isObject()) {
            return noop(0);
        }
        long term = decodeTerm(json.get(TERM_FIELD));
        if (!json.has(Command.TYPE_FIELD)) {
            return noop(term);
        }
        try {
            return new LogEntry<>(term, Command.fromJson(json, registry));
        } catch (CommandDecodeException e) {
            logger.warn("Dropping undecodable command of entry at term {}: {}", term, e.getMessage());
            return noop(term);
        }
    }

    private static long decodeTerm(JsonNode term) {
        if (term != null && term.isIntegralNumber() && term.canConvertToLong() && term.longValue() >= 0) {
            return term.longValue();
        }
        return 0;
    }

    @Override
    public String toString() {
        return "LogEntry{term=" + term + ", command=" + command + "}";
    }
}
