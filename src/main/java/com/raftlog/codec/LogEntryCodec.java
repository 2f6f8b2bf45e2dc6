package com.raftlog.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raftlog.command.Command;
import com.raftlog.command.CommandRegistry;
import com.raftlog.command.CustomCommand;
import com.raftlog.core.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Iterator;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Text and byte form of log entries, as handed to the transport and to the log storage.
 *
 * <p>Output is canonical: object properties are written sorted by name, at every level and including the bodies of custom commands, and member sets are written as ascending arrays. Two nodes holding the same logical entry therefore produce the same bytes.</p>
 *
 * <p>Reading follows the leniency of {@link LogEntry#fromJson}; only input that is not exactly one JSON value (bad syntax, trailing content, invalid UTF-8) is rejected, with a {@link LogEntryFormatException}.</p>
 *
 * <p>A codec holds no mutable state besides the registry it reads from and can be shared between threads.</p>
 *
 * @param <T> Base type of the application commands that may appear in the log.
 */
public class LogEntryCodec<T extends CustomCommand> {
    private static final Logger logger = LoggerFactory.getLogger(LogEntryCodec.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private final CommandRegistry<T> registry;

    public LogEntryCodec(CommandRegistry<T> registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @return the mapper used to read and write entries
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public CommandRegistry<T> registry() {
        return registry;
    }

    public String encodeToString(LogEntry<T> entry) {
        return write(entry.toJson());
    }

    public byte[] encode(LogEntry<T> entry) {
        return encodeToString(entry).getBytes(StandardCharsets.UTF_8);
    }

    public LogEntry<T> decode(String encoded) {
        return LogEntry.fromJson(read(encoded), registry);
    }

    public LogEntry<T> decode(byte[] encoded) {
        return LogEntry.fromJson(read(encoded), registry);
    }

    /**
     * Decodes a command envelope strictly: unlike {@link #decode(String)}, command failures reach the caller.
     */
    public Command<T> decodeCommand(String encoded) {
        return Command.fromJson(read(encoded), registry);
    }

    public String encodeBatch(List<LogEntry<T>> entries) {
        ArrayNode array = MAPPER.createArrayNode();
        for (LogEntry<T> entry : entries) {
            array.add(entry.toJson());
        }
        logger.debug("Encoded batch of {} entries", entries.size());
        return write(array);
    }

    public List<LogEntry<T>> decodeBatch(String encoded) {
        JsonNode tree = read(encoded);
        if (!tree.isArray()) {
            throw new LogEntryFormatException("Expected a JSON array of log entries, got " + tree.getNodeType());
        }
        List<LogEntry<T>> entries = new ArrayList<>(tree.size());
        for (JsonNode element : tree) {
            entries.add(LogEntry.fromJson(element, registry));
        }
        logger.debug("Decoded batch of {} entries", entries.size());
        return entries;
    }

    private static String write(JsonNode tree) {
        try {
            return MAPPER.writeValueAsString(canonical(tree));
        } catch (JsonProcessingException e) {
            throw new LogEntryFormatException("Failed to write log entry JSON", e);
        }
    }

    /**
     * Copy of the tree with the properties of every object sorted by name. Array order is kept.
     */
    static JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            TreeSet<String> names = new TreeSet<>();
            node.fieldNames().forEachRemaining(names::add);
            ObjectNode sorted = MAPPER.createObjectNode();
            for (String name : names) {
                sorted.set(name, canonical(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = MAPPER.createArrayNode();
            for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
                copy.add(canonical(it.next()));
            }
            return copy;
        }
        return node;
    }

    private static JsonNode read(String encoded) {
        Objects.requireNonNull(encoded, "encoded");
        try {
            return requireValue(MAPPER.readTree(encoded));
        } catch (JsonProcessingException e) {
            throw new LogEntryFormatException("Malformed log entry JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode read(byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded");
        try {
            return requireValue(MAPPER.readTree(encoded));
        } catch (JsonProcessingException e) {
            throw new LogEntryFormatException("Malformed log entry JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LogEntryFormatException("Unreadable log entry bytes", e);
        }
    }

    private static JsonNode requireValue(JsonNode tree) {
        if (tree == null || tree.isMissingNode()) {
            throw new LogEntryFormatException("Empty log entry input");
        }
        return tree;
    }
}
