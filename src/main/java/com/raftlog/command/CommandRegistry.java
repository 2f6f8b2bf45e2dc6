package com.raftlog.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps the wire tag of a custom command to the decoder able to rebuild it.
 *
 * <p>The embedding application populates the registry before decoding any entry that may carry one of its commands. Decoding only reads from it, so a single registry can be shared by every thread that decodes entries.</p>
 *
 * <p>The membership-change tags are reserved and cannot be registered; they are decoded by {@link Command} itself before the registry is consulted.</p>
 *
 * @param <T> Base type of the application commands this registry can produce.
 */
public class CommandRegistry<T extends CustomCommand> {
    private static final Logger logger = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, CustomCommandDecoder<? extends T>> decoders = new ConcurrentHashMap<>();

    public static <T extends CustomCommand> CommandRegistry<T> empty() {
        return new CommandRegistry<>();
    }

    /**
     * Registers the decoder for one command type.
     *
     * @param commandType wire tag, as returned by {@link CustomCommand#commandType()}
     * @param decoder function building the command from its JSON body
     * @return this registry
     * @throws IllegalArgumentException if the tag is reserved for membership changes
     * @throws IllegalStateException if a decoder is already registered for the tag
     */
    public CommandRegistry<T> register(String commandType, CustomCommandDecoder<? extends T> decoder) {
        Objects.requireNonNull(commandType, "commandType");
        Objects.requireNonNull(decoder, "decoder");
        if (Command.isReservedType(commandType)) {
            throw new IllegalArgumentException("Command type '" + commandType + "' is reserved");
        }
        if (decoders.putIfAbsent(commandType, decoder) != null) {
            throw new IllegalStateException("A decoder is already registered for command type '" + commandType + "'");
        }
        logger.debug("Registered decoder for command type '{}'", commandType);
        return this;
    }

    public Optional<CustomCommandDecoder<? extends T>> resolve(String commandType) {
        if (commandType == null) return Optional.empty();
        return Optional.ofNullable(decoders.get(commandType));
    }

    public boolean isRegistered(String commandType) {
        return commandType != null && decoders.containsKey(commandType);
    }

    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(decoders.keySet());
    }
}
