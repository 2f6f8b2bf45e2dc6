package com.raftlog.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Set;

/**
 * Command carried by a replicated log entry.
 *
 * <p>A command is either one of the two membership changes understood by the cluster itself, or an application command wrapped in {@link Custom}:</p>
 * <ul>
 *  <li>{@link SingleConfiguration}: direct, one-step change from {@code oldConfiguration} to {@code configuration}.</li>
 *  <li>{@link JointConfiguration}: the intermediate joint-consensus phase, during which a quorum is required in both {@code oldConfiguration} and {@code newConfiguration}.</li>
 *  <li>{@link Custom}: exactly one application command, opaque to the log.</li>
 * </ul>
 *
 * <p>Membership sets hold node ids (non-negative longs). They are stored unordered but always encoded as ascending arrays, so that the same logical command yields the same bytes on every node. The two sets of a change are not checked against each other: whether a transition is safe is decided by the membership protocol, not here.</p>
 *
 * <p>Commands are immutable values. Equality is structural and variant-aware; {@link Custom} defers to the wrapped command.</p>
 *
 * @param <T> Base type of the application commands that may appear in the log.
 */
public sealed interface Command<T extends CustomCommand>
        permits Command.SingleConfiguration, Command.JointConfiguration, Command.Custom {

    String SINGLE_CONFIGURATION = "SingleConfiguration";
    String JOINT_CONFIGURATION = "JointConfiguration";

    String TYPE_FIELD = "type";
    String COMMAND_FIELD = "command";

    /**
     * @return the wire tag of this command
     */
    String commandType();

    /**
     * Encodes the command body, without the {@code "type"} discriminator.
     *
     * @return the JSON body of this command
     */
    JsonNode toJson();

    static boolean isReservedType(String commandType) {
        return SINGLE_CONFIGURATION.equals(commandType) || JOINT_CONFIGURATION.equals(commandType);
    }

    static <T extends CustomCommand> Command<T> singleConfiguration(Set<Long> oldConfiguration, Set<Long> configuration) {
        return new SingleConfiguration<>(oldConfiguration, configuration);
    }

    static <T extends CustomCommand> Command<T> jointConfiguration(Set<Long> oldConfiguration, Set<Long> newConfiguration) {
        return new JointConfiguration<>(oldConfiguration, newConfiguration);
    }

    static <T extends CustomCommand> Command<T> custom(T command) {
        return new Custom<>(command);
    }

    /**
     * Decodes a command from an envelope holding the {@code "type"} discriminator and the {@code "command"} body.
     *
     * <p>Membership changes are read leniently once a {@code "command"} field is present: a body that is not an object, a missing configuration object, or one without an {@code "instanceIds"} array, stands for an empty set. Any other tag is resolved through the registry and the body is handed to the registered decoder.</p>
     *
     * @param envelope object holding {@code "type"} and {@code "command"}, usually a whole encoded log entry
     * @param registry decoders for application commands
     * @return the decoded command
     * @throws MissingCommandTypeException if there is no string {@code "type"} field
     * @throws UnknownCommandTypeException if the tag is not built in and not registered
     * @throws CommandDecodeException if a membership change has no {@code "command"} field, or a custom decoder fails or yields a command with a reserved or missing tag
     */
    static <T extends CustomCommand> Command<T> fromJson(JsonNode envelope, CommandRegistry<T> registry) {
        Objects.requireNonNull(registry, "registry");
        JsonNode typeNode = envelope == null ? null : envelope.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MissingCommandTypeException();
        }
        String commandType = typeNode.textValue();
        JsonNode body = envelope.path(COMMAND_FIELD);

        if (SINGLE_CONFIGURATION.equals(commandType)) {
            JsonNode command = requireBody(commandType, envelope);
            return new SingleConfiguration<>(
                InstanceIds.decode(command.get(SingleConfiguration.OLD_CONFIGURATION_FIELD)),
                InstanceIds.decode(command.get(SingleConfiguration.CONFIGURATION_FIELD))
            );
        }
        if (JOINT_CONFIGURATION.equals(commandType)) {
            JsonNode command = requireBody(commandType, envelope);
            return new JointConfiguration<>(
                InstanceIds.decode(command.get(JointConfiguration.OLD_CONFIGURATION_FIELD)),
                InstanceIds.decode(command.get(JointConfiguration.NEW_CONFIGURATION_FIELD))
            );
        }

        CustomCommandDecoder<? extends T> decoder = registry.resolve(commandType)
            .orElseThrow(() -> new UnknownCommandTypeException(commandType));
        T command;
        try {
            command = decoder.decode(body);
        } catch (CommandDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CommandDecodeException(commandType, "Decoder for command type '" + commandType + "' failed: " + e.getMessage(), e);
        }
        if (command == null) {
            throw new CommandDecodeException(commandType, "Decoder for command type '" + commandType + "' returned no command");
        }
        String decodedType = command.commandType();
        if (decodedType == null || isReservedType(decodedType)) {
            throw new CommandDecodeException(commandType, "Decoder for command type '" + commandType + "' produced a command tagged '" + decodedType + "'");
        }
        return new Custom<>(command);
    }

    // only an absent field fails; get() on a null or scalar body yields nothing, hence empty sets
    private static JsonNode requireBody(String commandType, JsonNode envelope) {
        JsonNode body = envelope.get(COMMAND_FIELD);
        if (body == null) {
            throw new CommandDecodeException(commandType, "Command of type '" + commandType + "' has no \"command\" field");
        }
        return body;
    }

    /**
     * Direct, one-step membership change.
     */
    record SingleConfiguration<T extends CustomCommand>(Set<Long> oldConfiguration, Set<Long> configuration)
            implements Command<T> {

        static final String CONFIGURATION_FIELD = "configuration";
        static final String OLD_CONFIGURATION_FIELD = "oldConfiguration";

        public SingleConfiguration {
            oldConfiguration = InstanceIds.copyOf(oldConfiguration);
            configuration = InstanceIds.copyOf(configuration);
        }

        @Override
        public String commandType() {
            return SINGLE_CONFIGURATION;
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode body = InstanceIds.NODES.objectNode();
            body.set(CONFIGURATION_FIELD, InstanceIds.encode(configuration));
            body.set(OLD_CONFIGURATION_FIELD, InstanceIds.encode(oldConfiguration));
            return body;
        }

        @Override
        public String toString() {
            return SINGLE_CONFIGURATION + "(" + InstanceIds.render(oldConfiguration) + " -> " + InstanceIds.render(configuration) + ")";
        }
    }

    /**
     * Joint-consensus phase of a reconfiguration, both member sets being authoritative.
     */
    record JointConfiguration<T extends CustomCommand>(Set<Long> oldConfiguration, Set<Long> newConfiguration)
            implements Command<T> {

        static final String NEW_CONFIGURATION_FIELD = "newConfiguration";
        static final String OLD_CONFIGURATION_FIELD = "oldConfiguration";

        public JointConfiguration {
            oldConfiguration = InstanceIds.copyOf(oldConfiguration);
            newConfiguration = InstanceIds.copyOf(newConfiguration);
        }

        @Override
        public String commandType() {
            return JOINT_CONFIGURATION;
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode body = InstanceIds.NODES.objectNode();
            body.set(NEW_CONFIGURATION_FIELD, InstanceIds.encode(newConfiguration));
            body.set(OLD_CONFIGURATION_FIELD, InstanceIds.encode(oldConfiguration));
            return body;
        }

        @Override
        public String toString() {
            return JOINT_CONFIGURATION + "(" + InstanceIds.render(oldConfiguration) + " -> " + InstanceIds.render(newConfiguration) + ")";
        }
    }

    /**
     * Application command. Tag, encoding, equality and rendering all come from the wrapped value.
     */
    record Custom<T extends CustomCommand>(T command) implements Command<T> {

        public Custom {
            Objects.requireNonNull(command, "command");
            String commandType = Objects.requireNonNull(command.commandType(), "commandType");
            if (isReservedType(commandType)) {
                throw new IllegalArgumentException("Custom command uses reserved type '" + commandType + "'");
            }
        }

        @Override
        public String commandType() {
            return command.commandType();
        }

        @Override
        public JsonNode toJson() {
            return command.toJson();
        }

        @Override
        public String toString() {
            return command.toString();
        }
    }
}
