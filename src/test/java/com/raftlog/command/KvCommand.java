package com.raftlog.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Key-value commands used as the application command type in tests.
 */
public sealed interface KvCommand extends CustomCommand permits KvCommand.Put, KvCommand.Delete {

    static CommandRegistry<KvCommand> registry() {
        return CommandRegistry.<KvCommand>empty()
            .register(Put.TYPE, Put::fromJson)
            .register(Delete.TYPE, Delete::fromJson);
    }

    record Put(String key, String value) implements KvCommand {
        public static final String TYPE = "Put";

        static Put fromJson(JsonNode body) {
            JsonNode key = body.get("key");
            if (key == null || !key.isTextual()) {
                throw new CommandDecodeException(TYPE, "Put without a key");
            }
            return new Put(key.textValue(), body.path("value").asText(""));
        }

        @Override
        public String commandType() {
            return TYPE;
        }

        @Override
        public JsonNode toJson() {
            ObjectNode body = JsonNodeFactory.instance.objectNode();
            body.put("value", value);
            body.put("key", key);
            return body;
        }
    }

    record Delete(String key) implements KvCommand {
        public static final String TYPE = "Delete";

        static Delete fromJson(JsonNode body) {
            return new Delete(body.get("key").textValue());
        }

        @Override
        public String commandType() {
            return TYPE;
        }

        @Override
        public JsonNode toJson() {
            ObjectNode body = JsonNodeFactory.instance.objectNode();
            body.put("key", key);
            return body;
        }
    }
}
