package com.raftlog.command;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CommandRegistryTest {
    private CommandRegistry<KvCommand> registry;

    @BeforeEach
    void setUp() {
        registry = CommandRegistry.empty();
    }

    @Test
    @DisplayName("A registered decoder is resolved by its tag")
    void shouldResolveRegisteredDecoder() {
        registry.register("Delete", body -> new KvCommand.Delete(body.path("key").asText()));

        assertThat(registry.isRegistered("Delete")).isTrue();
        assertThat(registry.registeredTypes()).containsExactly("Delete");
        assertThat(registry.resolve("Delete"))
            .hasValueSatisfying(decoder -> {
                KvCommand command = decoder.decode(JsonNodeFactory.instance.objectNode().put("key", "status"));
                assertThat(command).isEqualTo(new KvCommand.Delete("status"));
            });
    }

    @Test
    @DisplayName("Unknown and null tags resolve to nothing")
    void shouldResolveNothingForUnknownTag() {
        assertThat(registry.resolve("Put")).isEmpty();
        assertThat(registry.resolve(null)).isEmpty();
        assertThat(registry.isRegistered(null)).isFalse();
    }

    @Test
    @DisplayName("Membership-change tags cannot be registered")
    void shouldRejectReservedTags() {
        assertThatThrownBy(() -> registry.register("SingleConfiguration", body -> new KvCommand.Delete("x")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("JointConfiguration", body -> new KvCommand.Delete("x")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.registeredTypes()).isEmpty();
    }

    @Test
    @DisplayName("A tag can only be registered once")
    void shouldRejectDuplicateRegistration() {
        registry.register("Put", body -> new KvCommand.Put("a", "b"));

        assertThatThrownBy(() -> registry.register("Put", body -> new KvCommand.Put("c", "d")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Put");
    }

    @Test
    @DisplayName("Null tags and decoders are rejected")
    void shouldRejectNulls() {
        assertThatThrownBy(() -> registry.register(null, body -> new KvCommand.Delete("x")))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.register("Delete", null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("The registered types view is read-only")
    void shouldExposeReadOnlyTypes() {
        registry.register("Put", body -> new KvCommand.Put("a", "b"));

        assertThatThrownBy(() -> registry.registeredTypes().remove("Put"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
