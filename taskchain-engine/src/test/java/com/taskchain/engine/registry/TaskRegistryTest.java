package com.taskchain.engine.registry;

import com.fasterxml.jackson.databind.node.NullNode;
import com.taskchain.core.exception.InvalidTaskDefinitionException;
import com.taskchain.core.exception.UnknownTaskException;
import com.taskchain.core.model.TaskDefinition;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class TaskRegistryTest {

    private static TaskDefinition definition(String name) {
        return TaskDefinition.builder(name)
            .resultFresh(Duration.ofHours(1))
            .resultExpires(Duration.ofDays(7))
            .handler(ctx -> NullNode.getInstance())
            .build();
    }

    @Test
    void registeredDefinitions_shouldBeFoundByName() {
        TaskRegistry registry = new TaskRegistry()
            .register(definition("list_sizes"))
            .register(definition("list_images"));

        assertThat(registry.get("list_sizes").taskName()).isEqualTo("list_sizes");
        assertThat(registry.contains("list_images")).isTrue();
        assertThat(registry.find("ping")).isEmpty();
        assertThat(registry.names()).containsExactly("list_images", "list_sizes");
    }

    @Test
    void duplicateName_shouldBeRejected() {
        TaskRegistry registry = new TaskRegistry().register(definition("ping"));

        assertThatThrownBy(() -> registry.register(definition("ping")))
            .isInstanceOf(InvalidTaskDefinitionException.class);
    }

    @Test
    void unknownName_shouldThrow() {
        assertThatThrownBy(() -> new TaskRegistry().get("ping"))
            .isInstanceOf(UnknownTaskException.class)
            .hasMessageContaining("ping");
    }
}
