package com.kubeprov.provisioner.step;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for StepRegistry.
 * No Spring context: the registry is built from fixture steps.
 */
class StepRegistryTest {

    List<String> journal;
    StepRegistry registry;

    @BeforeEach
    void setUp() {
        journal = new ArrayList<>();
        registry = new StepRegistry(List.of(
                new RecordingStep("createNetwork", journal),
                new RecordingStep("createFirewall", journal, "createNetwork")));
    }

    @Test
    void registry_registersAllSteps_sortedByName() {
        assertThat(registry.stepNames()).containsExactly("createFirewall", "createNetwork");
        assertThat(registry.manifests())
                .extracting(StepManifest::name)
                .containsExactly("createFirewall", "createNetwork");
    }

    @Test
    void registry_get_unknownStep_throwsNotFoundWithConfigurationKind() {
        assertThatThrownBy(() -> registry.get("noSuchStep"))
                .isInstanceOf(StepNotFoundException.class)
                .hasMessageContaining("noSuchStep")
                .satisfies(e -> assertThat(((StepException) e).getKind())
                        .isEqualTo(StepException.Kind.CONFIGURATION));
    }

    @Test
    void registry_find_and_contains() {
        assertThat(registry.find("createNetwork")).isPresent();
        assertThat(registry.find("noSuchStep")).isEmpty();
        assertThat(registry.contains("createFirewall")).isTrue();
        assertThat(registry.contains("noSuchStep")).isFalse();
    }

    @Test
    void registry_register_sameName_lastRegistrationWins() {
        RecordingStep replacement = new RecordingStep("createNetwork", journal);

        registry.register(replacement);

        assertThat(registry.get("createNetwork")).isSameAs(replacement);
        assertThat(registry.stepNames()).hasSize(2);
    }

    @Test
    void manifest_blankName_rejected() {
        assertThatThrownBy(() -> StepManifest.of(" ", "nothing"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
