package com.waveflow.engine.persistence;

import com.waveflow.core.model.Checkpoint;
import com.waveflow.core.model.StepResult;
import com.waveflow.core.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InMemoryCheckpointRepositoryTest {

    private InMemoryCheckpointRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCheckpointRepository();
    }

    private Checkpoint checkpoint(int wave) {
        StepResult done = StepResult.running("a", Instant.now(), wave)
            .withCompleted(null, 0, Instant.now(), wave);
        return Checkpoint.capture(Map.of("a", done), new WorkflowState().snapshot(), wave, Map.of());
    }

    @Test
    @DisplayName("Saved checkpoints are found by id and listed in save order")
    void saveAndFind() {
        Checkpoint first = checkpoint(1);
        Checkpoint second = checkpoint(2);

        repository.save(first);
        repository.save(second);

        assertThat(repository.findById(first.checkpointId())).contains(first);
        assertThat(repository.findAll()).containsExactly(first, second);
        assertThat(repository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Unknown and null ids are not found")
    void unknownIds() {
        repository.save(checkpoint(1));

        assertThat(repository.findById("missing")).isEmpty();
        assertThat(repository.findById(null)).isEmpty();
    }

    @Test
    @DisplayName("Saving the same id again replaces the stored checkpoint")
    void saveReplaces() {
        Checkpoint original = checkpoint(1);
        Checkpoint replacement = new Checkpoint(original.checkpointId(), original.createdAt(), 5,
            original.stepResults(), original.workflowState(), original.metadata());

        repository.save(original);
        repository.save(replacement);

        assertThat(repository.count()).isEqualTo(1);
        assertThat(repository.findById(original.checkpointId())).map(Checkpoint::wave).contains(5);
    }

    @Test
    @DisplayName("Clear removes everything")
    void clear() {
        repository.save(checkpoint(1));
        repository.save(checkpoint(2));

        repository.clear();

        assertThat(repository.findAll()).isEmpty();
        assertThat(repository.count()).isZero();
    }

    @Test
    @DisplayName("The listing is a copy")
    void listingIsCopy() {
        repository.save(checkpoint(1));

        repository.findAll().clear();

        assertThat(repository.count()).isEqualTo(1);
    }
}
