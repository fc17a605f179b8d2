package com.prozchain.state;

import com.prozchain.checkpoint.CheckpointSystem;
import com.prozchain.leader.EpochState;
import com.prozchain.storage.FinalizedBlockStore;
import com.prozchain.validator.ValidatorRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Groups the persisted consensus states so they can be restored and flushed together.
 */
@Getter
@Component
@AllArgsConstructor
public class StateManager {

    private final ValidatorRegistry validatorRegistry;
    private final FinalizedBlockStore finalizedBlockStore;
    private final CheckpointSystem checkpointSystem;
    private final EpochState epochState;

    public void initializeFromDatabase() {
        states().forEach(ServiceState::initializeFromDatabase);
    }

    public void persistState() {
        states().forEach(ServiceState::persistState);
    }

    private List<ServiceState> states() {
        return List.of(validatorRegistry, finalizedBlockStore, checkpointSystem, epochState);
    }
}
