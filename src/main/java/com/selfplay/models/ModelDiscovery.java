package com.selfplay.models;

import java.io.IOException;
import java.util.Optional;

public interface ModelDiscovery {
    /**
     * @return the newest available model, or empty if there is none yet
     */
    Optional<ModelCandidate> findLatest() throws IOException;
}
