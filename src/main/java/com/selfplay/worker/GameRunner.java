package com.selfplay.worker;

import java.util.Optional;

import com.selfplay.pipeline.FinishedGameData;
import com.selfplay.shutdown.StopSignal;

/**
 * Plays one self-play game. Implementations must check {@code stopSignal} between moves and return
 * empty promptly once it is set.
 */
public interface GameRunner {
    /**
     * @param modelSwitcher {@code null} unless mid-game model switching is enabled; otherwise consulted at
     *        decision points and any evaluator it returns replaces the current one for both bots
     * @return the finished game, or empty if the game was interrupted
     */
    Optional<FinishedGameData> runGame(
            long gameIndex,
            BotSpec black,
            BotSpec white,
            ForkData forkData,
            StopSignal stopSignal,
            ModelSwitcher modelSwitcher);
}
