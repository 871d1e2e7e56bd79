package com.selfplay.worker;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.selfplay.manager.ModelHandle;
import com.selfplay.manager.SelfplayManager;
import com.selfplay.pipeline.FinishedGameData;
import com.selfplay.shutdown.StopSignal;
import com.selfplay.testing.FakeEvaluator;
import com.selfplay.testing.RecordingTrainingDataWriter;
import com.selfplay.testing.ScriptedGameRunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GameWorkerPoolTest {

    @Test
    void shouldPlayEachAdmittedGameIndexExactlyOnce() {
        assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
            SelfplayManager manager = new SelfplayManager(0.0, 8, 10);
            RecordingTrainingDataWriter train = new RecordingTrainingDataWriter();
            manager.loadModelAndStartDataWriting(new FakeEvaluator("a"), train, new RecordingTrainingDataWriter(), null);
            ScriptedGameRunner runner = new ScriptedGameRunner(2);
            GameAdmissionCounter counter = new GameAdmissionCounter(50);
            ForkData forkData = new ForkData(10);
            GameWorkerPool pool = new GameWorkerPool(4, manager, runner, counter, forkData, new StopSignal(), true);

            pool.start();
            assertEquals(0, pool.awaitWorkers());
            manager.close();

            Set<Long> expected = new HashSet<>();
            for (long i = 0; i < 50; i++) {
                expected.add(i);
            }
            assertEquals(expected, runner.playedIndices());
            assertEquals(50, pool.gamesCompleted());
            assertEquals(50, train.games().size());
            assertTrue(counter.claimed() >= 54);
            assertEquals(10, forkData.size());
        });
    }

    @Test
    void shouldAbandonGameAndExitWhenStopRequestedMidGame() {
        assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
            SelfplayManager manager = new SelfplayManager(0.0, 8, 10);
            RecordingTrainingDataWriter train = new RecordingTrainingDataWriter();
            ModelHandle a = manager.loadModelAndStartDataWriting(new FakeEvaluator("a"), train, new RecordingTrainingDataWriter(), null);
            StopSignal stopSignal = new StopSignal();
            CountDownLatch inGame = new CountDownLatch(1);
            CountDownLatch proceed = new CountDownLatch(1);
            ScriptedGameRunner runner = new ScriptedGameRunner(3) {
                @Override
                protected void beforeMove(long gameIndex, int move) {
                    inGame.countDown();
                    awaitQuietly(proceed);
                }
            };
            GameWorkerPool pool = new GameWorkerPool(
                    2, manager, runner, new GameAdmissionCounter(1000), new ForkData(), stopSignal, false);

            pool.start();
            assertTrue(inGame.await(5, TimeUnit.SECONDS));
            stopSignal.requestStop();
            proceed.countDown();

            assertEquals(0, pool.awaitWorkers());
            assertEquals(0, pool.gamesCompleted());
            assertEquals(0, a.refCount());
            manager.close();
            assertTrue(train.games().isEmpty());
        });
    }

    @Test
    void shouldAttributeGameToNewerModelAfterMidGameSwitch() {
        assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
            SelfplayManager manager = new SelfplayManager(0.0, 8, 10);
            RecordingTrainingDataWriter trainA = new RecordingTrainingDataWriter();
            RecordingTrainingDataWriter trainB = new RecordingTrainingDataWriter();
            FakeEvaluator evaluatorA = new FakeEvaluator("a");
            ModelHandle a = manager.loadModelAndStartDataWriting(evaluatorA, trainA, new RecordingTrainingDataWriter(), null);
            ScriptedGameRunner runner = new ScriptedGameRunner(3) {
                @Override
                protected void beforeMove(long gameIndex, int move) {
                    if (move == 1) {
                        manager.loadModelAndStartDataWriting(new FakeEvaluator("b"), trainB, new RecordingTrainingDataWriter(), null);
                    }
                }
            };
            GameWorkerPool pool = new GameWorkerPool(
                    1, manager, runner, new GameAdmissionCounter(1), new ForkData(), new StopSignal(), true);

            pool.start();
            assertEquals(0, pool.awaitWorkers());

            assertTrue(a.isFinalized());
            assertTrue(evaluatorA.isClosed());
            manager.close();
            assertTrue(trainA.games().isEmpty());
            assertEquals(1, trainB.games().size());
            FinishedGameData game = trainB.games().get(0);
            assertEquals("b", game.modelName());
            assertEquals(0, game.gameIndex());
        });
    }

    @Test
    void shouldKeepGameOnOriginalModelWhenSwitchingDisabled() {
        assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
            SelfplayManager manager = new SelfplayManager(0.0, 8, 10);
            RecordingTrainingDataWriter trainA = new RecordingTrainingDataWriter();
            RecordingTrainingDataWriter trainB = new RecordingTrainingDataWriter();
            ModelHandle a = manager.loadModelAndStartDataWriting(new FakeEvaluator("a"), trainA, new RecordingTrainingDataWriter(), null);
            ScriptedGameRunner runner = new ScriptedGameRunner(3) {
                @Override
                protected void beforeMove(long gameIndex, int move) {
                    if (gameIndex == 0 && move == 1) {
                        manager.loadModelAndStartDataWriting(new FakeEvaluator("b"), trainB, new RecordingTrainingDataWriter(), null);
                    }
                }
            };
            GameWorkerPool pool = new GameWorkerPool(
                    1, manager, runner, new GameAdmissionCounter(2), new ForkData(), new StopSignal(), false);

            pool.start();
            assertEquals(0, pool.awaitWorkers());
            manager.close();

            assertTrue(a.isFinalized());
            assertEquals(1, trainA.games().size());
            assertEquals("a", trainA.games().get(0).modelName());
            assertEquals(1, trainB.games().size());
            assertEquals(1, trainB.games().get(0).gameIndex());
        });
    }

    @Test
    void shouldStopPoolAndReportFailureWhenWorkerThrows() {
        assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
            SelfplayManager manager = new SelfplayManager(0.0, 8, 10);
            ModelHandle a = manager.loadModelAndStartDataWriting(
                    new FakeEvaluator("a"), new RecordingTrainingDataWriter(), new RecordingTrainingDataWriter(), null);
            StopSignal stopSignal = new StopSignal();
            GameRunner exploding = (gameIndex, black, white, forkData, stop, switcher) -> {
                throw new IllegalStateException("engine crashed");
            };
            GameWorkerPool pool = new GameWorkerPool(
                    2, manager, exploding, new GameAdmissionCounter(1000), new ForkData(), stopSignal, true);

            pool.start();
            int failures = pool.awaitWorkers();

            assertTrue(failures >= 1);
            assertTrue(stopSignal.isStopRequested());
            assertEquals(0, a.refCount());
            manager.close();
        });
    }

    @Test
    void shouldExitWithoutPlayingWhenInterruptedGameReturnsEmpty() {
        assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
            SelfplayManager manager = new SelfplayManager(0.0, 8, 10);
            manager.loadModelAndStartDataWriting(
                    new FakeEvaluator("a"), new RecordingTrainingDataWriter(), new RecordingTrainingDataWriter(), null);
            GameRunner interrupted = (gameIndex, black, white, forkData, stop, switcher) -> Optional.empty();
            GameWorkerPool pool = new GameWorkerPool(
                    3, manager, interrupted, new GameAdmissionCounter(1000), new ForkData(), new StopSignal(), true);

            pool.start();
            assertEquals(0, pool.awaitWorkers());
            assertEquals(0, pool.gamesCompleted());
            manager.close();
        });
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
