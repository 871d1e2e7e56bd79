package com.selfplay.pipeline;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.selfplay.testing.TestGames;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GameDataQueueTest {

    @Test
    void shouldBlockProducerWhileFullUntilConsumerTakes() throws Exception {
        GameDataQueue queue = new GameDataQueue(4);
        for (int i = 0; i < 4; i++) {
            queue.put(TestGames.game(i, "a", 1));
        }
        CountDownLatch fifthQueued = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                queue.put(TestGames.game(4, "a", 1));
                fifthQueued.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        assertFalse(fifthQueued.await(200, TimeUnit.MILLISECONDS));
        assertEquals(4, queue.size());

        assertEquals(0, queue.take().orElseThrow().gameIndex());
        assertTrue(fifthQueued.await(5, TimeUnit.SECONDS));
        producer.join();
        assertEquals(4, queue.size());
    }

    @Test
    void shouldDeliverQueuedGamesInOrderBeforeEndMarker() throws Exception {
        GameDataQueue queue = new GameDataQueue(3);
        queue.put(TestGames.game(1, "a", 1));
        queue.put(TestGames.game(2, "a", 1));
        queue.closeForWriting();

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertEquals(1, queue.take().orElseThrow().gameIndex());
            assertEquals(2, queue.take().orElseThrow().gameIndex());
            assertEquals(Optional.empty(), queue.take());
        });
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new GameDataQueue(0));
        assertEquals(7, new GameDataQueue(7).capacity());
    }
}
