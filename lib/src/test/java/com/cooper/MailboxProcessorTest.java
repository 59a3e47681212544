package com.cooper;

import com.cooper.config.ThreadPoolFactory;
import com.cooper.mailbox.LinkedMailbox;
import com.cooper.mailbox.config.OverflowStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for actors running on a dedicated thread.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class MailboxProcessorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private ActorSystem system;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
    }

    @AfterEach
    void tearDown() {
        system.shutdown();
    }

    @Test
    void operationsRunOnTheActorThread() throws Exception {
        try (ActorHandle<List<String>> handle = system.<List<String>>actorOf(new ArrayList<>())
                .withId("worker")
                .withBackend(Backend.THREAD)
                .spawn()) {
            String first = handle.call(state -> Thread.currentThread().getName()).get(WAIT);
            String second = handle.call(state -> Thread.currentThread().getName()).get(WAIT);

            assertEquals("actor-worker", first);
            assertEquals(first, second);
        }
    }

    @Test
    void blockingOperationDoesNotStallOtherActors() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);

        try (ActorHandle<List<String>> blocked = system.<List<String>>actorOf(new ArrayList<>())
                .withBackend(Backend.THREAD)
                .spawn();
             ActorHandle<List<String>> other = system.<List<String>>actorOf(new ArrayList<>())
                     .withBackend(Backend.THREAD)
                     .spawn()) {
            Reply<Boolean> waiting = blocked.call(state -> {
                entered.countDown();
                return release.await(10, TimeUnit.SECONDS);
            });
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            other.cast(state -> state.add("x"));
            assertEquals(1, other.call(List::size).get(WAIT));
            assertFalse(waiting.isDone());

            release.countDown();
            assertTrue(waiting.get(WAIT));
        }
    }

    @Test
    void asyncStageIsAwaitedBeforeTheNextEnvelope() throws Exception {
        CompletableFuture<String> gate = new CompletableFuture<>();
        try (ActorHandle<List<String>> handle = system.<List<String>>actorOf(new ArrayList<>())
                .withBackend(Backend.THREAD)
                .spawn()) {
            handle.castAsync(state -> gate.thenAccept(state::add));
            Reply<List<String>> snapshot = handle.call(List::copyOf);

            assertFalse(snapshot.isDone());
            gate.complete("resumed");

            assertEquals(List.of("resumed"), snapshot.get(WAIT));
        }
    }

    @Test
    void failingOperationThatInterruptsDoesNotStopTheActor() throws Exception {
        try (ActorHandle<List<String>> handle = system.<List<String>>actorOf(new ArrayList<>())
                .withBackend(Backend.THREAD)
                .spawn()) {
            Reply<String> failing = handle.call(state -> {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("gave up after interrupt");
            });
            OperationFailedException error = assertThrows(OperationFailedException.class, () -> failing.get(WAIT));
            assertInstanceOf(IllegalStateException.class, error.getCause());

            assertTrue(handle.cast(state -> state.add("after")).isSuccess());
            assertEquals(List.of("after"), handle.call(List::copyOf).get(WAIT));
            assertEquals(ActorStatus.RUNNING, handle.status());
        }
    }

    @Test
    void interruptFlagIsClearedBetweenOperations() throws Exception {
        try (ActorHandle<List<String>> handle = system.<List<String>>actorOf(new ArrayList<>())
                .withBackend(Backend.THREAD)
                .spawn()) {
            Reply<String> restored = handle.call(state -> {
                Thread.currentThread().interrupt();
                return "restored";
            });
            assertEquals("restored", restored.get(WAIT));

            assertFalse(handle.call(state -> Thread.currentThread().isInterrupted()).get(WAIT));
            assertTrue(handle.cast(state -> state.add("still running")).isSuccess());
            assertEquals(1, handle.call(List::size).get(WAIT));
            assertEquals(ActorStatus.RUNNING, handle.status());
        }
    }

    @Test
    void threadExitsWhenMailboxCloses() throws Exception {
        ActorMailbox<List<String>> mailbox =
                new ActorMailbox<>("direct", new LinkedMailbox<>(), OverflowStrategy.BLOCK);
        MailboxProcessor<List<String>> processor = new MailboxProcessor<>(
                "direct", new ArrayList<>(), mailbox, TerminationPolicy.DRAIN_PENDING, null, null,
                new ThreadPoolFactory());
        ActorHandle<List<String>> handle = new ActorHandle<>(mailbox);
        processor.start();

        handle.cast(state -> state.add("last"));
        handle.close();

        processor.whenTerminated().get(5, TimeUnit.SECONDS);
        processor.getThread().join(5_000);
        assertFalse(processor.getThread().isAlive());
        assertEquals(ActorStatus.TERMINATED, processor.status());
    }
}
