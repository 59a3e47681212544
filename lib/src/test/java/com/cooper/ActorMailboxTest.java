package com.cooper;

import com.cooper.mailbox.LinkedMailbox;
import com.cooper.mailbox.config.OverflowStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ActorMailboxTest {

    private ActorMailbox<List<String>> mailbox;
    private AtomicInteger signals;

    @BeforeEach
    void setUp() {
        mailbox = new ActorMailbox<>("mb", new LinkedMailbox<>(), OverflowStrategy.BLOCK);
        signals = new AtomicInteger();
        mailbox.onSignal(signals::incrementAndGet);
    }

    private static Envelope<List<String>> add(String value) {
        return Envelope.cast(state -> {
            state.add(value);
            return null;
        });
    }

    @Test
    void enqueueKeepsOrderAndSignals() {
        mailbox.enqueue(add("a"));
        mailbox.enqueue(add("b"));

        assertEquals(2, mailbox.size());
        assertEquals(2, signals.get());

        List<String> state = new ArrayList<>();
        mailbox.poll().invoke(state);
        mailbox.poll().invoke(state);
        assertEquals(List.of("a", "b"), state);
        assertTrue(mailbox.isEmpty());
    }

    @Test
    void releasingLastRegistrationCloses() {
        ActorMailbox.Registration first = mailbox.register();
        ActorMailbox.Registration second = mailbox.register();
        assertEquals(2, mailbox.producerCount());

        first.release();
        first.release();
        assertEquals(1, mailbox.producerCount(), "Repeated release counts once");
        assertFalse(mailbox.isClosed());

        second.release();
        assertTrue(mailbox.isClosed());
        assertTrue(second.isReleased());
        assertEquals(ActorStatus.DRAINING, mailbox.status());
    }

    @Test
    void enqueueAfterCloseFails() {
        mailbox.close();

        EnqueueFailedException error = assertThrows(EnqueueFailedException.class, () -> mailbox.enqueue(add("x")));
        assertEquals(EnqueueFailedException.Reason.ACTOR_TERMINATED, error.getReason());
        assertEquals("mb", error.getActorId());
    }

    @Test
    void closeIsIdempotentAndQueuesOneWakeUp() {
        mailbox.close();
        mailbox.close();

        assertEquals(0, mailbox.size(), "the close marker is not pending work");
        assertTrue(mailbox.isEmpty());
        assertFalse(mailbox.isQueueEmpty());
        assertTrue(mailbox.poll().isWakeUp());
        assertTrue(mailbox.isQueueEmpty());
        assertEquals(1, signals.get());
    }

    @Test
    void sizeCountsOnlyRealEnvelopesAcrossClose() throws Exception {
        mailbox.enqueue(add("a"));
        mailbox.close();
        assertEquals(1, mailbox.size());

        List<String> state = new ArrayList<>();
        mailbox.take().invoke(state);
        assertEquals(0, mailbox.size());
        assertTrue(mailbox.take().isWakeUp());
        assertEquals(0, mailbox.size());
        assertEquals(List.of("a"), state);
    }

    @Test
    void discardPendingAbandonsCalls() {
        CompletableFuture<Integer> reply = new CompletableFuture<>();
        mailbox.enqueue(Envelope.call(state -> CompletableFuture.completedFuture(state.size()), reply));
        mailbox.enqueue(add("never"));
        mailbox.close();

        assertEquals(2, mailbox.discardPending());
        assertTrue(mailbox.isEmpty());

        ExecutionException error = assertThrows(ExecutionException.class, reply::get);
        assertInstanceOf(ActorGoneException.class, error.getCause());
    }

    @Test
    void shutdownForcesDiscard() {
        mailbox.shutdown();

        assertTrue(mailbox.isClosed());
        assertTrue(mailbox.isForceDiscard());
    }

    @Test
    void statusFollowsLifecycle() {
        assertEquals(ActorStatus.CREATED, mailbox.status());
        mailbox.markRunning();
        assertEquals(ActorStatus.RUNNING, mailbox.status());
        mailbox.close();
        assertEquals(ActorStatus.DRAINING, mailbox.status());
        mailbox.markTerminated();
        assertEquals(ActorStatus.TERMINATED, mailbox.status());
        assertTrue(mailbox.whenTerminated().isDone());
    }
}
