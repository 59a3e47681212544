package com.cooper.builder;

import com.cooper.ActorHandle;
import com.cooper.ActorSystem;
import com.cooper.Backend;
import com.cooper.EnqueueFailedException;
import com.cooper.Result;
import com.cooper.mailbox.config.MailboxConfig;
import com.cooper.mailbox.config.MailboxType;
import com.cooper.mailbox.config.OverflowStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class ActorBuilderTest {

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
    void stateFactoryRunsAtSpawn() {
        AtomicInteger created = new AtomicInteger();
        ActorBuilder<List<String>> builder = system.actorFrom(() -> {
            created.incrementAndGet();
            return new ArrayList<>();
        });
        assertEquals(0, created.get());

        try (ActorHandle<List<String>> handle = builder.withId("built").spawn()) {
            assertEquals(1, created.get());
            assertEquals("built", handle.id());
        }
    }

    @Test
    void builderMailboxConfigOverridesSystemDefault() throws Exception {
        MailboxConfig config = new MailboxConfig()
                .setMailboxType(MailboxType.MPSC)
                .setCapacity(1)
                .setOverflowStrategy(OverflowStrategy.REJECT);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        try (ActorHandle<List<String>> handle = system.<List<String>>actorOf(new ArrayList<>())
                .withBackend(Backend.THREAD)
                .withMailboxConfig(config)
                .spawn()) {
            handle.cast(state -> {
                entered.countDown();
                release.await();
            });
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertTrue(handle.cast(state -> state.add("queued")).isSuccess());
            Result<Void> overflow = handle.cast(state -> state.add("overflow"));

            assertTrue(overflow.isFailure());
            EnqueueFailedException error = (EnqueueFailedException) ((Result.Failure<Void>) overflow).error();
            assertEquals(EnqueueFailedException.Reason.MAILBOX_FULL, error.getReason());

            release.countDown();
            assertEquals(List.of("queued"), handle.call(List::copyOf).get());
        }
    }
}
