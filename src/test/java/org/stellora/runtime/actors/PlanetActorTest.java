package org.stellora.runtime.actors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stellora.junit.extensions.logging.LogWatchExtension;
import org.stellora.runtime.messages.PlanetReply;
import org.stellora.runtime.messages.PlanetRequest.AsteroidArrival;
import org.stellora.runtime.messages.PlanetRequest.InputOrigin;
import org.stellora.runtime.messages.PlanetRequest.QueryState;
import org.stellora.runtime.messages.PlanetRequest.RequestCombine;
import org.stellora.runtime.model.Planet;
import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PlanetActorTest {

    private PlanetActor actor;

    @AfterEach
    void tearDown() {
        if (actor != null) {
            actor.stop();
        }
    }

    private PlanetActor start(Planet planet, int capacity) {
        actor = new PlanetActor(planet, ConfigFactory.parseMap(Map.of(
                "capacity", capacity, "sendTimeoutMs", 50, "pollIntervalMs", 10)));
        actor.start();
        return actor;
    }

    @Test
    void concurrentCombineRequestsRespectSingleUseLimit() throws Exception {
        start(new Planet(0, PlanetType.B, Set.of(), 5), 64);
        int senders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(senders);
        CountDownLatch go = new CountDownLatch(1);
        List<CompletableFuture<CompletableFuture<PlanetReply>>> sent = new ArrayList<>();
        try {
            for (int i = 0; i < senders; i++) {
                sent.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return actor.ask(new RequestCombine(ResourceKind.HYDROGEN, ResourceKind.OXYGEN,
                            InputOrigin.REQUESTER));
                }, pool));
            }
            go.countDown();

            int accepted = 0;
            int exceeded = 0;
            for (CompletableFuture<CompletableFuture<PlanetReply>> f : sent) {
                PlanetReply reply = f.get(5, TimeUnit.SECONDS).get(5, TimeUnit.SECONDS);
                if (reply.ok()) {
                    accepted++;
                } else if (reply.reason() == RejectionReason.CAPABILITY_EXCEEDED) {
                    exceeded++;
                }
            }
            assertThat(accepted).isEqualTo(1);
            assertThat(exceeded).isEqualTo(senders - 1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void answersQueriesWithState() throws Exception {
        start(new Planet(3, PlanetType.A, Set.of(ResourceKind.SILICON), 4), 8);

        PlanetReply reply = actor.ask(new QueryState()).get(2, TimeUnit.SECONDS);

        assertThat(reply.state().id()).isEqualTo(3);
        assertThat(reply.state().capacity()).isEqualTo(4);
        assertThat(actor.getPlanetId()).isEqualTo(3);
    }

    @Test
    void destroyedPlanetKeepsRunningAndRejects() throws Exception {
        start(new Planet(1, PlanetType.C, Set.of(ResourceKind.CARBON), 5, 0, Map.of()), 8);

        actor.ask(new AsteroidArrival(1)).get(2, TimeUnit.SECONDS);
        PlanetReply reply = actor.ask(new RequestCombine(ResourceKind.CARBON, ResourceKind.CARBON,
                InputOrigin.REQUESTER)).get(2, TimeUnit.SECONDS);

        assertThat(reply.reason()).isEqualTo(RejectionReason.PLANET_UNAVAILABLE);
        assertThat(actor.getCurrentState()).isEqualTo(ActorState.RUNNING);
    }

    @Test
    void rejectsMessagesWhenStopped() {
        actor = new PlanetActor(new Planet(0, PlanetType.D, Set.of(), 5), ConfigFactory.empty());

        assertThatThrownBy(() -> actor.ask(new QueryState())).isInstanceOf(IllegalStateException.class);

        actor.start();
        assertThatThrownBy(actor::start).isInstanceOf(IllegalStateException.class);
        actor.stop();
        await().atMost(Duration.ofSeconds(2)).until(() -> actor.getCurrentState() == ActorState.STOPPED);
        assertThatThrownBy(() -> actor.ask(new QueryState())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void invalidChannelOptionsAreRejected() {
        Planet planet = new Planet(0, PlanetType.D, Set.of(), 5);

        assertThatThrownBy(() -> new PlanetActor(planet, ConfigFactory.parseMap(Map.of("capacity", 0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PlanetActor(planet, ConfigFactory.parseMap(Map.of("capacity", "many"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
