package com.onevault.versioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.onevault.identity.HashKey;
import com.onevault.identity.IdentityValidationException;
import com.onevault.identity.MutationRecord;
import com.onevault.identity.RecordFamily;
import com.onevault.identity.testing.ManualClock;
import com.onevault.identity.testing.TestIdentities;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryVersionStore")
class InMemoryVersionStoreTest {

    private TestIdentities ids;
    private ManualClock clock;
    private InMemoryVersionStore store;

    @BeforeEach
    void setUp() {
        ids = TestIdentities.defaultTenant();
        clock = ids.clock();
        store = new InMemoryVersionStore(new LoadDateClock(clock), Duration.ofMillis(500));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static byte[] json(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static void assertSingleCurrent(List<Version> history) {
        assertThat(history.stream().filter(Version::isCurrent)).hasSizeLessThanOrEqualTo(1);
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).effectiveFrom()).isAfter(history.get(i - 1).effectiveFrom());
            assertThat(history.get(i - 1).effectiveTo()).isNotNull();
        }
    }

    @Nested
    @DisplayName("put()")
    class Put {

        @Test
        @DisplayName("alice: second put closes V1 at t1 and opens V2 at t1 + 1us")
        void aliceScenario() {
            HashKey h1 = ids.resolver().resolve(ids.tenantKey(), "alice@example.com");

            Version v1 = store.put(h1, json("{\"name\":\"Alice\"}"), "auth");
            clock.advance(Duration.ofSeconds(3));
            Version v2 = store.put(h1, json("{\"name\":\"Alice B.\"}"), "auth");

            List<Version> history = store.history(h1);
            assertThat(history).hasSize(2);
            Version closedV1 = history.get(0);
            assertThat(closedV1.effectiveFrom()).isEqualTo(v1.effectiveFrom());
            assertThat(closedV1.effectiveTo()).isNotNull();
            assertThat(v2.effectiveFrom()).isEqualTo(closedV1.effectiveTo().plus(LoadDateClock.EPSILON));
            assertThat(v2.effectiveTo()).isNull();
            assertThat(history.get(1)).isEqualTo(v2);
            assertThat(store.current(h1)).contains(v2);
        }

        @Test
        @DisplayName("same payload twice is a no-op returning the current version")
        void noOpOnEqualFingerprint() {
            HashKey key = ids.hub("bob@example.com");
            Version first = store.put(key, json("{\"name\":\"Bob\"}"), "auth");
            clock.advance(Duration.ofMinutes(1));
            Version second = store.put(key, json("{\"name\":\"Bob\"}"), "auth");

            assertThat(second).isEqualTo(first);
            assertThat(store.history(key)).hasSize(1);
        }

        @Test
        @DisplayName("A -> B -> A records three versions")
        void revertingPayloadIsNewVersion() {
            HashKey key = ids.hub("carol@example.com");
            store.put(key, json("A"), "auth");
            store.put(key, json("B"), "auth");
            store.put(key, json("A"), "auth");

            assertThat(store.history(key)).hasSize(3);
            assertSingleCurrent(store.history(key));
        }

        @Test
        @DisplayName("frozen clock still yields strictly increasing effective-froms")
        void frozenClock() {
            HashKey key = ids.hub("dave@example.com");
            for (int i = 0; i < 50; i++) {
                store.put(key, json("v" + i), "auth");
            }
            List<Version> history = store.history(key);
            assertThat(history).hasSize(50);
            assertSingleCurrent(history);
        }

        @Test
        @DisplayName("clock stepping backwards never reorders history")
        void clockSkew() {
            HashKey key = ids.hub("erin@example.com");
            store.put(key, json("one"), "auth");
            clock.set(clock.instant().minus(Duration.ofHours(1)));
            store.put(key, json("two"), "auth");

            assertSingleCurrent(store.history(key));
        }

        @Test
        @DisplayName("fingerprint is the SHA-256 of the payload")
        void fingerprint() {
            HashKey key = ids.hub("frank@example.com");
            Version version = store.put(key, json("abc"), "auth");
            assertThat(version.fingerprint())
                    .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        }

        @Test
        @DisplayName("rejects null payload and blank record source")
        void validation() {
            HashKey key = ids.hub("gina@example.com");
            assertThatThrownBy(() -> store.put(key, null, "auth"))
                    .isInstanceOf(IdentityValidationException.class);
            assertThatThrownBy(() -> store.put(key, json("x"), " "))
                    .isInstanceOf(IdentityValidationException.class);
            assertThat(store.history(key)).isEmpty();
        }

        @Test
        @DisplayName("listeners hear each appended version once, not no-ops")
        void listeners() {
            List<MutationRecord> seen = new ArrayList<>();
            store.addListener(seen::add);
            HashKey key = ids.hub("hank@example.com");

            Version v1 = store.put(key, json("1"), "auth");
            store.put(key, json("1"), "auth");
            Version v2 = store.put(key, json("2"), "auth");

            assertThat(seen).extracting(MutationRecord::versionId)
                    .containsExactly(v1.versionId(), v2.versionId());
            assertThat(seen).allSatisfy(m -> assertThat(m.family()).isEqualTo(RecordFamily.SATELLITE));
        }
    }

    @Nested
    @DisplayName("putIfCurrent()")
    class PutIfCurrent {

        @Test
        @DisplayName("succeeds when the expected version is current")
        void succeeds() {
            HashKey key = ids.hub("ivy@example.com");
            Version v1 = store.putIfCurrent(key, null, json("1"), "auth");
            Version v2 = store.putIfCurrent(key, v1, json("2"), "auth");

            assertThat(store.current(key)).contains(v2);
        }

        @Test
        @DisplayName("throws VersionConflictException on a stale read")
        void conflict() {
            HashKey key = ids.hub("jack@example.com");
            Version v1 = store.put(key, json("1"), "auth");
            store.put(key, json("2"), "auth");

            assertThatThrownBy(() -> store.putIfCurrent(key, v1, json("3"), "auth"))
                    .isInstanceOf(VersionConflictException.class)
                    .satisfies(e -> assertThat(((VersionConflictException) e).expectedVersionId())
                            .isEqualTo(v1.versionId()));
            assertThat(store.history(key)).hasSize(2);
        }

        @Test
        @DisplayName("expecting no version conflicts once one exists")
        void expectedAbsent() {
            HashKey key = ids.hub("kim@example.com");
            store.put(key, json("1"), "auth");

            assertThatThrownBy(() -> store.putIfCurrent(key, null, json("2"), "auth"))
                    .isInstanceOf(VersionConflictException.class);
        }
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("history of an unknown key is empty")
        void unknownKey() {
            HashKey key = ids.unrecorded("nobody");
            assertThat(store.history(key)).isEmpty();
            assertThat(store.current(key)).isEmpty();
        }

        @Test
        @DisplayName("history snapshot is immutable and unaffected by later writes")
        void snapshotIsStable() {
            HashKey key = ids.hub("liam@example.com");
            store.put(key, json("1"), "auth");
            List<Version> snapshot = store.history(key);
            store.put(key, json("2"), "auth");

            assertThat(snapshot).hasSize(1);
            assertThatThrownBy(() -> snapshot.add(snapshot.get(0)))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("asOf() returns the version effective at the instant")
        void asOf() {
            HashKey key = ids.hub("mia@example.com");
            Instant before = clock.instant().minusSeconds(1);
            Version v1 = store.put(key, json("1"), "auth");
            clock.advance(Duration.ofMinutes(5));
            Instant between = clock.instant().minusSeconds(1);
            Version v2 = store.put(key, json("2"), "auth");

            assertThat(store.asOf(key, before)).isEmpty();
            assertThat(store.asOf(key, between)).map(Version::fingerprint).contains(v1.fingerprint());
            assertThat(store.asOf(key, v2.effectiveFrom())).contains(v2);
            assertThat(store.asOf(key, clock.instant().plus(Duration.ofDays(1)))).contains(v2);
        }

        @Test
        @DisplayName("payload is copied in and out")
        void payloadCopies() {
            HashKey key = ids.hub("noah@example.com");
            byte[] payload = json("original");
            Version version = store.put(key, payload, "auth");
            payload[0] = 'X';
            version.payload()[0] = 'Y';

            assertThat(new String(store.current(key).orElseThrow().payload(), StandardCharsets.UTF_8))
                    .isEqualTo("original");
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("concurrent puts on one key keep a single current version")
        void concurrentPutsSameKey() throws Exception {
            HashKey key = ids.hub("olivia@example.com");
            int writers = 16;
            int writesEach = 25;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int w = 0; w < writers; w++) {
                    int writer = w;
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < writesEach; i++) {
                            store.put(key, json(writer + ":" + i), "auth");
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            List<Version> history = store.history(key);
            assertThat(history).hasSize(writers * writesEach);
            assertSingleCurrent(history);
        }

        @Test
        @DisplayName("readers never observe zero or two current versions during writes")
        void readersSeeConsistentSnapshots() throws Exception {
            HashKey key = ids.hub("pat@example.com");
            store.put(key, json("seed"), "auth");
            AtomicReference<String> violation = new AtomicReference<>();
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<?> writer = pool.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        store.put(key, json("w" + i), "auth");
                    }
                });
                Future<?> reader = pool.submit(() -> {
                    while (!writer.isDone()) {
                        long current = store.history(key).stream().filter(Version::isCurrent).count();
                        if (current != 1) {
                            violation.set("saw " + current + " current versions");
                        }
                    }
                });
                writer.get(30, TimeUnit.SECONDS);
                reader.get(30, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }
            assertThat(violation.get()).isNull();
        }

        @Test
        @DisplayName("a held lock makes other writers fail with StoreUnavailableException")
        void lockTimeout() throws Exception {
            HashKey key = ids.hub("quinn@example.com");
            CountDownLatch locked = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                var lock = store.lockOf(key);
                lock.lock();
                try {
                    locked.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock();
                }
            });
            holder.start();
            try {
                assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();
                assertThatThrownBy(() -> store.put(key, json("blocked"), "auth"))
                        .isInstanceOf(StoreUnavailableException.class);
                assertThat(store.history(key)).isEmpty();
            } finally {
                release.countDown();
                holder.join(5_000);
            }
            assertThat(store.put(key, json("after"), "auth").isCurrent()).isTrue();
        }

        @Test
        @DisplayName("interrupted writer leaves no partial state")
        void interruptedWriter() {
            HashKey key = ids.hub("rose@example.com");
            store.put(key, json("1"), "auth");

            Thread.currentThread().interrupt();
            assertThatThrownBy(() -> store.put(key, json("2"), "auth"))
                    .isInstanceOf(OperationCancelledException.class);
            assertThat(Thread.interrupted()).isTrue();

            assertThat(store.history(key)).hasSize(1);
            assertThat(store.current(key).orElseThrow().isCurrent()).isTrue();
        }
    }
}
