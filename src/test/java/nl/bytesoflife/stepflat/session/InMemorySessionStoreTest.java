package nl.bytesoflife.stepflat.session;

import nl.bytesoflife.stepflat.kernel.memory.MemoryFace;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final InMemorySessionStore store = new InMemorySessionStore(Duration.ofMinutes(30), clock);

    @Test
    void insertGetRemove() {
        FaceSession session = session("a");
        store.insert(session);

        assertSame(session, store.get("a").orElseThrow());
        assertSame(session, store.require("a"));
        assertEquals(1, store.size());

        assertTrue(store.remove("a"));
        assertFalse(store.remove("a"));
        assertTrue(store.get("a").isEmpty());
    }

    @Test
    void unknownSessionIsNotFound() {
        assertTrue(store.get("nope").isEmpty());
        assertTrue(store.get(null).isEmpty());
        assertThrows(SessionNotFoundException.class, () -> store.require("nope"));
    }

    @Test
    void sessionsExpire() {
        store.insert(session("old"));
        clock.advance(Duration.ofMinutes(20));
        store.insert(session("new"));

        clock.advance(Duration.ofMinutes(15));

        assertTrue(store.get("old").isEmpty());
        assertTrue(store.get("new").isPresent());
        assertEquals(1, store.size());

        clock.advance(Duration.ofMinutes(30));
        assertEquals(1, store.evictExpired());
        assertEquals(0, store.size());
    }

    @Test
    void faceLookupChecksBounds() {
        FaceSession session = session("s");

        assertNotNull(session.face(0));
        assertNotNull(session.face(1));
        assertThrows(InvalidFaceIdException.class, () -> session.face(2));
        assertThrows(InvalidFaceIdException.class, () -> session.face(-1));
    }

    @Test
    void ttlMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new InMemorySessionStore(Duration.ZERO));
    }

    private FaceSession session(String id) {
        return new FaceSession(id, id + ".step",
                List.of(MemoryFace.builder().build(), MemoryFace.builder().build()), null, clock.instant());
    }

    private static class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
