package works.graphstate.testing;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TestClockTest {

	@Test
	void movesOnlyWhenTold() {
		Instant start = Instant.parse("2024-01-01T00:00:00Z");
		TestClock clock = new TestClock(start);
		assertEquals(start, clock.instant());
		assertEquals(start, clock.instant());
		assertEquals(start.plusSeconds(1), clock.tick());
		assertEquals(start.plusSeconds(1).plusMillis(5), clock.advance(Duration.ofMillis(5)));
		assertEquals(start.plusSeconds(1).plusMillis(5), clock.instant());
	}

	@Test
	void isUtcOnly() {
		TestClock clock = new TestClock(Instant.EPOCH);
		assertThrows(UnsupportedOperationException.class, () -> clock.withZone(ZoneId.of("Europe/Paris")));
	}
}
