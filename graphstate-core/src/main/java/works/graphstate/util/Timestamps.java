package works.graphstate.util;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import works.graphstate.exceptions.StateSerializationException;

import static java.time.temporal.ChronoUnit.MICROS;

/**
 * All backends store timestamps in UTC at microsecond precision,
 * which is the finest precision every one of them can round-trip exactly.
 */
public final class Timestamps {
	private Timestamps() { }

	/**
	 * Fixed-width, so that lexical order equals chronological order.
	 * That matters for backends that store timestamps as strings.
	 */
	public static final DateTimeFormatter ISO_MICROS = DateTimeFormatter
		.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'")
		.withZone(ZoneOffset.UTC);

	public static Instant now(Clock clock) {
		return clock.instant().truncatedTo(MICROS);
	}

	public static LocalDateTime toUtcDateTime(Instant instant) {
		return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
	}

	public static Instant fromUtcDateTime(LocalDateTime dateTime) {
		return dateTime.toInstant(ZoneOffset.UTC);
	}

	public static String format(Instant instant) {
		return ISO_MICROS.format(instant);
	}

	public static Instant parse(String text) {
		try {
			return Instant.from(ISO_MICROS.parse(text));
		} catch (DateTimeParseException e) {
			throw new StateSerializationException("Unparseable timestamp \"" + text + "\"", e);
		}
	}
}
