package ae.teletronics.attachments.adapters.time;

import ae.teletronics.attachments.ports.ClockProvider;

import java.time.Instant;
import java.time.ZoneId;

/** Production clock based on system time. */
public class SystemClockProvider implements ClockProvider {

    private final ZoneId zone;

    public SystemClockProvider() {
        this(ZoneId.of("UTC"));
    }

    public SystemClockProvider(ZoneId zone) {
        this.zone = zone;
    }

    @Override public Instant now() { return Instant.now(); }

    @Override public ZoneId zone() { return zone; }
}
