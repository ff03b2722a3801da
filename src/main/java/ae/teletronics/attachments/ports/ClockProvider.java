package ae.teletronics.attachments.ports;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Testable clock abstraction, used for date-partitioned storage locations.
 */
public interface ClockProvider {

    Instant now();

    default ZoneId zone() {
        return ZoneId.of("UTC");
    }
}
