package ae.teletronics.attachments.ports;

import java.io.IOException;
import java.util.Objects;

/**
 * Pluggable antivirus check, run as one of the upload analyzers.
 */
public interface VirusScanner {

    ScanReport scan(StreamSource source) throws IOException;

    enum Verdict { CLEAN, INFECTED, ERROR }

    /**
     * @param engine  e.g., "NoOp", "ClamAV"
     * @param details optional finding, null when clean
     */
    record ScanReport(Verdict verdict, String engine, String details) {

        public ScanReport {
            Objects.requireNonNull(verdict, "verdict");
        }

        public static ScanReport clean(String engine) {
            return new ScanReport(Verdict.CLEAN, engine, null);
        }

        public static ScanReport infected(String engine, String details) {
            return new ScanReport(Verdict.INFECTED, engine, details);
        }

        public static ScanReport error(String engine, String details) {
            return new ScanReport(Verdict.ERROR, engine, details);
        }

        public boolean isClean() {
            return verdict == Verdict.CLEAN;
        }
    }
}
