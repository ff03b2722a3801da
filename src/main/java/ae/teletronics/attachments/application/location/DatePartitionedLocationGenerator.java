package ae.teletronics.attachments.application.location;

import ae.teletronics.attachments.application.util.TokenGenerator;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.ClockProvider;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/** {@code yyyy/MM/dd/<32 random chars>[.ext]} in the clock's zone. */
public class DatePartitionedLocationGenerator implements LocationGenerator {

    private static final DateTimeFormatter DIRECTORIES = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final ClockProvider clock;

    public DatePartitionedLocationGenerator(ClockProvider clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String generate(FileMetadata metadata, String extension) {
        LocalDate day = LocalDate.ofInstant(clock.now(), clock.zone());
        return DIRECTORIES.format(day) + "/" + LocationGenerator.withExtension(TokenGenerator.randomToken(), extension);
    }
}
