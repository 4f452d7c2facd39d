package at.sv.huebridge;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public final class FormatUtil {
    private FormatUtil() {
    }

    /**
     * ISO-8601 with offset and second precision, e.g. {@code 2024-03-01T18:30:05+01:00}.
     */
    public static String formatTimestamp(ZonedDateTime time) {
        return time.truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public static String getCauseMessage(Exception e) {
        return Objects.requireNonNullElse(e.getCause(), e).getLocalizedMessage();
    }
}
