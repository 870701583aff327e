package com.williamcallahan.eventtail.cli;

import com.williamcallahan.eventtail.domain.EventFilter;
import com.williamcallahan.eventtail.domain.EventImportance;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed arguments of the {@code tail} command.
 *
 * @param live stream over WebSocket
 * @param follow poll the history endpoint forward
 * @param filter event filter, null when no filter flag was given
 * @param since start of the historical range
 * @param until end of the historical range
 * @param limit maximum number of historical events
 * @param json print one JSON object per line
 * @param noColor disable ANSI colors
 * @param url tail endpoint
 * @param verbose print progress to stderr
 */
public record TailCommandOptions(
        boolean live,
        boolean follow,
        EventFilter filter,
        Instant since,
        Instant until,
        Integer limit,
        boolean json,
        boolean noColor,
        String url,
        boolean verbose) {

    private static final Pattern RELATIVE_TIME = Pattern.compile("^(\\d+)([smhd])$");

    /**
     * Parses command line arguments. Unknown arguments are ignored; a flag that expects a value
     * always consumes the next argument, even when the value is rejected.
     *
     * @param args raw arguments
     * @param defaultUrl endpoint used when {@code --url} is absent
     * @param clock reference for relative times such as {@code 1h}
     * @return parsed options
     */
    public static TailCommandOptions parse(String[] args, String defaultUrl, Clock clock) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(clock, "clock");
        boolean live = false;
        boolean follow = false;
        boolean json = false;
        boolean noColor = false;
        boolean verbose = false;
        String url = defaultUrl;
        Instant since = null;
        Instant until = null;
        Integer limit = null;
        String source = null;
        String type = null;
        EventImportance minImportance = null;

        for (int index = 0; index < args.length; index++) {
            String arg = args[index];
            String next = index + 1 < args.length ? args[index + 1] : null;
            switch (arg) {
                case "--live" -> live = true;
                case "--follow", "-f" -> follow = true;
                case "--json" -> json = true;
                case "--no-color" -> noColor = true;
                case "--verbose", "-v" -> verbose = true;
                case "--source" -> {
                    source = next;
                    index++;
                }
                case "--type" -> {
                    type = next;
                    index++;
                }
                case "--importance", "-i" -> {
                    if (EventImportance.isValid(next)) {
                        minImportance = EventImportance.fromWireValue(next);
                    }
                    index++;
                }
                case "--since" -> {
                    if (next != null) {
                        since = parseTime(next, clock);
                    }
                    index++;
                }
                case "--until" -> {
                    if (next != null) {
                        until = parseTime(next, clock);
                    }
                    index++;
                }
                case "--limit", "-n" -> {
                    if (next != null) {
                        limit = parseLimit(next);
                    }
                    index++;
                }
                case "--url" -> {
                    if (next != null) {
                        url = next;
                    }
                    index++;
                }
                default -> {
                    // ignored
                }
            }
        }

        EventFilter filter = null;
        if (source != null || type != null || minImportance != null) {
            filter = new EventFilter(source, type, minImportance);
        }
        return new TailCommandOptions(live, follow, filter, since, until, limit, json, noColor, url, verbose);
    }

    /**
     * Parses a relative time such as {@code 30m} (counted back from now) or an absolute date-time.
     *
     * @return the instant, or null when the value is not a recognizable time
     */
    static Instant parseTime(String value, Clock clock) {
        Matcher relative = RELATIVE_TIME.matcher(value);
        if (relative.matches()) {
            try {
                long amount = Long.parseLong(relative.group(1));
                Duration offset = switch (relative.group(2)) {
                    case "s" -> Duration.ofSeconds(amount);
                    case "m" -> Duration.ofMinutes(amount);
                    case "h" -> Duration.ofHours(amount);
                    default -> Duration.ofDays(amount);
                };
                return clock.instant().minus(offset);
            } catch (NumberFormatException | ArithmeticException | DateTimeException outOfRange) {
                return null;
            }
        }
        Instant absolute = tryParse(value, Instant::parse);
        if (absolute == null) {
            absolute = tryParse(value, text -> OffsetDateTime.parse(text).toInstant());
        }
        if (absolute == null) {
            absolute = tryParse(value, text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        return absolute;
    }

    private static Instant tryParse(String value, Function<String, Instant> parser) {
        try {
            return parser.apply(value);
        } catch (DateTimeParseException unparseable) {
            return null;
        }
    }

    private static Integer parseLimit(String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 0 ? parsed : null;
        } catch (NumberFormatException notNumber) {
            return null;
        }
    }
}
