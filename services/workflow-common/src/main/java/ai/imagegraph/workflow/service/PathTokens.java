package ai.imagegraph.workflow.service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands time placeholders in save paths and file names.
 * <p>
 * Recognized tokens are {@code {timestamp}}, {@code {date}}, {@code {time}} and the
 * strftime-style {@code [time(%Y-%m-%d)]} form used by path-aware save nodes.
 * Anything else, including unknown brace tokens, is copied verbatim.
 */
public final class PathTokens {

    private static final Pattern TOKEN = Pattern.compile("\\{([A-Za-z_]+)}|\\[time\\(([^)]+)\\)]");

    private static final Map<String, DateTimeFormatter> NAMED_TOKENS = Map.of(
            "timestamp", DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss"),
            "date", DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            "time", DateTimeFormatter.ofPattern("HHmmss"));

    private PathTokens() {
    }

    public static String substituteTokens(String pathTemplate, LocalDateTime now) {
        if (pathTemplate == null || pathTemplate.isEmpty()) {
            return pathTemplate;
        }

        Matcher matcher = TOKEN.matcher(pathTemplate);
        StringBuilder result = new StringBuilder(pathTemplate.length() + 16);
        while (matcher.find()) {
            String replacement;
            if (matcher.group(1) != null) {
                DateTimeFormatter formatter = NAMED_TOKENS.get(matcher.group(1));
                replacement = formatter != null ? formatter.format(now) : matcher.group();
            } else {
                replacement = formatStrftime(matcher.group(2), now);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatStrftime(String pattern, LocalDateTime now) {
        StringBuilder out = new StringBuilder(pattern.length() + 8);
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '%' || i + 1 >= pattern.length()) {
                out.append(c);
                continue;
            }
            char directive = pattern.charAt(++i);
            String value = formatDirective(directive, now);
            if (value == null) {
                out.append('%').append(directive);
            } else {
                out.append(value);
            }
        }
        return out.toString();
    }

    private static String formatDirective(char directive, LocalDateTime now) {
        return switch (directive) {
            case 'Y' -> String.format("%04d", now.getYear());
            case 'y' -> String.format("%02d", now.getYear() % 100);
            case 'm' -> String.format("%02d", now.getMonthValue());
            case 'd' -> String.format("%02d", now.getDayOfMonth());
            case 'j' -> String.format("%03d", now.getDayOfYear());
            case 'H' -> String.format("%02d", now.getHour());
            case 'I' -> String.format("%02d", now.getHour() % 12 == 0 ? 12 : now.getHour() % 12);
            case 'M' -> String.format("%02d", now.getMinute());
            case 'S' -> String.format("%02d", now.getSecond());
            case 'p' -> now.getHour() < 12 ? "AM" : "PM";
            case 'B' -> DateTimeFormatter.ofPattern("MMMM", Locale.ENGLISH).format(now);
            case 'b' -> DateTimeFormatter.ofPattern("MMM", Locale.ENGLISH).format(now);
            case 'A' -> DateTimeFormatter.ofPattern("EEEE", Locale.ENGLISH).format(now);
            case 'a' -> DateTimeFormatter.ofPattern("EEE", Locale.ENGLISH).format(now);
            case '%' -> "%";
            default -> null;
        };
    }
}
