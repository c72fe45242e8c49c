package io.github.byzatic.crontimestamps.cron_expression;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.github.byzatic.crontimestamps.base_exceptions.MalformedFieldException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the text of one cron field into its {@link FieldSubentry} units.
 *
 * <h3>Accepted forms (per comma separated subentry)</h3>
 * <ul>
 *   <li>{@code *} - the whole domain of the field;</li>
 *   <li>{@code N} - a single value;</li>
 *   <li>{@code N-M} - an inclusive range;</li>
 *   <li>{@code *&#47;S}, {@code N-M/S} - a range walked with step {@code S};</li>
 *   <li>{@code N/S} - from {@code N} to the end of the domain with step {@code S}
 *       ({@code 5/15} on minutes is {@code 5,20,35,50}).</li>
 * </ul>
 * Months accept {@code JAN..DEC}, days of week accept {@code SUN..SAT}; names are case-insensitive.
 * Day of week {@code 7} is Sunday and is folded into {@code 0}.
 */
public final class FieldParser {
    private final static Logger logger = LoggerFactory.getLogger(FieldParser.class);

    private static final Pattern NAME = Pattern.compile("[A-Z]+");

    private static final Map<String, Integer> MONTH_NAMES = ImmutableMap.<String, Integer>builder()
            .put("JAN", 1).put("FEB", 2).put("MAR", 3).put("APR", 4)
            .put("MAY", 5).put("JUN", 6).put("JUL", 7).put("AUG", 8)
            .put("SEP", 9).put("OCT", 10).put("NOV", 11).put("DEC", 12)
            .build();

    private static final Map<String, Integer> DAY_NAMES = ImmutableMap.<String, Integer>builder()
            .put("SUN", 0).put("MON", 1).put("TUE", 2).put("WED", 3)
            .put("THU", 4).put("FRI", 5).put("SAT", 6)
            .build();

    private static final int SUNDAY_ALIAS = 7;

    private FieldParser() {
    }

    /**
     * Parses a field into its distinct subentries, keeping first-seen order.
     *
     * @throws MalformedFieldException if a token is not an integer, a range or step is structurally
     *                                 invalid, or a value falls outside the field's domain
     */
    public static @NotNull ImmutableSet<FieldSubentry> parseField(String fieldText, @NotNull FieldKind kind)
            throws MalformedFieldException {
        return ImmutableSet.copyOf(parseSubentries(fieldText, kind));
    }

    /**
     * Same as {@link #parseField(String, FieldKind)} but keeps every subentry in comma order,
     * duplicates included.
     */
    public static @NotNull ImmutableList<FieldSubentry> parseSubentries(String fieldText, @NotNull FieldKind kind)
            throws MalformedFieldException {
        if (fieldText == null || fieldText.trim().isEmpty()) {
            throw new MalformedFieldException("Empty " + kind.fieldName() + " field", kind, fieldText);
        }
        String normalized = normalize(fieldText.trim(), kind);
        logger.trace("{} field '{}' normalized to '{}'", kind.fieldName(), fieldText, normalized);

        ImmutableList.Builder<FieldSubentry> out = ImmutableList.builder();
        for (String token : normalized.split(",", -1)) {
            parseSubentry(token, kind, fieldText, out);
        }
        return out.build();
    }

    // wildcard to full range, then names to numbers
    static String normalize(String fieldText, FieldKind kind) throws MalformedFieldException {
        String text = fieldText.replace("*", kind.starRange()).toUpperCase(Locale.ROOT);
        switch (kind) {
            case MONTH:
                return replaceNames(text, MONTH_NAMES, kind, fieldText);
            case DAY_OF_WEEK:
                return replaceNames(text, DAY_NAMES, kind, fieldText);
            default:
                return text;
        }
    }

    private static String replaceNames(String text, Map<String, Integer> names, FieldKind kind, String fieldText)
            throws MalformedFieldException {
        Matcher m = NAME.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Integer value = names.get(m.group());
            if (value == null) {
                throw new MalformedFieldException(
                        "Unknown " + kind.fieldName() + " name '" + m.group() + "'", kind, fieldText);
            }
            m.appendReplacement(sb, String.valueOf(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static void parseSubentry(String token, FieldKind kind, String fieldText,
                                      ImmutableList.Builder<FieldSubentry> out) throws MalformedFieldException {
        if (token.isEmpty()) {
            throw new MalformedFieldException("Empty subentry in " + kind.fieldName() + " field", kind, fieldText);
        }
        String[] stepParts = token.split("/", -1);
        if (stepParts.length > 2) {
            throw new MalformedFieldException("More than one '/' in '" + token + "'", kind, fieldText);
        }
        boolean stepGiven = stepParts.length == 2;
        int step = stepGiven && !stepParts[1].isEmpty() ? parseInt(stepParts[1], kind, fieldText) : 1;
        if (step < 1) {
            throw new MalformedFieldException("Step must be >= 1 in '" + token + "'", kind, fieldText);
        }

        String[] rangeParts = stepParts[0].split("-", -1);
        if (rangeParts.length > 2) {
            throw new MalformedFieldException("More than one '-' in '" + token + "'", kind, fieldText);
        }
        int start = parseInt(rangeParts[0], kind, fieldText);
        int end;
        if (rangeParts.length == 2) {
            end = parseInt(rangeParts[1], kind, fieldText);
        } else {
            if (stepGiven && kind == FieldKind.DAY_OF_WEEK && start == SUNDAY_ALIAS) {
                // 7/S runs from Sunday to the end of the week, same as 0/S
                start = kind.min();
            }
            end = stepGiven ? kind.max() : start;
        }

        if (kind == FieldKind.DAY_OF_WEEK) {
            addDayOfWeek(start, end, step, token, fieldText, out);
            return;
        }
        checkRange(start, end, kind, token, fieldText);
        out.add(new FieldSubentry(start, end, step, token));
    }

    // 7 is Sunday: fold it into 0 so every subentry stays inside 0..6
    private static void addDayOfWeek(int start, int end, int step, String token, String fieldText,
                                     ImmutableList.Builder<FieldSubentry> out) throws MalformedFieldException {
        FieldKind kind = FieldKind.DAY_OF_WEEK;
        if (start < kind.min() || end > SUNDAY_ALIAS || start > SUNDAY_ALIAS) {
            throw new MalformedFieldException("Value out of range " + kind.min() + "-" + SUNDAY_ALIAS
                    + " in '" + token + "'", kind, fieldText);
        }
        if (start > end) {
            throw new MalformedFieldException("Range start is after range end in '" + token + "'", kind, fieldText);
        }
        if (end < SUNDAY_ALIAS) {
            out.add(new FieldSubentry(start, end, step, token));
            return;
        }
        if (start == SUNDAY_ALIAS) {
            out.add(new FieldSubentry(0, 0, 1, token));
            return;
        }
        out.add(new FieldSubentry(start, kind.max(), step, token));
        if ((SUNDAY_ALIAS - start) % step == 0) {
            out.add(new FieldSubentry(0, 0, 1, token));
        }
    }

    private static void checkRange(int start, int end, FieldKind kind, String token, String fieldText)
            throws MalformedFieldException {
        if (!kind.inDomain(start) || !kind.inDomain(end)) {
            throw new MalformedFieldException("Value out of range " + kind.starRange() + " in '" + token + "'",
                    kind, fieldText);
        }
        if (start > end) {
            throw new MalformedFieldException("Range start is after range end in '" + token + "'", kind, fieldText);
        }
    }

    private static int parseInt(String s, FieldKind kind, String fieldText) throws MalformedFieldException {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new MalformedFieldException("Not an integer: '" + s + "' in " + kind.fieldName() + " field",
                    kind, fieldText, null, e);
        }
    }
}
