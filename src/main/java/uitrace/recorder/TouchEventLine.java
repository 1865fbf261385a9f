package uitrace.recorder;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One decoded line of {@code getevent -lt} output:
 * {@code [<ts>] [<dev>: ]<type> <code> <value>}.
 *
 * <p>Numeric types and codes are mapped to their symbolic names so the
 * detector only has to deal with one vocabulary.
 */
public record TouchEventLine(double timestamp, String device, String type, String code, int value) {

    public static final String EV_KEY = "EV_KEY";
    public static final String EV_ABS = "EV_ABS";

    public static final String BTN_TOUCH          = "BTN_TOUCH";
    public static final String BTN_TOOL_FINGER    = "BTN_TOOL_FINGER";
    public static final String ABS_MT_POSITION_X  = "ABS_MT_POSITION_X";
    public static final String ABS_MT_POSITION_Y  = "ABS_MT_POSITION_Y";
    public static final String ABS_MT_SLOT        = "ABS_MT_SLOT";
    public static final String ABS_MT_TRACKING_ID = "ABS_MT_TRACKING_ID";
    public static final String ABS_X              = "ABS_X";
    public static final String ABS_Y              = "ABS_Y";

    private static final Pattern LINE = Pattern.compile(
            "^\\[\\s*(\\d+\\.\\d+)]\\s+"
            + "(?:(/dev/input/event\\d+):\\s+)?"
            + "(EV_\\w+|[0-9a-f]{4})\\s+"
            + "([A-Z0-9_]+|[0-9a-f]{4})\\s+"
            + "(DOWN|UP|[0-9a-f]+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HEX4 = Pattern.compile("[0-9A-F]{4}");
    private static final Pattern HEX  = Pattern.compile("[0-9A-F]+");

    private static final Map<String, String> TYPE_NAMES = Map.of(
            "0001", EV_KEY,
            "0003", EV_ABS);

    private static final Map<String, String> CODE_NAMES = Map.of(
            "014A", BTN_TOUCH,
            "0145", BTN_TOOL_FINGER,
            "0035", ABS_MT_POSITION_X,
            "0036", ABS_MT_POSITION_Y,
            "002F", ABS_MT_SLOT,
            "0039", ABS_MT_TRACKING_ID,
            "0000", ABS_X,
            "0001", ABS_Y);

    /**
     * Parses one raw line.
     *
     * @return the decoded line, or empty if it does not match the grammar or
     *         its value cannot be decoded
     */
    public static Optional<TouchEventLine> parse(String raw) {
        if (raw == null) return Optional.empty();
        Matcher m = LINE.matcher(raw.strip());
        if (!m.lookingAt()) return Optional.empty();

        String type = m.group(3).toUpperCase(Locale.ROOT);
        type = TYPE_NAMES.getOrDefault(type, type);

        String code = m.group(4).toUpperCase(Locale.ROOT);
        if (HEX4.matcher(code).matches()) {
            code = CODE_NAMES.getOrDefault(code, code);
        }

        Integer value = decodeValue(m.group(5));
        if (value == null) return Optional.empty();

        return Optional.of(new TouchEventLine(Double.parseDouble(m.group(1)), m.group(2), type, code, value));
    }

    /**
     * {@code DOWN} → 1, {@code UP} → 0, {@code ffffffff} → -1, otherwise
     * unsigned hexadecimal, with a decimal fallback for text that is not hex.
     *
     * @return the value, or {@code null} if it does not fit in an {@code int}
     */
    static Integer decodeValue(String raw) {
        String v = raw.toUpperCase(Locale.ROOT);
        if ("DOWN".equals(v)) return 1;
        if ("UP".equals(v)) return 0;
        if ("FFFFFFFF".equals(v)) return -1;
        if (HEX.matcher(v).matches()) {
            String digits = v.replaceFirst("^0+(?=.)", "");
            if (digits.length() > 8) return null;
            long parsed = Long.parseLong(digits, 16);
            return parsed <= Integer.MAX_VALUE ? (int) parsed : null;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isKey() { return EV_KEY.equals(type); }

    public boolean isAbs() { return EV_ABS.equals(type); }
}
