package uitrace.device;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the foreground activity from {@code dumpsys activity} output.
 */
public final class ActivityParser {

    private static final Pattern RESUMED  = Pattern.compile("mResumedActivity:\\s*(.*?)\\n");
    private static final Pattern FOCUSED  = Pattern.compile("mFocusedActivity:\\s*(.*?)\\n");
    private static final Pattern COMPONENT = Pattern.compile("\\s([\\w.]+)/(\\.?[\\w.$]+)");

    private ActivityParser() {}

    /**
     * Reads the {@code mResumedActivity} line, falling back to
     * {@code mFocusedActivity}. A component written as {@code pkg/.Act} is
     * expanded to {@code pkg.Act}.
     *
     * @return the activity name, the raw line when it holds no component, or
     *         {@code null} when neither line is present
     */
    public static String parse(String dumpsys) {
        if (dumpsys == null) return null;
        String text = dumpsys.endsWith("\n") ? dumpsys : dumpsys + "\n";
        Matcher m = RESUMED.matcher(text);
        if (!m.find()) {
            m = FOCUSED.matcher(text);
            if (!m.find()) return null;
        }
        String line = m.group(1);
        Matcher c = COMPONENT.matcher(line);
        if (c.find()) {
            String pkg = c.group(1);
            String act = c.group(2);
            return act.startsWith(".") ? pkg + act : act;
        }
        String trimmed = line.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
