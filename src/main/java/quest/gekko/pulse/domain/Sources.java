package quest.gekko.pulse.domain;

import java.util.Locale;
import java.util.regex.Pattern;

public final class Sources {
    /** All non-survey platforms combined. */
    public static final String SOCIAL = "social";
    public static final String SURVEY = "survey";

    private static final Pattern PLATFORM_TAG = Pattern.compile("[a-z0-9][a-z0-9_-]{0,31}");

    private Sources() {}

    public static String normalize(String source) {
        return source == null ? null : source.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String source) {
        return source != null && PLATFORM_TAG.matcher(source).matches();
    }

    public static boolean isPlatform(String source) {
        return isValid(source) && !SOCIAL.equals(source) && !SURVEY.equals(source);
    }
}
