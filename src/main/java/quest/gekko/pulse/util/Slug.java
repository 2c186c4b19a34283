package quest.gekko.pulse.util;

import java.util.Locale;

public final class Slug {
    private Slug() {}

    /** "Stranger Things" becomes "stranger-things". */
    public static String of(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
    }
}
