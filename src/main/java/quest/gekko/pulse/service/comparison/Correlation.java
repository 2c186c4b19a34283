package quest.gekko.pulse.service.comparison;

import java.util.List;

final class Correlation {
    private Correlation() {}

    /**
     * Pearson correlation of paired values, or null with fewer than {@code minPairs} pairs
     * or when either side has no variance.
     */
    static Double pearson(List<double[]> pairs, int minPairs) {
        int n = pairs.size();
        if (n < minPairs) return null;
        double sx = 0, sy = 0;
        for (double[] p : pairs) {
            sx += p[0];
            sy += p[1];
        }
        double mx = sx / n, my = sy / n;
        double cov = 0, vx = 0, vy = 0;
        for (double[] p : pairs) {
            double dx = p[0] - mx, dy = p[1] - my;
            cov += dx * dy;
            vx += dx * dx;
            vy += dy * dy;
        }
        if (vx == 0 || vy == 0) return null;
        double r = cov / Math.sqrt(vx * vy);
        r = Math.max(-1.0, Math.min(1.0, r));
        return Math.round(r * 1_000_000d) / 1_000_000d;
    }
}
