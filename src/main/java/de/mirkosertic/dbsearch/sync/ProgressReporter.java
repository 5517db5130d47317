package de.mirkosertic.dbsearch.sync;

import de.mirkosertic.dbsearch.settings.SearchSettings;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns the shared indexed-counters into bounded progress figures.
 * <p>
 * Counters can run ahead of the store totals or below zero for a while, because several
 * processes add to them while the totals are read separately. Percentages are therefore
 * clamped to [0, 100], and a counter at or above its total is reported as the total.
 * Nothing is written back.
 */
public final class ProgressReporter {

    private ProgressReporter() {
    }

    public static ProgressView progress(final SearchSettings settings, final IndexTotals totals) {
        return new ProgressView(
                percent(settings.topicsIndexed(), totals.topicCount()),
                percent(settings.postsIndexed(), totals.postCount()),
                indexed(settings.topicsIndexed(), totals.topicCount()),
                indexed(settings.postsIndexed(), totals.postCount()),
                settings.working()
        );
    }

    static double percent(final long indexed, final long total) {
        if (total <= 0) {
            return 0;
        }
        final double rounded = BigDecimal.valueOf(indexed * 100.0 / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
        return Math.max(0, Math.min(100, rounded));
    }

    static long indexed(final long indexed, final long total) {
        if (indexed >= total) {
            return Math.max(0, total);
        }
        return Math.max(0, indexed);
    }
}
