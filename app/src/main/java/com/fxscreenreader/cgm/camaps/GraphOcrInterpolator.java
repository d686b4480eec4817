package com.fxscreenreader.cgm.camaps;

import com.fxscreenreader.models.GraphTreatment;
import com.fxscreenreader.models.OcrTextBlock;
import com.fxscreenreader.models.TimeLabel;
import com.fxscreenreader.models.UserError;
import com.fxscreenreader.utilitymodels.Constants;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estimates when carbohydrate markers on the landscape glucose graph were entered, by linear
 * interpolation between the HH:MM labels of the time axis.
 */
public class GraphOcrInterpolator {

    private static final String TAG = GraphOcrInterpolator.class.getSimpleName();

    private static final Pattern TIME_PATTERN = Pattern.compile("(\\d{2}):(\\d{2})");
    private static final Pattern CARBS_PATTERN = Pattern.compile("(?<!m)(\\d{1,3})\\s*g\\b", Pattern.CASE_INSENSITIVE);

    static final int BUCKET_HEIGHT = 100;
    static final int AXIS_TOLERANCE = 100;
    static final int DEFAULT_AXIS_THRESHOLD = 500;
    static final int MIN_CARBS = 1;
    static final int MAX_CARBS = 200;
    private static final long FUTURE_TOLERANCE_MS = 10 * Constants.MINUTE_IN_MS;

    private final ZoneId zone;

    public GraphOcrInterpolator() {
        this(ZoneId.systemDefault());
    }

    public GraphOcrInterpolator(final ZoneId zone) {
        this.zone = zone;
    }

    private static final class Carbs {
        final int grams;
        final int x;

        Carbs(final int grams, final int x) {
            this.grams = grams;
            this.x = x;
        }
    }

    public List<GraphTreatment> interpolate(final List<OcrTextBlock> blocks, final long now) {
        final List<GraphTreatment> treatments = new ArrayList<>();
        if (blocks == null || blocks.isEmpty()) return treatments;

        final int threshold = axisThreshold(blocks);

        final List<TimeLabel> labels = new ArrayList<>();
        final List<Carbs> markers = new ArrayList<>();
        for (final OcrTextBlock block : blocks) {
            final String text = block.getText() == null ? "" : block.getText().trim();
            if (block.getTop() >= threshold) {
                final TimeLabel label = timeLabel(text, block.centerX());
                if (label != null) labels.add(label);
            } else {
                final Matcher matcher = CARBS_PATTERN.matcher(text);
                if (matcher.find()) {
                    final int grams = Integer.parseInt(matcher.group(1));
                    if (grams >= MIN_CARBS && grams <= MAX_CARBS) {
                        markers.add(new Carbs(grams, block.centerX()));
                        UserError.Log.d(TAG, "Carbs marker " + grams + "g at x=" + block.centerX());
                    }
                }
            }
        }

        labels.sort(Comparator.comparingInt(TimeLabel::getXPosition));
        if (labels.size() < 2) {
            UserError.Log.d(TAG, "Not enough time labels for interpolation: " + labels.size());
            return treatments;
        }

        for (final Carbs marker : markers) {
            final Long timestamp = interpolateTime(marker.x, labels, now);
            if (timestamp != null) {
                treatments.add(GraphTreatment.carbs(marker.grams, timestamp));
            } else {
                UserError.Log.d(TAG, "Could not place carbs marker " + marker.grams + "g at x=" + marker.x);
            }
        }
        return treatments;
    }

    /**
     * Upper edge of the time axis: the average top of the most populated label row, less a tolerance.
     */
    static int axisThreshold(final List<OcrTextBlock> blocks) {
        final Map<Integer, List<Integer>> rows = new LinkedHashMap<>();
        for (final OcrTextBlock block : blocks) {
            final String text = block.getText() == null ? "" : block.getText().trim();
            if (timeLabel(text, 0) != null) {
                rows.computeIfAbsent((block.getTop() / BUCKET_HEIGHT) * BUCKET_HEIGHT, k -> new ArrayList<>()).add(block.getTop());
            }
        }
        List<Integer> largest = null;
        for (final List<Integer> row : rows.values()) {
            if (largest == null || row.size() > largest.size()) largest = row;
        }
        if (largest == null) {
            return DEFAULT_AXIS_THRESHOLD;
        }
        long sum = 0;
        for (final int top : largest) sum += top;
        final int average = (int) (sum / largest.size());
        UserError.Log.d(TAG, "Time axis around y=" + average + " (" + largest.size() + " labels)");
        return average - AXIS_TOLERANCE;
    }

    private static TimeLabel timeLabel(final String text, final int x) {
        final Matcher matcher = TIME_PATTERN.matcher(text);
        if (!matcher.find()) return null;
        final int hour = Integer.parseInt(matcher.group(1));
        final int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) return null;
        return new TimeLabel(hour, minute, x);
    }

    Long interpolateTime(final int x, final List<TimeLabel> labels, final long now) {
        TimeLabel left = null;
        TimeLabel right = null;
        for (int i = 0; i < labels.size() - 1; i++) {
            if (labels.get(i).getXPosition() <= x && labels.get(i + 1).getXPosition() >= x) {
                left = labels.get(i);
                right = labels.get(i + 1);
                break;
            }
        }
        if (left == null) {
            if (x < labels.get(0).getXPosition()) {
                left = labels.get(0);
                right = labels.get(1);
            } else {
                left = labels.get(labels.size() - 2);
                right = labels.get(labels.size() - 1);
            }
        }

        final int xRange = right.getXPosition() - left.getXPosition();
        if (xRange <= 0) return null;
        final double fraction = (double) (x - left.getXPosition()) / xRange;

        final int leftMinutes = left.minuteOfDay();
        int rightMinutes = right.minuteOfDay();
        if (rightMinutes < leftMinutes) {
            rightMinutes += Constants.MINUTES_PER_DAY;
        }
        final double interpolated = leftMinutes + (rightMinutes - leftMinutes) * fraction;
        final int minuteOfDay = Math.floorMod((int) Math.floor(interpolated), Constants.MINUTES_PER_DAY);

        final ZonedDateTime current = Instant.ofEpochMilli(now).atZone(zone);
        ZonedDateTime estimated = current.with(LocalTime.of(minuteOfDay / 60, minuteOfDay % 60));
        if (estimated.toInstant().toEpochMilli() > now + FUTURE_TOLERANCE_MS) {
            estimated = estimated.minusDays(1);
        }
        return estimated.toInstant().toEpochMilli();
    }
}
