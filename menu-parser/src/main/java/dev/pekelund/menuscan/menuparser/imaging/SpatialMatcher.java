package dev.pekelund.menuscan.menuparser.imaging;

import dev.pekelund.menuscan.items.ImageRegion;
import dev.pekelund.menuscan.items.OcrWord;
import dev.pekelund.menuscan.items.ParsedItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches each item to the detected image region closest to where its name was printed.
 *
 * <p>Assignment is greedy nearest-neighbour and not one-to-one: a single dish photo may illustrate several
 * line items, and items without a region within the proximity threshold stay without an image.</p>
 */
public class SpatialMatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpatialMatcher.class);

    public static final double DEFAULT_MAX_DISTANCE = 300.0;

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

    private final double maxDistance;

    public SpatialMatcher() {
        this(DEFAULT_MAX_DISTANCE);
    }

    public SpatialMatcher(double maxDistance) {
        this.maxDistance = maxDistance;
    }

    public List<ParsedItem> match(List<ParsedItem> items, List<OcrWord> words, List<ImageRegion> regions) {
        if (items.isEmpty() || words.isEmpty() || regions.isEmpty()) {
            return items;
        }
        List<ParsedItem> matched = new ArrayList<>(items.size());
        int assigned = 0;
        for (ParsedItem item : items) {
            Optional<ImageRegion> region = locate(item, words).flatMap(centroid -> nearestRegion(centroid, regions));
            if (region.isPresent()) {
                matched.add(item.withImage(region.get()));
                assigned++;
            } else {
                matched.add(item);
            }
        }
        LOGGER.info("Matched {} of {} items to {} image regions", assigned, items.size(), regions.size());
        return matched;
    }

    Optional<Point> locate(ParsedItem item, List<OcrWord> words) {
        String name = item.name().toLowerCase(Locale.ROOT);
        double sumX = 0;
        double sumY = 0;
        int count = 0;
        for (OcrWord word : words) {
            if (word.text() == null || word.bbox() == null) {
                continue;
            }
            String text = EDGE_PUNCTUATION.matcher(word.text().toLowerCase(Locale.ROOT)).replaceAll("");
            if (text.length() < 2 || text.chars().noneMatch(Character::isLetter)) {
                continue;
            }
            if (name.contains(text) || text.contains(name)) {
                sumX += word.bbox().centerX();
                sumY += word.bbox().centerY();
                count++;
            }
        }
        return count == 0 ? Optional.empty() : Optional.of(new Point(sumX / count, sumY / count));
    }

    private Optional<ImageRegion> nearestRegion(Point centroid, List<ImageRegion> regions) {
        ImageRegion nearest = null;
        double nearestDistance = Double.MAX_VALUE;
        for (ImageRegion region : regions) {
            double distance = Math.hypot(region.centerX() - centroid.x(), region.centerY() - centroid.y());
            if (distance < nearestDistance) {
                nearest = region;
                nearestDistance = distance;
            }
        }
        return nearestDistance < maxDistance ? Optional.ofNullable(nearest) : Optional.empty();
    }

    record Point(double x, double y) { }
}
