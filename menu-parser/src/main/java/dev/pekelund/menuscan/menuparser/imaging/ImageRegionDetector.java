package dev.pekelund.menuscan.menuparser.imaging;

import dev.pekelund.menuscan.items.ImageRegion;
import java.awt.image.BufferedImage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Segments a page bitmap into rectangles that are likely to hold photographs.
 *
 * <p>The page is scored cell by cell. Photographs combine high colour variance with diffuse edges while
 * printed text has low variance, so the product of normalised variance and horizontal edge density
 * separates the two without a trained model. Image-like cells are merged greedily into rectangles and the
 * rectangles are kept only when their size is plausible for a dish photo or logo.</p>
 */
public class ImageRegionDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageRegionDetector.class);

    public static final int DEFAULT_CELL_SIZE = 50;

    static final int EDGE_THRESHOLD = 100;
    static final double VARIANCE_NORMALIZATION = 5000.0;
    static final double CELL_THRESHOLD = 0.3;
    static final double MERGE_DISTANCE_FACTOR = 1.5;
    static final double MIN_AREA_RATIO = 0.01;
    static final double MAX_AREA_RATIO = 0.40;
    static final int MIN_SIDE = 80;

    private final int cellSize;

    public ImageRegionDetector() {
        this(DEFAULT_CELL_SIZE);
    }

    public ImageRegionDetector(int cellSize) {
        if (cellSize <= 1) {
            throw new IllegalArgumentException("Cell size must be greater than 1 but was " + cellSize);
        }
        this.cellSize = cellSize;
    }

    public List<ImageRegion> detect(BufferedImage image) {
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            return List.of();
        }
        List<Cell> marked = markImageLikeCells(image);
        List<Cell> bounds = mergeCells(marked);

        long pageArea = (long) image.getWidth() * image.getHeight();
        List<ImageRegion> regions = new ArrayList<>();
        for (Cell rectangle : bounds) {
            double areaRatio = (double) rectangle.width() * rectangle.height() / pageArea;
            if (areaRatio < MIN_AREA_RATIO || areaRatio > MAX_AREA_RATIO
                || rectangle.width() < MIN_SIDE || rectangle.height() < MIN_SIDE) {
                LOGGER.debug("Discarding candidate region {} (area ratio {})", rectangle, areaRatio);
                continue;
            }
            regions.add(new ImageRegion(rectangle.x(), rectangle.y(), rectangle.width(), rectangle.height(),
                rectangle.score(), crop(image, rectangle)));
        }
        LOGGER.info("Detected {} image regions from {} image-like cells on a {}x{} page", regions.size(),
            marked.size(), image.getWidth(), image.getHeight());
        return regions;
    }

    private List<Cell> markImageLikeCells(BufferedImage image) {
        List<Cell> marked = new ArrayList<>();
        for (int y = 0; y < image.getHeight(); y += cellSize) {
            for (int x = 0; x < image.getWidth(); x += cellSize) {
                int width = Math.min(cellSize, image.getWidth() - x);
                int height = Math.min(cellSize, image.getHeight() - y);
                double score = scoreCell(image, x, y, width, height);
                if (score > CELL_THRESHOLD) {
                    marked.add(new Cell(x, y, width, height, score));
                }
            }
        }
        return marked;
    }

    /**
     * Image likelihood of one cell: {@code min(1, colourVariance / normalisation) * edgeDensity}.
     */
    static double scoreCell(BufferedImage image, int x, int y, int width, int height) {
        int[] pixels = image.getRGB(x, y, width, height, null, 0, width);
        int count = pixels.length;
        double[] sum = new double[3];
        double[] sumOfSquares = new double[3];
        int edges = 0;
        for (int row = 0; row < height; row++) {
            for (int column = 0; column < width; column++) {
                int rgb = pixels[row * width + column];
                int red = (rgb >> 16) & 0xFF;
                int green = (rgb >> 8) & 0xFF;
                int blue = rgb & 0xFF;
                sum[0] += red;
                sum[1] += green;
                sum[2] += blue;
                sumOfSquares[0] += (double) red * red;
                sumOfSquares[1] += (double) green * green;
                sumOfSquares[2] += (double) blue * blue;
                if (column > 0) {
                    int previous = pixels[row * width + column - 1];
                    int delta = Math.abs(red - ((previous >> 16) & 0xFF))
                        + Math.abs(green - ((previous >> 8) & 0xFF))
                        + Math.abs(blue - (previous & 0xFF));
                    if (delta > EDGE_THRESHOLD) {
                        edges++;
                    }
                }
            }
        }

        double variance = 0;
        for (int channel = 0; channel < 3; channel++) {
            double mean = sum[channel] / count;
            variance += sumOfSquares[channel] / count - mean * mean;
        }
        variance /= 3;

        int pairs = height * (width - 1);
        double edgeDensity = pairs > 0 ? (double) edges / pairs : 0;
        return Math.min(1.0, variance / VARIANCE_NORMALIZATION) * edgeDensity;
    }

    private List<Cell> mergeCells(List<Cell> cells) {
        double mergeDistance = MERGE_DISTANCE_FACTOR * cellSize;
        boolean[] merged = new boolean[cells.size()];
        List<Cell> rectangles = new ArrayList<>();
        for (int seed = 0; seed < cells.size(); seed++) {
            if (merged[seed]) {
                continue;
            }
            merged[seed] = true;
            List<Cell> group = new ArrayList<>();
            Deque<Cell> pending = new ArrayDeque<>();
            pending.add(cells.get(seed));
            while (!pending.isEmpty()) {
                Cell current = pending.poll();
                group.add(current);
                for (int candidate = 0; candidate < cells.size(); candidate++) {
                    if (!merged[candidate] && current.distanceTo(cells.get(candidate)) <= mergeDistance) {
                        merged[candidate] = true;
                        pending.add(cells.get(candidate));
                    }
                }
            }
            rectangles.add(boundsOf(group));
        }
        return rectangles;
    }

    private static Cell boundsOf(List<Cell> group) {
        int minX = Integer.MAX_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE;
        int maxY = Integer.MIN_VALUE;
        double scoreSum = 0;
        for (Cell cell : group) {
            minX = Math.min(minX, cell.x());
            minY = Math.min(minY, cell.y());
            maxX = Math.max(maxX, cell.x() + cell.width());
            maxY = Math.max(maxY, cell.y() + cell.height());
            scoreSum += cell.score();
        }
        return new Cell(minX, minY, maxX - minX, maxY - minY, scoreSum / group.size());
    }

    private static BufferedImage crop(BufferedImage image, Cell rectangle) {
        int[] pixels = image.getRGB(rectangle.x(), rectangle.y(), rectangle.width(), rectangle.height(), null, 0,
            rectangle.width());
        BufferedImage copy = new BufferedImage(rectangle.width(), rectangle.height(), BufferedImage.TYPE_INT_RGB);
        copy.setRGB(0, 0, rectangle.width(), rectangle.height(), pixels, 0, rectangle.width());
        return copy;
    }

    private record Cell(int x, int y, int width, int height, double score) {

        double distanceTo(Cell other) {
            return Math.hypot(x - other.x, y - other.y);
        }
    }
}
