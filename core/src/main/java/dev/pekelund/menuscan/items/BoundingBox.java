package dev.pekelund.menuscan.items;

/**
 * Pixel rectangle locating a token on a page, expressed as its two corners.
 */
public record BoundingBox(int x0, int y0, int x1, int y1) {

    public static BoundingBox of(int x, int y, int width, int height) {
        return new BoundingBox(x, y, x + width, y + height);
    }

    public double centerX() {
        return (x0 + x1) / 2.0;
    }

    public double centerY() {
        return (y0 + y1) / 2.0;
    }
}
