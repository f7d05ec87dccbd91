package dev.pekelund.menuscan.items;

import java.awt.image.BufferedImage;

/**
 * Rectangular area of a page bitmap that is likely to contain a photograph rather than text.
 *
 * @param x         left edge in source pixels
 * @param y         top edge in source pixels
 * @param width     width in pixels
 * @param height    height in pixels
 * @param score     image likelihood in the range 0..1
 * @param pixelData detached copy of the cropped sub-image
 */
public record ImageRegion(int x, int y, int width, int height, double score, BufferedImage pixelData) {

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    public long area() {
        return (long) width * height;
    }
}
