package dev.pekelund.menuscan.items;

/**
 * A single word recognised by the OCR engine together with its position on the page.
 *
 * @param text       recognised text
 * @param bbox       location of the word in source pixels
 * @param confidence engine confidence in the range 0..100
 */
public record OcrWord(String text, BoundingBox bbox, double confidence) {
}
