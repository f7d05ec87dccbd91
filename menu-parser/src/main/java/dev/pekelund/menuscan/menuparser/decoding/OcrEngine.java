package dev.pekelund.menuscan.menuparser.decoding;

import java.awt.image.BufferedImage;

public interface OcrEngine {

    /**
     * Recognises the text on a page bitmap.
     *
     * @throws MenuDecodingException when recognition is unavailable or fails
     */
    OcrResult recognize(BufferedImage image);
}
