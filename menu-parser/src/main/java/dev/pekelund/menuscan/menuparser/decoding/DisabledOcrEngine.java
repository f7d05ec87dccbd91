package dev.pekelund.menuscan.menuparser.decoding;

import java.awt.image.BufferedImage;

/**
 * Engine used when OCR is switched off; image uploads fail to decode.
 */
public class DisabledOcrEngine implements OcrEngine {

    @Override
    public OcrResult recognize(BufferedImage image) {
        throw new MenuDecodingException("OCR is disabled; image menus cannot be decoded");
    }
}
