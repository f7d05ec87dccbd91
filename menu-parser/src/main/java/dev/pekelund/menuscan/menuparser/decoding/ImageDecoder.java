package dev.pekelund.menuscan.menuparser.decoding;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.springframework.stereotype.Component;

@Component
public class ImageDecoder {

    public BufferedImage read(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new MenuDecodingException("Cannot decode an empty image");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException ex) {
            throw new MenuDecodingException("Failed to read image", ex);
        }
        if (image == null) {
            throw new MenuDecodingException("Unsupported image format");
        }
        return image;
    }
}
