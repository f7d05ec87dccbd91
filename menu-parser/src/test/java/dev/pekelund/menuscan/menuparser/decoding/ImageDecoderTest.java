package dev.pekelund.menuscan.menuparser.decoding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class ImageDecoderTest {

    private final ImageDecoder decoder = new ImageDecoder();

    @Test
    void readsPngUploads() throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB), "png", output);

        BufferedImage image = decoder.read(output.toByteArray());

        assertThat(image.getWidth()).isEqualTo(40);
        assertThat(image.getHeight()).isEqualTo(30);
    }

    @Test
    void rejectsUnknownFormats() {
        assertThatThrownBy(() -> decoder.read("GIF? no".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(MenuDecodingException.class)
            .hasMessageContaining("Unsupported image format");
    }

    @Test
    void rejectsEmptyUploads() {
        assertThatThrownBy(() -> decoder.read(new byte[0])).isInstanceOf(MenuDecodingException.class);
    }
}
