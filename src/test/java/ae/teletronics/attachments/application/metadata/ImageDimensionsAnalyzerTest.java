package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.application.exceptions.InvalidFileException;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.StreamSource;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

import static org.assertj.core.api.Assertions.*;

class ImageDimensionsAnalyzerTest {

    private static StreamSource png(int width, int height) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), "png", out);
        byte[] data = out.toByteArray();
        return () -> new ByteArrayInputStream(data);
    }

    @Test
    void adds_width_and_height_for_images() throws Exception {
        FileMetadata.Builder metadata = FileMetadata.builder().mimeType("image/png");

        new ImageDimensionsAnalyzer().analyze(png(40, 30), UploadContext.empty(), metadata);

        FileMetadata built = metadata.build();
        assertThat(built.get(ImageDimensionsAnalyzer.WIDTH)).contains(40L);
        assertThat(built.get(ImageDimensionsAnalyzer.HEIGHT)).contains(30L);
    }

    @Test
    void skips_non_images() throws Exception {
        FileMetadata.Builder metadata = FileMetadata.builder().mimeType("text/plain");

        new ImageDimensionsAnalyzer(true).analyze(png(1, 1), UploadContext.empty(), metadata);

        assertThat(metadata.build().extra()).isEmpty();
    }

    @Test
    void unreadable_image_is_left_out_unless_required() throws Exception {
        StreamSource garbage = () -> new ByteArrayInputStream("not an image".getBytes());
        FileMetadata.Builder metadata = FileMetadata.builder().mimeType("image/png");

        new ImageDimensionsAnalyzer().analyze(garbage, UploadContext.empty(), metadata);
        assertThat(metadata.build().extra()).isEmpty();

        assertThatThrownBy(() -> new ImageDimensionsAnalyzer(true)
                .analyze(garbage, UploadContext.empty(), FileMetadata.builder().mimeType("image/png")))
                .isInstanceOf(InvalidFileException.class)
                .hasMessage("image dimensions could not be determined");
    }
}
