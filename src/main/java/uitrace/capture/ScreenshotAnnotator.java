package uitrace.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.model.BoundingRect;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Produces the boxed screenshot: the raw screenshot with the acted-upon
 * control outlined in red.
 */
public class ScreenshotAnnotator {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotAnnotator.class);

    /** Outline width; the rectangle is grown by 0..WIDTH-1 pixels. */
    static final int OUTLINE_WIDTH = 4;

    /**
     * Writes {@code boxed}: an outlined copy of {@code raw} when a rectangle
     * is given and drawing succeeds, else a verbatim copy.
     *
     * @return whether an outline was drawn
     * @throws IOException if even the verbatim copy fails
     */
    public boolean annotate(Path raw, Path boxed, BoundingRect rect) throws IOException {
        if (rect != null) {
            try {
                drawOutline(raw, boxed, rect);
                return true;
            } catch (IOException | RuntimeException e) {
                log.warn("Drawing outline on {} failed, copying raw: {}", raw.getFileName(), e.getMessage());
            }
        }
        Files.copy(raw, boxed, StandardCopyOption.REPLACE_EXISTING);
        return false;
    }

    void drawOutline(Path raw, Path boxed, BoundingRect rect) throws IOException {
        BufferedImage source = ImageIO.read(raw.toFile());
        if (source == null) {
            throw new IOException("not a readable image: " + raw);
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
            g.setColor(Color.RED);
            for (int i = 0; i < OUTLINE_WIDTH; i++) {
                int x = rect.x1() - i;
                int y = rect.y1() - i;
                g.drawRect(x, y, (rect.x2() + i) - x, (rect.y2() + i) - y);
            }
        } finally {
            g.dispose();
        }
        if (!ImageIO.write(rgb, "png", boxed.toFile())) {
            throw new IOException("no PNG writer available");
        }
    }
}
