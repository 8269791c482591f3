package app.slidecraft.pipeline.image;

import app.slidecraft.pipeline.domain.type.PresentationStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the fallback slide image: style background, accent band and the slide title.
 * Output depends only on the arguments.
 */
@Component
public class PlaceholderRenderer {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderRenderer.class);
    private static final int MAX_LINES = 3;

    public byte[] render(String title, PresentationStyle style, int width, int height) {
        PresentationStyle palette = style == null ? PresentationStyle.DEFAULT : style;
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(palette.background());
            graphics.fillRect(0, 0, width, height);
            graphics.setColor(palette.accent());
            graphics.fillRect(0, height - Math.max(height / 24, 4), width, Math.max(height / 24, 4));
            drawTitle(graphics, title, palette.primary(), width, height);
        } finally {
            graphics.dispose();
        }
        return encodePng(image);
    }

    private void drawTitle(Graphics2D graphics, String title, Color color, int width, int height) {
        String text = title == null || title.isBlank() ? "Image unavailable" : title.trim();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_OFF);
            graphics.setFont(new Font(Font.SANS_SERIF, Font.BOLD, Math.max(height / 14, 12)));
            graphics.setColor(color);
            FontMetrics metrics = graphics.getFontMetrics();
            List<String> lines = wrap(text, metrics, (int) (width * 0.8));
            int lineHeight = metrics.getHeight();
            int y = (height - lineHeight * lines.size()) / 2 + metrics.getAscent();
            for (String line : lines) {
                int x = (width - metrics.stringWidth(line)) / 2;
                graphics.drawString(line, x, y);
                y += lineHeight;
            }
        } catch (RuntimeException | Error ex) {
            // minimal JREs can ship without a usable font configuration
            log.warn("Placeholder title rendering skipped errorType={}", ex.getClass().getSimpleName());
        }
    }

    private List<String> wrap(String text, FontMetrics metrics, int maxWidth) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split("\\s+")) {
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (metrics.stringWidth(candidate) <= maxWidth || current.length() == 0) {
                current.setLength(0);
                current.append(candidate);
                continue;
            }
            lines.add(current.toString());
            current.setLength(0);
            current.append(word);
            if (lines.size() == MAX_LINES) {
                break;
            }
        }
        if (current.length() > 0 && lines.size() < MAX_LINES) {
            lines.add(current.toString());
        }
        return lines;
    }

    private byte[] encodePng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to encode placeholder image", ex);
        }
    }
}
