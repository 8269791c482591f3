package app.slidecraft.pipeline.provider.stub;

import app.slidecraft.pipeline.provider.GeneratedImage;
import app.slidecraft.pipeline.provider.ImageGenerationEndpoint;
import app.slidecraft.pipeline.provider.ImagePrompt;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.GradientPaint;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Offline endpoint producing a gradient whose colours are derived from the prompt.
 */
@Component
@ConditionalOnProperty(name = "app.pipeline.image-provider", havingValue = "stub", matchIfMissing = true)
public class StubImageEndpoint implements ImageGenerationEndpoint {

    @Override
    public String provider() {
        return "stub";
    }

    @Override
    public String model() {
        return "stub-gradient";
    }

    @Override
    public GeneratedImage generate(ImagePrompt prompt) {
        int hash = prompt.prompt() == null ? 0 : prompt.prompt().hashCode();
        Color from = new Color(hash & 0xFFFFFF);
        Color to = new Color(Integer.rotateLeft(hash, 12) & 0xFFFFFF);

        BufferedImage image = new BufferedImage(prompt.width(), prompt.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setPaint(new GradientPaint(0, 0, from, prompt.width(), prompt.height(), to));
            graphics.fillRect(0, 0, prompt.width(), prompt.height());
        } finally {
            graphics.dispose();
        }
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return new GeneratedImage(out.toByteArray(), "image/png", model());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to encode stub image", ex);
        }
    }
}
