package app.slidecraft.pipeline.domain.type;

import java.awt.Color;
import java.util.Locale;
import java.util.Optional;

public enum PresentationStyle {
    PROFESSIONAL(new Color(240, 240, 250), new Color(0, 51, 102), new Color(255, 102, 0)),
    CASUAL(new Color(255, 248, 231), new Color(68, 68, 68), new Color(46, 160, 67)),
    ACADEMIC(new Color(250, 250, 245), new Color(51, 51, 51), new Color(128, 0, 32)),
    CREATIVE(new Color(245, 238, 255), new Color(75, 0, 130), new Color(255, 64, 129));

    public static final PresentationStyle DEFAULT = PROFESSIONAL;

    private final Color background;
    private final Color primary;
    private final Color accent;

    PresentationStyle(Color background, Color primary, Color accent) {
        this.background = background;
        this.primary = primary;
        this.accent = accent;
    }

    public Color background() {
        return background;
    }

    public Color primary() {
        return primary;
    }

    public Color accent() {
        return accent;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PresentationStyle> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(DEFAULT);
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (PresentationStyle style : values()) {
            if (style.name().equals(normalized)) {
                return Optional.of(style);
            }
        }
        return Optional.empty();
    }
}
