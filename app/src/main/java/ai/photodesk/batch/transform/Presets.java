package ai.photodesk.batch.transform;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Registry of the built-in presets, keyed by their lower-case key.
 */
public final class Presets {

    public static final Preset EDITORIAL_WEB = new Preset("editorial_web", "Editorial Web",
            ResizeMode.FIT, 2560, 1440, OptionalInt.of(750), ImageFormat.JPEG, 85);
    public static final Preset EMAIL = new Preset("email", "Email",
            ResizeMode.FIT, 600, 2000, OptionalInt.of(80), ImageFormat.JPEG, 75);
    public static final Preset INSTAGRAM_STORY = new Preset("instagram_story", "Instagram Story",
            ResizeMode.EXACT, 1080, 1920, OptionalInt.empty(), ImageFormat.JPEG, 90);
    public static final Preset INSTAGRAM_FEED_PORTRAIT = new Preset("instagram_feed_portrait", "Instagram Feed Portrait",
            ResizeMode.EXACT, 1080, 1350, OptionalInt.empty(), ImageFormat.JPEG, 90);

    private static final Map<String, Preset> REGISTRY = new LinkedHashMap<>();

    static {
        register(EDITORIAL_WEB);
        register(EMAIL);
        register(INSTAGRAM_STORY);
        register(INSTAGRAM_FEED_PORTRAIT);
    }

    private Presets() {
    }

    public static Optional<Preset> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(REGISTRY.get(key.trim().toLowerCase(Locale.ROOT)));
    }

    public static Collection<Preset> all() {
        return REGISTRY.values();
    }

    private static void register(Preset preset) {
        REGISTRY.put(preset.key(), preset);
    }
}
