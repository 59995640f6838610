package ai.photodesk.batch.transform;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * File extensions accepted into the processing queue.
 */
public final class SupportedImageTypes {

    public static final Set<String> EXTENSIONS = Set.of("jpg", "jpeg", "png", "tif", "tiff");

    private SupportedImageTypes() {
    }

    public static boolean isSupported(Path path) {
        return path != null && EXTENSIONS.contains(extensionOf(path));
    }

    public static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String stemOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
