package ai.photodesk.batch.transform;

/**
 * Output encodings a preset can produce.
 */
public enum ImageFormat {
    JPEG("jpg"),
    PNG("png");

    private final String extension;

    ImageFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public boolean supportsQuality() {
        return this == JPEG;
    }
}
