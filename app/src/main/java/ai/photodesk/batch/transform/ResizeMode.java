package ai.photodesk.batch.transform;

/**
 * How a preset maps source dimensions onto its target box.
 */
public enum ResizeMode {
    /** Shrink to fit inside the box keeping the aspect ratio; never enlarge. */
    FIT,
    /** Scale and centre-crop to exactly the box. */
    EXACT
}
