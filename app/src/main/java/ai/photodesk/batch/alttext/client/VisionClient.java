package ai.photodesk.batch.alttext.client;

/**
 * Remote model that turns an image into a textual description.
 */
@FunctionalInterface
public interface VisionClient {

    /**
     * @return the model's text answer, stripped of surrounding whitespace
     * @throws VisionApiException for every failed call, classified by {@link VisionFailure}
     */
    String describe(VisionRequest request);
}
