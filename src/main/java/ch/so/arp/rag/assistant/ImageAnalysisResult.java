package ch.so.arp.rag.assistant;

/**
 * Result of an image request. Image understanding is not available, so every
 * result currently reports {@code supported == false}.
 *
 * @param supported whether the capability exists in this deployment
 * @param imageUrl  the image that was submitted
 * @param message   explanation for the caller
 */
public record ImageAnalysisResult(boolean supported, String imageUrl, String message) {

    public static ImageAnalysisResult notSupported(String imageUrl) {
        return new ImageAnalysisResult(false, imageUrl, "Image recognition is not configured for this assistant.");
    }
}
