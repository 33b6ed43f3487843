package ch.so.arp.rag.assistant;

import java.util.function.Supplier;

import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Translates {@link RestClientException}s raised by the HTTP clients into the
 * typed upstream failures.
 */
final class UpstreamCalls {

    private UpstreamCalls() {
    }

    static <T> T call(String service, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException ex) {
            throw new UpstreamCallException(service + " answered with HTTP " + ex.getStatusCode().value() + ": "
                    + ex.getResponseBodyAsString(), ex);
        } catch (RestClientException ex) {
            if (ex.getCause() instanceof HttpMessageConversionException) {
                throw new MalformedUpstreamResponseException(service + " returned an unreadable response: "
                        + ex.getMessage());
            }
            throw new UpstreamCallException(service + " request failed: " + ex.getMessage(), ex);
        }
    }
}
