package org.depscope.source;

import java.io.IOException;

/**
 * Fetches the body of a URL as text.
 */
@FunctionalInterface
public interface TextFetcher {

    /**
     * @param url The absolute http(s) URL.
     * @return The response body.
     * @throws IOException If the request fails or the status is not 200.
     */
    String fetch(String url) throws IOException;

    static boolean isHttpUrl(String path) {
        return path != null && (path.startsWith("http://") || path.startsWith("https://"));
    }
}
