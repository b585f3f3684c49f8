package io.github.rtdb;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Address and path normalisation, and request URL rendering.
 */
final class Urls {

    private static final String JSON_SUFFIX = ".json";

    private Urls() {
    }

    /**
     * Adds {@code https://} when no scheme is given and drops a trailing slash.
     */
    static String sanitizeUrl(String url) {
        String s = url;
        if (!s.startsWith("https://") && !s.startsWith("http://")) {
            s = "https://" + s;
        }
        if (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    /**
     * Strips surrounding slashes and a {@code .json} suffix.
     * {@code "/foo/.json"}, {@code "foo/"} and {@code "foo.json"} all become {@code "foo"}.
     */
    static String sanitizePath(String path) {
        String s = trimSlashes(path);
        if (s.endsWith(JSON_SUFFIX)) {
            s = s.substring(0, s.length() - JSON_SUFFIX.length());
        }
        if (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    /**
     * Renders {@code <address>/.json[?<params>]}. Parameters are expected in a stable order.
     */
    static String render(String address, Map<String, String> params) {
        StringBuilder url = new StringBuilder(address).append("/").append(JSON_SUFFIX);
        if (!params.isEmpty()) {
            url.append('?');
            boolean first = true;
            for (Map.Entry<String, String> param : params.entrySet()) {
                if (!first) {
                    url.append('&');
                }
                url.append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
                        .append('=')
                        .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
                first = false;
            }
        }
        return url.toString();
    }

    /**
     * Drops the query string, so URLs carrying an auth secret can be logged.
     */
    static String withoutQuery(String url) {
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q);
    }

    static String encodePath(String path) {
        // encode each segment but preserve slashes
        // use URI encoding (spaces -> %20) not form encoding (spaces -> +)
        StringBuilder encoded = new StringBuilder();
        for (String segment : path.split("/", -1)) {
            if (encoded.length() > 0) {
                encoded.append("/");
            }
            String formEncoded = URLEncoder.encode(segment, StandardCharsets.UTF_8);
            encoded.append(formEncoded.replace("+", "%20"));
        }
        return encoded.toString();
    }

    private static String trimSlashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '/') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '/') {
            end--;
        }
        return s.substring(start, end);
    }
}
