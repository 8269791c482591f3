package app.slidecraft.pipeline.compile;

import app.slidecraft.pipeline.config.S3Props;
import app.slidecraft.pipeline.error.ResolutionException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a stored image reference back to a container and key of the configured bucket.
 * <p>
 * Accepted shapes:
 * <ul>
 *     <li>{@code s3://container/key}</li>
 *     <li>{@code https://container.s3.amazonaws.com/key}, with an optional region
 *     ({@code .s3.region.}, {@code .s3-region.}) or {@code dualstack} infix</li>
 *     <li>{@code https://s3.region.amazonaws.com/container/key}</li>
 *     <li>{@code https://custom-endpoint/container/key} and {@code https://container.custom-endpoint/key}</li>
 *     <li>a bare key</li>
 * </ul>
 * Account qualifiers appended to the container name ({@code -123456789012} or a configured value)
 * are ignored when matching against the bucket.
 */
@Component
public class StorageReferenceResolver {

    private static final Pattern VIRTUAL_HOSTED = Pattern.compile(
            "^(?<container>.+?)\\.s3(?:[.-][a-z0-9-]+)*\\.amazonaws\\.com(?:\\.cn)?$");
    private static final Pattern PATH_STYLE = Pattern.compile(
            "^s3(?:[.-][a-z0-9-]+)*\\.amazonaws\\.com(?:\\.cn)?$");
    private static final Pattern NUMERIC_QUALIFIER = Pattern.compile("-\\d{10,}$");

    private final String bucket;
    private final String endpointHost;
    private final List<String> accountQualifiers;

    @Autowired
    public StorageReferenceResolver(S3Props props) {
        this(props.bucket(), props.endpoint(), props.accountQualifiers());
    }

    public StorageReferenceResolver(String bucket, String endpoint, List<String> accountQualifiers) {
        this.bucket = bucket;
        this.endpointHost = hostOf(endpoint);
        this.accountQualifiers = accountQualifiers == null
                ? List.of()
                : accountQualifiers.stream()
                .filter(q -> q != null && !q.isBlank())
                .map(q -> q.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public StorageLocation resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new ResolutionException("Empty storage reference");
        }
        String ref = reference.trim();
        StorageLocation parsed;
        if (ref.regionMatches(true, 0, "s3://", 0, 5)) {
            parsed = splitContainer(ref.substring(5), ref);
        } else if (ref.regionMatches(true, 0, "http://", 0, 7) || ref.regionMatches(true, 0, "https://", 0, 8)) {
            parsed = parseUrl(ref);
        } else {
            parsed = new StorageLocation(bucket, stripLeadingSlash(ref));
        }
        if (parsed.key().isBlank()) {
            throw new ResolutionException("Storage reference has no object key: " + ref);
        }
        if (!canonicalContainer(parsed.container()).equals(canonicalContainer(bucket))) {
            throw new ResolutionException(
                    "Storage reference points at container " + parsed.container() + ", expected " + bucket);
        }
        return new StorageLocation(bucket, parsed.key());
    }

    // qualifiers stack in any order, e.g. name-dev-123456789012
    String canonicalContainer(String container) {
        String name = container.toLowerCase(Locale.ROOT);
        String previous;
        do {
            previous = name;
            name = stripQualifiers(name);
        } while (!name.equals(previous));
        return name;
    }

    private String stripQualifiers(String name) {
        String stripped = name;
        for (String qualifier : accountQualifiers) {
            if (stripped.endsWith("-" + qualifier)) {
                stripped = stripped.substring(0, stripped.length() - qualifier.length() - 1);
            } else if (stripped.startsWith(qualifier + "-")) {
                stripped = stripped.substring(qualifier.length() + 1);
            }
        }
        Matcher numeric = NUMERIC_QUALIFIER.matcher(stripped);
        if (numeric.find()) {
            stripped = stripped.substring(0, numeric.start());
        }
        return stripped;
    }

    private StorageLocation parseUrl(String ref) {
        URI uri;
        try {
            uri = new URI(ref);
        } catch (URISyntaxException ex) {
            throw new ResolutionException("Malformed storage URL: " + ex.getReason(), ex);
        }
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        String path = stripLeadingSlash(decode(uri.getRawPath()));

        if (PATH_STYLE.matcher(host).matches()) {
            return splitContainer(path, ref);
        }
        Matcher virtualHosted = VIRTUAL_HOSTED.matcher(host);
        if (virtualHosted.matches()) {
            return new StorageLocation(virtualHosted.group("container"), path);
        }
        if (endpointHost != null) {
            if (host.equals(endpointHost)) {
                return splitContainer(path, ref);
            }
            if (host.endsWith("." + endpointHost)) {
                return new StorageLocation(host.substring(0, host.length() - endpointHost.length() - 1), path);
            }
        }
        throw new ResolutionException("Unrecognized storage host: " + host);
    }

    private StorageLocation splitContainer(String path, String ref) {
        String trimmed = stripLeadingSlash(path);
        int slash = trimmed.indexOf('/');
        if (slash <= 0) {
            throw new ResolutionException("Storage reference has no object key: " + ref);
        }
        return new StorageLocation(trimmed.substring(0, slash), trimmed.substring(slash + 1));
    }

    private static String decode(String rawPath) {
        if (rawPath == null) {
            return "";
        }
        return URLDecoder.decode(rawPath.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private static String stripLeadingSlash(String value) {
        String result = value;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        return result;
    }

    private static String hostOf(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return null;
        }
        String value = endpoint.trim();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        String host = URI.create(value).getHost();
        return host == null ? null : host.toLowerCase(Locale.ROOT);
    }
}
