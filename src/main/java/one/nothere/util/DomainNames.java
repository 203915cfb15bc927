package one.nothere.util;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Locale;
import java.util.Optional;

/**
 * Host and domain helpers shared by the blocklist, crawler and scorers.
 */
public final class DomainNames {

    private static final String WWW_PREFIX = "www.";

    private DomainNames() {
    }

    /**
     * Lower-cases a host or domain and strips a single leading {@code www.}.
     */
    public static String bareDomain(String domain) {
        if (domain == null) {
            return "";
        }
        String lowered = domain.trim().toLowerCase(Locale.ROOT);
        return lowered.startsWith(WWW_PREFIX) ? lowered.substring(WWW_PREFIX.length()) : lowered;
    }

    /**
     * Reduces a stored domain value, which may carry a port, a scheme or a path,
     * to its bare lower-cased host without {@code www.}.
     */
    public static String bareHost(String domainOrUrl) {
        if (domainOrUrl == null) {
            return "";
        }
        String value = domainOrUrl.trim();
        String host = value.contains("://") ? host(value).orElse("") : value;
        int slash = host.indexOf('/');
        if (slash >= 0) {
            host = host.substring(0, slash);
        }
        int colon = host.lastIndexOf(':');
        if (colon >= 0 && !host.endsWith("]")) {
            host = host.substring(0, colon);
        }
        return bareDomain(host);
    }

    /**
     * Extracts the host of an absolute URL.
     *
     * @return the host, or empty when the URL cannot be parsed or has no host
     */
    public static Optional<String> host(String url) {
        if (url == null) {
            return Optional.empty();
        }
        return parse(url).map(URL::getHost).filter(host -> !host.isEmpty());
    }

    /**
     * Extracts the authority (host plus optional port) of an absolute URL.
     * This is the value stored in {@code pages.domain}.
     */
    public static Optional<String> authority(String url) {
        if (url == null) {
            return Optional.empty();
        }
        return parse(url)
            .filter(parsed -> !parsed.getHost().isEmpty())
            .map(parsed -> parsed.getPort() > 0 ? parsed.getHost() + ":" + parsed.getPort() : parsed.getHost());
    }

    /**
     * Returns {@code scheme://host[:port]} of an absolute URL, lower-cased.
     */
    public static Optional<String> origin(String url) {
        if (url == null) {
            return Optional.empty();
        }
        return parse(url)
            .filter(parsed -> !parsed.getHost().isEmpty())
            .map(parsed -> {
                String base = parsed.getProtocol() + "://" + parsed.getHost();
                return (parsed.getPort() > 0 ? base + ":" + parsed.getPort() : base).toLowerCase(Locale.ROOT);
            });
    }

    private static Optional<URL> parse(String url) {
        try {
            return Optional.of(new URL(url.trim()));
        } catch (MalformedURLException e) {
            return Optional.empty();
        }
    }

    /**
     * Returns true when {@code host} equals {@code domain} or is a subdomain of it.
     */
    public static boolean matchesDomain(String host, String domain) {
        return host.equals(domain) || host.endsWith("." + domain);
    }
}
