package one.nothere.application.blocklist;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import one.nothere.util.DomainNames;

/**
 * Pre-fetch hard filter for clearly harmful URLs.
 *
 * <p>Checks run in order and the first match wins: exact domain, parent domain,
 * blocked TLD suffix, then a case-insensitive regex search over the whole URL.
 * URLs whose host cannot be parsed are blocked.</p>
 *
 * <p>Instances are plain values owned by whoever builds them; the application
 * context holds one shared instance. Lookups and mutations may run concurrently.</p>
 */
public class Tier1Blocklist {

    private final Set<String> domains = ConcurrentHashMap.newKeySet();
    private final List<String> tlds;
    private final List<Pattern> patterns = new CopyOnWriteArrayList<>();

    public Tier1Blocklist(Collection<String> domains, Collection<String> tlds, Collection<String> patterns) {
        domains.forEach(this::addDomain);
        this.tlds = tlds.stream().map(tld -> tld.toLowerCase(Locale.ROOT)).distinct().toList();
        patterns.forEach(this::addPattern);
    }

    /**
     * Decides whether a URL is blocked.
     *
     * @param url absolute URL, normalized or raw
     * @return decision with the matching rule as reason
     */
    public BlockDecision isBlocked(String url) {
        if (url == null) {
            return BlockDecision.blocked("Invalid URL format: null");
        }
        String lowered = url.toLowerCase(Locale.ROOT);
        Optional<String> host = DomainNames.host(lowered);
        if (host.isEmpty()) {
            return BlockDecision.blocked("Invalid URL format: " + url);
        }
        String domain = DomainNames.bareDomain(host.get());

        if (domains.contains(domain)) {
            return BlockDecision.blocked("Blocked domain: " + domain);
        }
        int dot = domain.indexOf('.');
        while (dot >= 0) {
            String parent = domain.substring(dot + 1);
            if (domains.contains(parent)) {
                return BlockDecision.blocked("Blocked domain: " + parent);
            }
            dot = domain.indexOf('.', dot + 1);
        }
        for (String tld : tlds) {
            if (domain.endsWith(tld)) {
                return BlockDecision.blocked("Blocked TLD: " + tld);
            }
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(lowered).find()) {
                return BlockDecision.blocked("Blocked pattern: " + pattern.pattern());
            }
        }
        return BlockDecision.allowed();
    }

    public void addDomain(String domain) {
        String normalized = DomainNames.bareDomain(domain);
        if (!normalized.isEmpty()) {
            domains.add(normalized);
        }
    }

    /**
     * Adds every domain in the batch.
     *
     * @return how many were new
     */
    public int addDomains(Collection<String> batch) {
        int added = 0;
        for (String domain : batch) {
            String normalized = DomainNames.bareDomain(domain);
            if (!normalized.isEmpty() && domains.add(normalized)) {
                added++;
            }
        }
        return added;
    }

    public void removeDomain(String domain) {
        domains.remove(DomainNames.bareDomain(domain));
    }

    /**
     * Adds a regex searched case-insensitively against the full URL.
     *
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    public void addPattern(String regex) {
        patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public Stats stats() {
        return new Stats(domains.size(), tlds.size(), patterns.size());
    }

    /**
     * Rule counts per category.
     */
    public record Stats(int blockedDomains, int blockedTlds, int blockedPatterns) {
    }
}
