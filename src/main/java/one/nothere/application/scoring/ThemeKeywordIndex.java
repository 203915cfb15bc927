package one.nothere.application.scoring;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import one.nothere.adapters.persistence.ThemeKeywordRepository;
import one.nothere.config.CacheFactory;
import one.nothere.config.ScoringProperties;
import one.nothere.domain.scoring.ThemeKeyword;
import one.nothere.support.cache.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cached keyword to theme map with precompiled whole-word matchers.
 *
 * <p>The map is loaded on first use and kept for {@code scoring.cache.keyword-ttl}
 * (process lifetime by default); database edits are not seen before expiry.</p>
 */
@Component
public class ThemeKeywordIndex {

    private static final Logger log = LoggerFactory.getLogger(ThemeKeywordIndex.class);
    private static final String INDEX_KEY = "theme-keywords";

    private final ThemeKeywordRepository repository;
    private final TtlCache<String, CompiledIndex> cache;

    public ThemeKeywordIndex(ThemeKeywordRepository repository, CacheFactory cacheFactory, ScoringProperties properties) {
        this.repository = repository;
        this.cache = cacheFactory.createCache("theme-keywords", 1,
            properties.getCache().getKeywordTtl(), properties.getCache().isEnabled());
    }

    /**
     * Every (keyword, theme) pair whose keyword occurs as a whole word in the content.
     *
     * @throws org.springframework.dao.DataAccessException when the keyword tables cannot be read
     */
    public List<ThemeKeyword> match(String content) {
        CompiledIndex index = cache.get(INDEX_KEY, key -> load());
        String contentLower = content.toLowerCase(Locale.ROOT);
        List<ThemeKeyword> matches = new ArrayList<>();
        for (Map.Entry<Pattern, List<ThemeKeyword>> entry : index.entries().entrySet()) {
            if (entry.getKey().matcher(contentLower).find()) {
                matches.addAll(entry.getValue());
            }
        }
        return matches;
    }

    public int keywordCount() {
        return cache.get(INDEX_KEY, key -> load()).entries().size();
    }

    private CompiledIndex load() {
        Map<String, List<ThemeKeyword>> byKeyword = new LinkedHashMap<>();
        for (ThemeKeyword keyword : repository.findAll()) {
            byKeyword.computeIfAbsent(keyword.keyword(), k -> new ArrayList<>()).add(keyword);
        }
        Map<Pattern, List<ThemeKeyword>> entries = new LinkedHashMap<>();
        byKeyword.forEach((keyword, themes) ->
            entries.put(Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b"), List.copyOf(themes)));
        log.info("Loaded {} unique keywords from database", entries.size());
        return new CompiledIndex(entries);
    }

    private record CompiledIndex(Map<Pattern, List<ThemeKeyword>> entries) {
    }
}
