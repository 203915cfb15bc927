package one.nothere.application.crawl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import one.nothere.domain.crawl.ExtractedLink;
import one.nothere.domain.crawl.ExtractedPage;
import one.nothere.exception.ContentExtractionException;
import one.nothere.util.UrlCanonicalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Pulls title, visible text and outbound links out of an HTML document.
 *
 * <p>Script, style, nav, footer and header elements are removed before both
 * text and links are collected, so navigation chrome contributes neither.</p>
 */
@Component
public class PageContentExtractor {

    static final int MAX_TITLE_CHARS = 500;
    static final int MAX_CONTENT_CHARS = 50_000;
    static final int MAX_LINK_TEXT_CHARS = 500;

    private static final List<String> SKIPPED_SCHEMES = List.of("mailto:", "tel:", "javascript:");

    /**
     * @param html    document source
     * @param baseUrl final (post-redirect) URL the document was served from
     */
    public ExtractedPage extract(String html, String baseUrl) {
        Document document;
        try {
            document = Jsoup.parse(html == null ? "" : html, baseUrl);
        } catch (RuntimeException e) {
            throw new ContentExtractionException(baseUrl, e);
        }

        document.select("script, style, nav, footer, header").remove();

        String title = truncate(document.title().trim(), MAX_TITLE_CHARS);
        String content = truncate(collapseWhitespace(document.text()), MAX_CONTENT_CHARS);

        List<ExtractedLink> links = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (isSkipped(href)) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            if (absolute.isEmpty()) {
                continue;
            }
            String text = truncate(anchor.text().trim(), MAX_LINK_TEXT_CHARS);
            links.add(new ExtractedLink(UrlCanonicalizer.normalize(absolute), text.isEmpty() ? null : text));
        }

        return new ExtractedPage(title.isEmpty() ? null : title, content, links);
    }

    private static boolean isSkipped(String href) {
        String lowered = href.toLowerCase(Locale.ROOT);
        return SKIPPED_SCHEMES.stream().anyMatch(lowered::startsWith);
    }

    private static String collapseWhitespace(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }

    private static String truncate(String value, int maxChars) {
        return value.length() <= maxChars ? value : value.substring(0, maxChars);
    }
}
