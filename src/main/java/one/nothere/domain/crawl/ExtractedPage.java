package one.nothere.domain.crawl;

import java.util.List;

/**
 * Visible content pulled out of an HTML document.
 *
 * @param title   page title, at most 500 characters, null when absent
 * @param content whitespace-collapsed visible text, at most 50,000 characters
 * @param links   outbound links in document order
 */
public record ExtractedPage(String title, String content, List<ExtractedLink> links) {

    public ExtractedPage {
        links = links == null ? List.of() : List.copyOf(links);
    }
}
