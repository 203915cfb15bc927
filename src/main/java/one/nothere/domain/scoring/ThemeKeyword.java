package one.nothere.domain.scoring;

/**
 * One keyword-to-theme association from the theme tables.
 *
 * @param keyword   lower-cased keyword
 * @param themeId   id of the theme row
 * @param principle human readable principle of the theme
 * @param category  category that fixes the weight
 */
public record ThemeKeyword(String keyword, int themeId, String principle, KeywordCategory category) {

    public int weight() {
        return category.weight();
    }
}
