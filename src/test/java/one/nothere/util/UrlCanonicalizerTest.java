package one.nothere.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import one.nothere.domain.crawl.CanonicalUrl;
import org.junit.jupiter.api.Test;

class UrlCanonicalizerTest {

    @Test
    void should_NormalizeAndHashIdentically_When_OnlyFragmentAndSchemeDiffer() {
        CanonicalUrl bare = UrlCanonicalizer.canonicalize("example.com/page#frag");
        CanonicalUrl full = UrlCanonicalizer.canonicalize("https://example.com/page#other");

        assertThat(bare.normalized()).isEqualTo("https://example.com/page");
        assertThat(full.normalized()).isEqualTo("https://example.com/page");
        assertThat(bare.hash()).isEqualTo(full.hash());
    }

    @Test
    void should_PrefixHttps_When_SchemeIsNotHttp() {
        assertThat(UrlCanonicalizer.normalize("ftp://files.example.com/a")).isEqualTo("https://ftp://files.example.com/a");
        assertThat(UrlCanonicalizer.normalize("example.org")).isEqualTo("https://example.org");
    }

    @Test
    void should_KeepHttpScheme_And_TrimWhitespace() {
        assertThat(UrlCanonicalizer.normalize("  http://example.com/a?b=1  ")).isEqualTo("http://example.com/a?b=1");
    }

    @Test
    void should_KeepQueryStringsDistinct() {
        assertThat(UrlCanonicalizer.canonicalize("https://example.com/a?page=1").hash())
            .isNotEqualTo(UrlCanonicalizer.canonicalize("https://example.com/a?page=2").hash());
    }

    @Test
    void should_ProduceLowerCaseSha256Hex() {
        String hash = UrlCanonicalizer.hash("https://example.com");

        assertThat(hash).hasSize(64).matches("[0-9a-f]+");
        assertThat(hash).isEqualTo(HashUtils.sha256Hex("https://example.com"));
    }

    @Test
    void should_RejectNull() {
        assertThatThrownBy(() -> UrlCanonicalizer.normalize(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
