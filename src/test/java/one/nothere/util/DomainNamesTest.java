package one.nothere.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DomainNamesTest {

    @Test
    void bareDomain_StripsWwwAndLowerCases() {
        assertThat(DomainNames.bareDomain("WWW.Example.COM")).isEqualTo("example.com");
        assertThat(DomainNames.bareDomain("sub.example.com")).isEqualTo("sub.example.com");
        assertThat(DomainNames.bareDomain(null)).isEmpty();
    }

    @Test
    void bareHost_DropsSchemePortAndPath() {
        assertThat(DomainNames.bareHost("www.example.edu:8080")).isEqualTo("example.edu");
        assertThat(DomainNames.bareHost("https://www.Example.org/path?q=1")).isEqualTo("example.org");
        assertThat(DomainNames.bareHost("example.com/about")).isEqualTo("example.com");
    }

    @Test
    void authority_KeepsExplicitPort() {
        assertThat(DomainNames.authority("http://localhost:8080/a")).contains("localhost:8080");
        assertThat(DomainNames.authority("https://example.com/a")).contains("example.com");
        assertThat(DomainNames.authority("not a url")).isEmpty();
    }

    @Test
    void origin_IsLowerCasedSchemeAndHost() {
        assertThat(DomainNames.origin("HTTPS://Example.com/robots/path")).contains("https://example.com");
        assertThat(DomainNames.origin("http://example.com:81/x")).contains("http://example.com:81");
    }

    @Test
    void host_IsEmptyForMalformedUrls() {
        assertThat(DomainNames.host("https://")).isEmpty();
        assertThat(DomainNames.host("::::")).isEmpty();
    }

    @Test
    void matchesDomain_AcceptsSubdomainsOnly() {
        assertThat(DomainNames.matchesDomain("news.bbc.co.uk", "bbc.co.uk")).isTrue();
        assertThat(DomainNames.matchesDomain("bbc.co.uk", "bbc.co.uk")).isTrue();
        assertThat(DomainNames.matchesDomain("notbbc.co.uk", "bbc.co.uk")).isFalse();
    }
}
