package one.nothere.application.blocklist;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class Tier1BlocklistTest {

    private Tier1Blocklist blocklist;

    @BeforeEach
    void setUp() {
        blocklist = BlocklistDefaults.newBlocklist();
    }

    @Test
    void should_BlockExactDomain_WithDomainReason() {
        BlockDecision decision = blocklist.isBlocked("https://pornhub.com/view");

        assertThat(decision.blocked()).isTrue();
        assertThat(decision.reason()).isEqualTo("Blocked domain: pornhub.com");
    }

    @Test
    void should_BlockSubdomain_ViaParentDomain() {
        BlockDecision decision = blocklist.isBlocked("https://sub.pornhub.com/");

        assertThat(decision.blocked()).isTrue();
        assertThat(decision.reason()).isEqualTo("Blocked domain: pornhub.com");
    }

    @Test
    void should_BlockWwwHost_AsBareDomain() {
        assertThat(blocklist.isBlocked("https://www.PornHub.com/").reason()).isEqualTo("Blocked domain: pornhub.com");
    }

    @Test
    void should_BlockByTld() {
        BlockDecision decision = blocklist.isBlocked("https://foo.xxx/page");

        assertThat(decision.blocked()).isTrue();
        assertThat(decision.reason()).isEqualTo("Blocked TLD: .xxx");
    }

    @Test
    void should_BlockByPattern_CaseInsensitively() {
        BlockDecision decision = blocklist.isBlocked("https://example.com/CASINO/x");

        assertThat(decision.blocked()).isTrue();
        assertThat(decision.reason()).isEqualTo("Blocked pattern: /casino/");
    }

    @Test
    void should_AllowReputableSites() {
        assertThat(blocklist.isBlocked("https://wikipedia.org/wiki/Java").blocked()).isFalse();
        assertThat(blocklist.isBlocked("https://www.bbc.com/news").blocked()).isFalse();
        assertThat(blocklist.isBlocked("https://wikipedia.org/").reason()).isNull();
    }

    @Test
    void should_BlockUnparseableUrls() {
        assertThat(blocklist.isBlocked("not a url").blocked()).isTrue();
        assertThat(blocklist.isBlocked("not a url").reason()).startsWith("Invalid URL format");
        assertThat(blocklist.isBlocked("https://").blocked()).isTrue();
        assertThat(blocklist.isBlocked(null).blocked()).isTrue();
    }

    @Test
    void should_MatchHostWithoutPort() {
        assertThat(blocklist.isBlocked("https://pornhub.com:8443/x").reason()).isEqualTo("Blocked domain: pornhub.com");
    }

    @Test
    void should_NotBlockLookalikeDomains() {
        Tier1Blocklist custom = new Tier1Blocklist(List.of("bad.com"), List.of(), List.of());

        assertThat(custom.isBlocked("https://notbad.com/").blocked()).isFalse();
        assertThat(custom.isBlocked("https://deep.sub.bad.com/").blocked()).isTrue();
    }

    @Test
    void should_ApplyCustomisations_AndReportStats() {
        Tier1Blocklist custom = new Tier1Blocklist(List.of("one.com"), List.of(".zip"), List.of("/spam/"));
        assertThat(custom.stats()).isEqualTo(new Tier1Blocklist.Stats(1, 1, 1));

        int added = custom.addDomains(List.of("two.com", "www.one.com", "three.com", " "));
        custom.addPattern("free-money");

        assertThat(added).isEqualTo(2);
        assertThat(custom.stats()).isEqualTo(new Tier1Blocklist.Stats(3, 1, 2));
        assertThat(custom.isBlocked("https://two.com").blocked()).isTrue();
        assertThat(custom.isBlocked("https://ok.com/FREE-MONEY-now").reason()).isEqualTo("Blocked pattern: free-money");

        custom.removeDomain("two.com");
        assertThat(custom.isBlocked("https://two.com").blocked()).isFalse();
    }

    @Test
    void should_KeepDefaultInstancesIndependent() {
        Tier1Blocklist other = BlocklistDefaults.newBlocklist();
        other.addDomain("example.com");

        assertThat(other.isBlocked("https://example.com").blocked()).isTrue();
        assertThat(blocklist.isBlocked("https://example.com").blocked()).isFalse();
    }
}
