package one.nothere.application.blocklist;

import java.util.List;
import java.util.Set;

/**
 * Built-in Tier-1 rule set: domains, TLD suffixes and URL path patterns for
 * content that is never crawled.
 */
public final class BlocklistDefaults {

    public static final Set<String> DOMAINS = Set.of(
        // Adult content
        "pornhub.com", "xvideos.com", "xnxx.com", "redtube.com", "youporn.com",
        "tube8.com", "spankbang.com", "xhamster.com", "eporner.com", "motherless.com",
        "livejasmin.com", "chaturbate.com", "cam4.com", "stripchat.com", "camsoda.com",

        // Gambling
        "bet365.com", "pokerstars.com", "bwin.com", "draftkings.com", "fanduel.com",
        "betfair.com", "casino.com", "bovada.lv", "888casino.com", "williamhill.com",
        "paddypower.com", "betway.com", "unibet.com", "betonline.ag",

        // Alcohol and drug retail
        "totalwine.com", "wine.com", "drizly.com", "reservebar.com",
        "leafly.com", "weedmaps.com", "eaze.com",

        // Payday and predatory lending
        "cashnetusa.com", "checkintocash.com", "cashadvance.com", "speedycash.com",
        "moneylion.com", "advanceamerica.net", "titlemax.com", "checkngo.com",

        // MLM
        "amway.com", "herbalife.com", "monat.com", "lularoe.com", "itworks.com",
        "younique.com", "avon.com", "marykay.com", "arbonne.com", "beachbody.com",
        "rodan-fields.com", "pampered-chef.com", "usana.com", "isagenix.com",

        // Hate groups
        "stormfront.org", "dailystormer.name", "vdare.com", "americanrenaissance.com",
        "counter-currents.com", "theoccidentalobserver.net", "unz.com",

        // Misinformation and conspiracy
        "infowars.com", "prisonplanet.com", "naturalnews.com", "beforeitsnews.com",
        "veteranstoday.com", "rense.com", "davidicke.com", "thetruthseeker.co.uk",
        "conspiracyplanet.com", "rumormillnews.com", "qmap.pub", "qanon.pub",
        "thegatewaypundit.com", "tfrlive.com", "theepochtimes.com",

        // Antivax and pseudoscience
        "mercola.com", "greenmedinfo.com", "tenpenny.com",
        "learntherisk.org", "childrenshealthdefense.org", "nvic.org",

        // Content farms
        "ehow.com", "answers.com", "ask.com", "answerbag.com", "chacha.com",
        "mahalo.com", "wikihow.com", "buzzle.com", "listverse.com"
    );

    public static final List<String> TLDS = List.of(
        ".xxx", ".adult", ".porn", ".sex", ".sexy", ".casino", ".bet",
        ".poker", ".loan", ".loans", ".date", ".download", ".click"
    );

    public static final List<String> PATTERNS = List.of(
        // Adult
        "/porn/", "/xxx/", "/sex/", "/adult/", "/nude/", "/escort/", "/hookup/", "/camgirl/", "/onlyfans/",
        // Gambling
        "/casino/", "/poker/", "/betting/", "/slots/", "/blackjack/", "/roulette/",
        // Drugs and alcohol
        "/buy-weed/", "/marijuana-delivery/", "/liquor-store/", "/order-alcohol/",
        // Predatory lending
        "/payday-loan/", "/cash-advance/", "/title-loan/", "/quick-cash/",
        // MLM recruiting
        "/join-my-team/", "/be-your-own-boss/", "/work-from-home-opportunity/",
        // Conspiracy and misinformation
        "/flat-earth/", "/holocaust-hoax/", "/crisis-actors/", "/false-flag/", "/qanon/",
        "/moon-landing-fake/", "/chemtrails/", "/5g-conspiracy/", "/covid-hoax/", "/plandemic/",
        "/vaccine-injury/", "/anti-vax/"
    );

    private BlocklistDefaults() {
    }

    /**
     * Creates a fresh, independently mutable blocklist seeded with the built-in rules.
     */
    public static Tier1Blocklist newBlocklist() {
        return new Tier1Blocklist(DOMAINS, TLDS, PATTERNS);
    }
}
