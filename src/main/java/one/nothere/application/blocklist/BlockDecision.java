package one.nothere.application.blocklist;

/**
 * Answer of a Tier-1 lookup.
 *
 * @param blocked true when the URL must not be admitted or fetched
 * @param reason  which rule matched, null when the URL is allowed
 */
public record BlockDecision(boolean blocked, String reason) {

    private static final BlockDecision ALLOWED = new BlockDecision(false, null);

    public static BlockDecision allowed() {
        return ALLOWED;
    }

    public static BlockDecision blocked(String reason) {
        return new BlockDecision(true, reason);
    }
}
