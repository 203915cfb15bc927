package one.nothere.domain.scoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Civil-rights organisation flags for one bare domain.
 */
public record OrgBlocklistRecord(String domain,
                                 boolean splcFlagged,
                                 boolean acluFlagged,
                                 boolean cairFlagged,
                                 boolean adlFlagged,
                                 boolean otherFlagged,
                                 String reason) {

    public boolean isFlagged() {
        return splcFlagged || acluFlagged || cairFlagged || adlFlagged || otherFlagged;
    }

    /**
     * Names of the organisations that flagged the domain, in a fixed order.
     */
    public List<String> flaggedBy() {
        List<String> orgs = new ArrayList<>();
        if (splcFlagged) {
            orgs.add("SPLC");
        }
        if (acluFlagged) {
            orgs.add("ACLU");
        }
        if (cairFlagged) {
            orgs.add("CAIR");
        }
        if (adlFlagged) {
            orgs.add("ADL");
        }
        if (otherFlagged) {
            orgs.add("Other");
        }
        return orgs;
    }
}
