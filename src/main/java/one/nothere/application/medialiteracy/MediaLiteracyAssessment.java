package one.nothere.application.medialiteracy;

import java.util.List;

/**
 * Structured verdict parsed from a model reply.
 *
 * @param credibilityScore clamped to {@code [0, 100]}
 * @param contextBoxText   user-facing note, null when none was offered
 */
public record MediaLiteracyAssessment(int credibilityScore,
                                      List<String> majorRedFlags,
                                      List<String> minorConcerns,
                                      String explanation,
                                      boolean contextBoxNeeded,
                                      String contextBoxText) {

    public MediaLiteracyAssessment {
        majorRedFlags = List.copyOf(majorRedFlags);
        minorConcerns = List.copyOf(minorConcerns);
    }
}
