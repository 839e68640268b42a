package villagecompute.community.integration.moderation;

/**
 * Nudity sub-scores returned by the classifier, each between 0.0 and 1.0.
 */
public record NudityScores(double sexualActivity, double sexualDisplay, double erotica, double suggestive) {
}
