package villagecompute.community.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import villagecompute.community.api.types.ModerationVerdictType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans user text against the community rule set and produces a block / flag / clean verdict.
 *
 * <p>
 * <b>Detectors (severity):</b>
 * <ul>
 * <li>Profanity lexicon, whole words (3)</li>
 * <li>Hate speech and threats (5, always blocks)</li>
 * <li>Spam phrases, three or more links, a character repeated 11+ times (3)</li>
 * <li>Sexual, drug, illegal-activity and self-harm phrases (4)</li>
 * <li>SSN, phone, e-mail and card numbers (3)</li>
 * <li>Mostly upper-case text of 10+ letters (1)</li>
 * <li>A character repeated 6+ times (1)</li>
 * </ul>
 *
 * <p>
 * Severity is the sum of the triggered detectors, each counted once. Text at or above the block threshold (or with
 * a hard issue) is blocked; text at or above the flag threshold is flagged and published in cleaned form. Cleaning
 * masks profane words and hateful phrases with {@value #MASK} and replaces personal information with
 * {@value #PERSONAL_INFO_REPLACEMENT}.
 *
 * <p>
 * Stateless and deterministic: the same text always yields the same verdict.
 */
@ApplicationScoped
public class TextModerationService {

    public static final int DEFAULT_FLAG_THRESHOLD = 3;
    public static final int DEFAULT_BLOCK_THRESHOLD = 6;

    public static final String MASK = "****";
    public static final String PERSONAL_INFO_REPLACEMENT = "[PERSONAL INFO REMOVED]";

    private static final int CAPS_MIN_LETTERS = 10;
    private static final double CAPS_RATIO = 0.7;
    private static final int SPAM_LINK_COUNT = 3;

    static final List<String> PROFANITY_WORDS = List.of("damn", "hell", "crap", "stupid", "idiot", "dumb", "moron",
            "loser", "bitch", "bastard", "asshole", "shit", "fuck", "motherfucker", "meth", "crack", "cocaine",
            "heroin", "weed", "dealer");

    private static final Pattern PROFANITY = Pattern.compile("\\b(" + String.join("|", PROFANITY_WORDS) + ")\\b",
            Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> HATE_SPEECH = compile(
            "\\b(hate|kill|die|murder|destroy)\\s+(you|them|him|her|yourself)\\b", "\\b(go\\s+die|kill\\s+yourself)\\b",
            "\\b(worthless|pathetic|scum|trash)\\s+(person|human|father|man)\\b",
            "\\b(should\\s+be\\s+dead|deserve\\s+to\\s+die)\\b");

    private static final List<Pattern> SPAM = compile(
            "\\b(click\\s+here|free\\s+money|make\\s+\\$\\d+|guaranteed\\s+income)",
            "\\b(viagra|casino|lottery|winner|crypto|bitcoin|investment)\\b",
            "\\b(buy\\s+now|limited\\s+time|act\\s+fast|call\\s+now)\\b", "(.)\\1{10,}");

    private static final Pattern LINK = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> INAPPROPRIATE = compile("\\b(nude|naked|sex|porn|xxx|sexual|explicit)\\b",
            "\\b(drug\\s+deal|buy\\s+weed|sell\\s+drugs|selling\\s+pills)\\b",
            "\\b(illegal\\s+activity|breaking\\s+law|commit\\s+crime)\\b",
            "\\b(self\\s+harm|suicide|cutting|overdose)\\b");

    private static final List<Pattern> PERSONAL_INFO = compile("\\b\\d{3}-\\d{2}-\\d{4}\\b",
            "\\b\\d{3}-\\d{3}-\\d{4}\\b", "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b",
            "\\b\\d{4}\\s?\\d{4}\\s?\\d{4}\\s?\\d{4}\\b");

    private static final Pattern REPEATED_CHARACTERS = Pattern.compile("(.)\\1{5,}");

    @ConfigProperty(
            name = "moderation.text.flag-threshold",
            defaultValue = "3")
    int flagThreshold = DEFAULT_FLAG_THRESHOLD;

    @ConfigProperty(
            name = "moderation.text.block-threshold",
            defaultValue = "6")
    int blockThreshold = DEFAULT_BLOCK_THRESHOLD;

    /**
     * Evaluates text against the rule set.
     *
     * @param text
     *            user text, may be null or empty
     * @return verdict; empty input is clean
     */
    public ModerationVerdictType evaluate(String text) {
        if (text == null || text.isBlank()) {
            return ModerationVerdictType.clean(text);
        }

        List<ModerationIssue> found = new ArrayList<>();
        if (PROFANITY.matcher(text).find()) {
            found.add(ModerationIssue.PROFANITY);
        }
        if (anyMatch(HATE_SPEECH, text)) {
            found.add(ModerationIssue.HATE_SPEECH);
        }
        if (anyMatch(SPAM, text) || countLinks(text) >= SPAM_LINK_COUNT) {
            found.add(ModerationIssue.SPAM);
        }
        if (anyMatch(INAPPROPRIATE, text)) {
            found.add(ModerationIssue.INAPPROPRIATE_CONTENT);
        }
        if (anyMatch(PERSONAL_INFO, text)) {
            found.add(ModerationIssue.PERSONAL_INFO);
        }
        if (isMostlyUpperCase(text)) {
            found.add(ModerationIssue.EXCESSIVE_CAPS);
        }
        if (REPEATED_CHARACTERS.matcher(text).find()) {
            found.add(ModerationIssue.REPEATED_CHARACTERS);
        }

        if (found.isEmpty()) {
            return ModerationVerdictType.clean(text);
        }

        int severity = found.stream().mapToInt(ModerationIssue::severity).sum();
        boolean hard = found.stream().anyMatch(ModerationIssue::isHard);
        boolean shouldBlock = hard || severity >= blockThreshold;
        boolean shouldFlag = !shouldBlock && severity >= flagThreshold;
        List<String> issues = found.stream().map(ModerationIssue::code).toList();
        String cleaned = shouldBlock || shouldFlag ? clean(text) : text;

        return new ModerationVerdictType(shouldBlock, shouldFlag, severity, issues, cleaned);
    }

    /**
     * Masks profanity and hateful phrases and removes personal information. Text without matches is returned
     * unchanged.
     */
    public String clean(String text) {
        if (text == null || text.isEmpty()) {
            return text == null ? "" : text;
        }
        String cleaned = removePersonalInfo(text);
        for (Pattern pattern : HATE_SPEECH) {
            cleaned = pattern.matcher(cleaned).replaceAll(MASK);
        }
        return PROFANITY.matcher(cleaned).replaceAll(MASK);
    }

    /**
     * Replaces email addresses, phone numbers and similar personal information, leaving other text untouched.
     */
    public String removePersonalInfo(String text) {
        if (text == null || text.isEmpty()) {
            return text == null ? "" : text;
        }
        String cleaned = text;
        for (Pattern pattern : PERSONAL_INFO) {
            cleaned = pattern.matcher(cleaned).replaceAll(Matcher.quoteReplacement(PERSONAL_INFO_REPLACEMENT));
        }
        return cleaned;
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static int countLinks(String text) {
        Matcher matcher = LINK.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static boolean isMostlyUpperCase(String text) {
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        return letters >= CAPS_MIN_LETTERS && (double) upper / letters >= CAPS_RATIO;
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }
}
