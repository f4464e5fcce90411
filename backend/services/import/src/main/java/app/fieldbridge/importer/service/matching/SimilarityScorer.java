package app.fieldbridge.importer.service.matching;

import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic name similarity in {@code [0, 1]}.
 *
 * <p>Both names are lower-cased and stripped of underscores, hyphens and whitespace. Equal names
 * score 1.0, a name containing the other scores 0.8, anything else scores
 * {@code 1 - levenshtein / maxLength}.
 */
@Component
public class SimilarityScorer {

    static final double CONTAINMENT_SCORE = 0.8;

    private static final Pattern SEPARATORS = Pattern.compile("[_\\-\\s]");
    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    public double score(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);

        if (left.isEmpty() || right.isEmpty()) {
            return left.isEmpty() && right.isEmpty() ? 1.0 : 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        if (left.contains(right) || right.contains(left)) {
            return CONTAINMENT_SCORE;
        }
        int distance = LEVENSHTEIN.apply(left, right);
        int longest = Math.max(left.length(), right.length());
        return clamp(1.0 - (double) distance / longest);
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return SEPARATORS.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private double clamp(double value) {
        if (value < 0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
