package im.arun.rptsearch.classify;

import im.arun.rptsearch.model.LineTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Scores raw report lines against line templates and picks the best fit.
 *
 * <p>Positions are aligned one to one up to the shorter of line and template.
 * Literal template characters weigh 3.0 and need an exact match, {@code 9}
 * and {@code A} weigh 1.0 and need a digit or a letter, a template space
 * weighs 0.5 and needs whitespace. The score is earned weight over total weight.</p>
 */
public class LineClassifier {
    public static final double DEFAULT_MIN_SCORE = 0.55;

    static final double LITERAL_WEIGHT = 3.0;
    static final double CLASS_WEIGHT = 1.0;
    static final double SPACE_WEIGHT = 0.5;

    private final double minScore;

    public LineClassifier() {
        this(DEFAULT_MIN_SCORE);
    }

    public LineClassifier(double minScore) {
        this.minScore = minScore;
    }

    public double getMinScore() {
        return minScore;
    }

    /**
     * Catalog templates are padded with spaces and end in a {@code *} terminator;
     * neither takes part in matching.
     */
    public static String prepareTemplate(String template) {
        if (template == null) {
            return "";
        }
        String prepared = template.stripTrailing();
        if (prepared.endsWith("*")) {
            prepared = prepared.substring(0, prepared.length() - 1).stripTrailing();
        }
        return prepared;
    }

    /**
     * Score in [0, 1]; 0 when no position can be aligned.
     */
    public static double score(String line, String template) {
        String pattern = prepareTemplate(template);
        int aligned = Math.min(pattern.length(), line == null ? 0 : line.length());
        double total = 0.0;
        double earned = 0.0;

        for (int i = 0; i < aligned; i++) {
            char t = pattern.charAt(i);
            char c = line.charAt(i);
            switch (t) {
                case 'A':
                    total += CLASS_WEIGHT;
                    if (Character.isLetter(c)) earned += CLASS_WEIGHT;
                    break;
                case '9':
                    total += CLASS_WEIGHT;
                    if (Character.isDigit(c)) earned += CLASS_WEIGHT;
                    break;
                case ' ':
                    total += SPACE_WEIGHT;
                    if (Character.isWhitespace(c)) earned += SPACE_WEIGHT;
                    break;
                default:
                    total += LITERAL_WEIGHT;
                    if (c == t) earned += LITERAL_WEIGHT;
            }
        }

        return total == 0.0 ? 0.0 : earned / total;
    }

    /**
     * Best template at or above the threshold; equal scores go to the lowest line id.
     */
    public Optional<TemplateMatch> classify(String line, List<LineTemplate> templates) {
        LineTemplate best = null;
        double bestScore = -1.0;

        for (LineTemplate template : templates) {
            double s = score(line, template.getTemplate());
            if (s < minScore) {
                continue;
            }
            if (best == null || s > bestScore || (s == bestScore && template.getLineId() < best.getLineId())) {
                best = template;
                bestScore = s;
            }
        }

        return best == null ? Optional.empty() : Optional.of(new TemplateMatch(best, bestScore));
    }
}
