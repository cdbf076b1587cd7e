package com.hydrokb.quality;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.search.SearchResult;
import com.hydrokb.search.Tokenizer;

/**
 * Scores ranked results on relevance, technical density, completeness, freshness and source
 * reliability, and keeps the ones that clear the configured floor.
 */
public class QualityValidator {
    private static final Logger log = LoggerFactory.getLogger(QualityValidator.class);

    static final double RELEVANCE_WEIGHT = 0.30;
    static final double TECHNICAL_WEIGHT = 0.25;
    static final double COMPLETENESS_WEIGHT = 0.20;
    static final double FRESHNESS_WEIGHT = 0.15;
    static final double SOURCE_WEIGHT = 0.10;

    static final double FRESHNESS_FLOOR = 0.1;
    private static final double DAYS_PER_YEAR = 365.25;

    static final List<String> RELIABLE_SOURCES = List.of(
            "awwa", "american water works association",
            "iso", "international organization for standardization",
            "epa", "environmental protection agency",
            "who", "world health organization",
            "asce", "american society of civil engineers",
            "iwa", "international water association",
            "unesco", "united nations educational",
            "world bank", "banco mundial",
            "bid", "banco interamericano de desarrollo");

    static final List<String> TECHNICAL_INDICATORS = List.of(
            "ecuación", "equation", "fórmula", "formula",
            "coeficiente", "coefficient", "parámetro", "parameter",
            "cálculo", "calculation", "análisis", "analysis",
            "dimensionamiento", "sizing", "diseño", "design",
            "especificación", "specification", "norma", "standard",
            "procedimiento", "procedure", "método", "method",
            "resultado", "result", "conclusión", "conclusion");

    static final List<String> COMPLETENESS_INDICATORS = List.of(
            "ejemplo", "example", "caso", "case",
            "procedimiento", "procedure", "paso", "step",
            "resultado", "result", "conclusión", "conclusion",
            "tabla", "table", "figura", "figure",
            "referencia", "reference", "bibliografía", "bibliography");

    private static final List<Pattern> FORMULA_PATTERNS = List.of(
            Pattern.compile("[A-Za-z]\\s*=\\s*[^.]*[+\\-*/]"),
            Pattern.compile("Q\\s*="),
            Pattern.compile("P\\s*="),
            Pattern.compile("H\\s*="));

    private static final Pattern UNIT_PATTERN = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(m3/s|L/s|mca|kPa|bar|psi|mm|cm|m|km|gpm|cfs)(?![\\p{L}\\p{N}])");

    private final Clock clock;

    public QualityValidator() {
        this(Clock.systemUTC());
    }

    public QualityValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationOutcome validate(String query, List<SearchResult> results, ValidationOptions options) {
        List<AssessedResult> evaluated = new ArrayList<>(results.size());
        List<AssessedResult> accepted = new ArrayList<>();
        for (SearchResult result : results) {
            QualityMetrics metrics = evaluate(query, result, options);
            evaluated.add(new AssessedResult(result, metrics));
            if (passes(metrics, options.minQualityScore(), options.strictMode())) {
                accepted.add(new AssessedResult(annotate(result, metrics), metrics));
            }
        }
        accepted.sort(Comparator.comparingDouble((AssessedResult assessed) -> assessed.metrics().overall()).reversed());
        log.debug("quality.validated query=\"{}\" evaluated={} accepted={} strict={}",
                query, evaluated.size(), accepted.size(), options.strictMode());
        return new ValidationOutcome(accepted, evaluated);
    }

    public QualityMetrics evaluate(String query, SearchResult result, ValidationOptions options) {
        List<QualityIssue> issues = new ArrayList<>();
        double relevance = relevance(query, result, issues);
        double technical = technicalAccuracy(result.content(), issues);
        double completeness = completeness(result.content(), issues);
        double freshness = freshness(result, options.maxContentAgeYears(), issues);
        double source = sourceReliability(result, options.preferredSources(), issues);
        double overall = relevance * RELEVANCE_WEIGHT
                + technical * TECHNICAL_WEIGHT
                + completeness * COMPLETENESS_WEIGHT
                + freshness * FRESHNESS_WEIGHT
                + source * SOURCE_WEIGHT;
        return new QualityMetrics(relevance, technical, completeness, freshness, source, overall, issues,
                recommendations(relevance, technical, completeness, freshness, source));
    }

    static boolean passes(QualityMetrics metrics, double minScore, boolean strictMode) {
        if (!strictMode) {
            return metrics.overall() >= minScore;
        }
        return metrics.relevance() >= minScore
                && metrics.technicalAccuracy() >= minScore * 0.8
                && metrics.completeness() >= minScore * 0.7
                && metrics.freshness() >= minScore * 0.6
                && metrics.sourceReliability() >= minScore * 0.5;
    }

    double relevance(String query, SearchResult result, List<QualityIssue> issues) {
        List<String> queryTerms = Tokenizer.tokenize(query);
        Set<String> contentTerms = new HashSet<>(Tokenizer.tokenize(result.content()));
        long common = queryTerms.stream().filter(contentTerms::contains).count();
        double overlap = (double) common / Math.max(queryTerms.size(), 1);
        double score = result.score() * 0.7 + overlap * 0.3;
        if (score < 0.4) {
            issues.add(new QualityIssue(IssueType.LOW_RELEVANCE, Severity.HIGH,
                    "Content has low relevance to the query",
                    "Rephrase the query or use more specific terms"));
        }
        return Math.min(score, 1.0);
    }

    double technicalAccuracy(String content, List<QualityIssue> issues) {
        String lower = content.toLowerCase(Locale.ROOT);
        long indicators = TECHNICAL_INDICATORS.stream().filter(lower::contains).count();
        int formulas = 0;
        for (Pattern pattern : FORMULA_PATTERNS) {
            formulas += count(pattern.matcher(content));
        }
        int units = count(UNIT_PATTERN.matcher(content));
        String trimmed = content.trim();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        double density = (indicators + formulas + units) / (double) Math.max(words, 1);
        double score = Math.min(density * 10, 1.0);
        if (density < 0.02) {
            issues.add(new QualityIssue(IssueType.LOW_TECHNICAL_DENSITY, Severity.MEDIUM,
                    "Content has low technical density",
                    "Look for more specialized technical documents"));
            score *= 0.7;
        }
        return score;
    }

    double completeness(String content, List<QualityIssue> issues) {
        double lengthScore;
        if (content.length() < 200) {
            lengthScore = 0.3;
            issues.add(new QualityIssue(IssueType.INCOMPLETE_INFO, Severity.MEDIUM,
                    "Content looks incomplete (very short)",
                    "Look for documents with more detail"));
        } else if (content.length() < 500) {
            lengthScore = 0.6;
        } else {
            lengthScore = 1.0;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        long indicators = COMPLETENESS_INDICATORS.stream().filter(lower::contains).count();
        double indicatorScore = Math.min(indicators / 3.0, 1.0);
        return lengthScore * 0.6 + indicatorScore * 0.4;
    }

    double freshness(SearchResult result, double maxAgeYears, List<QualityIssue> issues) {
        Instant createdAt = result.source() == null ? null : result.source().createdAt();
        if (createdAt == null) {
            return 1.0;
        }
        double ageYears = Math.max(0L, Duration.between(createdAt, clock.instant()).toDays()) / DAYS_PER_YEAR;
        if (ageYears > maxAgeYears) {
            issues.add(new QualityIssue(IssueType.OUTDATED_CONTENT,
                    ageYears > maxAgeYears * 2 ? Severity.HIGH : Severity.MEDIUM,
                    String.format(Locale.ROOT, "Content is %.1f years old", ageYears),
                    "Look for newer documents or confirm the information still holds"));
            return FRESHNESS_FLOOR;
        }
        return Math.max(FRESHNESS_FLOOR, 1.0 - ageYears / maxAgeYears);
    }

    double sourceReliability(SearchResult result, List<String> preferredSources, List<QualityIssue> issues) {
        String title = result.source() == null || result.source().title() == null
                ? ""
                : result.source().title().toLowerCase(Locale.ROOT);
        String content = result.content().toLowerCase(Locale.ROOT);
        double score = 0.5;
        if (RELIABLE_SOURCES.stream().anyMatch(source -> mentions(title, content, source))) {
            score += 0.4;
        }
        if (preferredSources.stream().anyMatch(source -> mentions(title, content, source.toLowerCase(Locale.ROOT)))) {
            score += 0.3;
        }
        if (result.source() != null && result.source().referenceCount() > 0) {
            score += 0.1;
        }
        if (score < 0.4) {
            issues.add(new QualityIssue(IssueType.UNRELIABLE_SOURCE, Severity.LOW,
                    "Source is not among the recognized reliable sources",
                    "Cross-check against recognized industry sources"));
        }
        return Math.min(score, 1.0);
    }

    static List<String> recommendations(double relevance, double technical, double completeness, double freshness,
            double source) {
        List<String> recommendations = new ArrayList<>();
        if (relevance < 0.6) {
            recommendations.add("Refine the query with more specific terms");
        }
        if (technical < 0.5) {
            recommendations.add("Search more technical or specialized documents");
        }
        if (completeness < 0.6) {
            recommendations.add("Combine with information from additional sources");
        }
        if (freshness < 0.7) {
            recommendations.add("Check whether more recent information exists");
        }
        if (source < 0.6) {
            recommendations.add("Cross-check against recognized industry sources");
        }
        return recommendations;
    }

    private SearchResult annotate(SearchResult result, QualityMetrics metrics) {
        SearchResult annotated = result.withMetadata("qualityScore", metrics.overall());
        if (metrics.technicalAccuracy() <= 0.7 || result.highlights().isEmpty()) {
            return annotated;
        }
        List<String> emphasized = result.highlights().stream().map(QualityValidator::emphasizeTechnicalTerms).toList();
        return new SearchResult(annotated.id(), annotated.content(), annotated.score(), annotated.method(),
                annotated.source(), emphasized, annotated.metadata(), annotated.degradations());
    }

    static String emphasizeTechnicalTerms(String highlight) {
        String emphasized = highlight;
        for (String term : TECHNICAL_INDICATORS) {
            Pattern word = Pattern.compile("(?<![\\p{L}\\p{N}*])(" + Pattern.quote(term) + ")(?![\\p{L}\\p{N}*])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            emphasized = word.matcher(emphasized).replaceAll("**$1**");
        }
        return emphasized;
    }

    private static boolean mentions(String title, String content, String source) {
        Pattern word = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(source) + "(?![\\p{L}\\p{N}])");
        return word.matcher(title).find() || word.matcher(content).find();
    }

    private static int count(Matcher matcher) {
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
