package io.archive.vectors.retrieval;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Deterministic answer built from result metadata alone.
 *
 * <p>Example: "Found 5 relevant articles from the Utah Digital Newspapers archive.
 * Sources include: Deseret News, Salt Lake Herald, Tooele Bulletin and 1 more.
 * Date range: 1890-01-04 to 1912-07-19. See the sources below for detailed excerpts."</p>
 */
public final class ExtractiveSummary {

    private static final int MAX_PAPERS = 3;

    private ExtractiveSummary() {
    }

    public static String of(List<Passage> passages, String archiveName) {
        int n = passages.size();
        if (n == 0) {
            return RetrievalResult.NO_RESULTS_ANSWER;
        }

        StringBuilder answer = new StringBuilder(String.format(
            "Found %d relevant article%s from the %s archive.", n, n > 1 ? "s" : "", archiveName));

        TreeSet<String> papers = passages.stream()
            .map(Passage::paper)
            .filter(p -> !SourceFormatter.isMissing(p))
            .collect(Collectors.toCollection(TreeSet::new));
        if (!papers.isEmpty()) {
            String named = papers.stream().limit(MAX_PAPERS).collect(Collectors.joining(", "));
            if (papers.size() > MAX_PAPERS) {
                named += " and " + (papers.size() - MAX_PAPERS) + " more";
            }
            answer.append(" Sources include: ").append(named).append('.');
        }

        TreeSet<String> dates = passages.stream()
            .map(p -> SourceFormatter.date(p.date()))
            .filter(Objects::nonNull)
            .filter(d -> !d.isEmpty())
            .collect(Collectors.toCollection(TreeSet::new));
        if (!dates.isEmpty()) {
            if (dates.first().equals(dates.last())) {
                answer.append(" Date: ").append(dates.first()).append('.');
            } else {
                answer.append(" Date range: ").append(dates.first()).append(" to ").append(dates.last()).append('.');
            }
        }

        answer.append(" See the sources below for detailed excerpts.");
        return answer.toString();
    }
}
