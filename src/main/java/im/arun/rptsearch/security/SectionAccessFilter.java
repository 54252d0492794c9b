package im.arun.rptsearch.security;

import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.IntegrityWarning.Kind;
import im.arun.rptsearch.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Narrows candidate pages to the pages of the sections a caller may see.
 *
 * <p>Section security is opt-in per report: a report without sections exposes
 * every page when no sections are authorized. A report that defines sections
 * exposes nothing unless the caller is authorized for at least one of them.</p>
 */
public class SectionAccessFilter {
    private static final Logger logger = LoggerFactory.getLogger(SectionAccessFilter.class);

    public SortedSet<Integer> filterPages(Collection<Integer> candidatePages,
                                          Collection<Section> authorizedSections,
                                          List<Section> reportSections) {
        SortedSet<Integer> result = new TreeSet<>();
        if (authorizedSections.isEmpty()) {
            if (reportSections.isEmpty()) {
                result.addAll(candidatePages);
            } else {
                logger.debug("Report defines {} sections and none are authorized; no pages pass",
                    reportSections.size());
            }
            return result;
        }

        PageRanges ranges = PageRanges.of(authorizedSections);
        for (Integer page : candidatePages) {
            if (ranges.contains(page)) {
                result.add(page);
            }
        }
        return result;
    }

    /**
     * Maps caller identifiers to report sections. An identifier matches a section
     * by name or by numeric id; identifiers matching nothing are reported and dropped.
     */
    public List<Section> resolveAuthorized(Collection<String> identifiers, List<Section> reportSections,
                                           List<IntegrityWarning> warnings) {
        Set<Section> resolved = new LinkedHashSet<>();
        for (String raw : identifiers) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String identifier = raw.trim();
            boolean found = false;
            for (Section section : reportSections) {
                if (identifier.equals(section.getName() == null ? null : section.getName().trim())
                    || identifier.equals(String.valueOf(section.getSectionId()))) {
                    resolved.add(section);
                    found = true;
                }
            }
            if (!found) {
                IntegrityWarning warning = IntegrityWarning.of(Kind.UNKNOWN_SECTION,
                    "section '%s' is not defined for this report; ignored", identifier);
                logger.warn("{}", warning);
                warnings.add(warning);
            }
        }
        return new ArrayList<>(resolved);
    }
}
