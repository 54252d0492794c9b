package im.arun.rptsearch.security;

import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.IntegrityWarning.Kind;
import im.arun.rptsearch.model.Section;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Consistency checks on a report's section table. Findings are warnings only.
 */
public final class SectionLayout {

    private SectionLayout() {}

    /**
     * Sections should tile pages 1..pageCount in start-page order without overlap.
     * A non-positive {@code pageCount} skips the coverage checks.
     */
    public static List<IntegrityWarning> validate(List<Section> sections, int pageCount) {
        List<IntegrityWarning> warnings = new ArrayList<>();
        if (sections.isEmpty()) {
            return warnings;
        }
        List<Section> ordered = new ArrayList<>(sections);
        ordered.sort(Comparator.comparingInt(Section::getStartPage).thenComparingLong(Section::getSectionId));

        int expectedNext = 1;
        Section previous = null;
        for (Section section : ordered) {
            if (previous != null && section.getStartPage() <= previous.lastPage()) {
                warnings.add(IntegrityWarning.of(Kind.SECTION_OVERLAP,
                    "section %s (pages %d-%d) overlaps section %s (pages %d-%d)",
                    section.getName(), section.getStartPage(), section.lastPage(),
                    previous.getName(), previous.getStartPage(), previous.lastPage()));
            } else if (section.getStartPage() > expectedNext && (pageCount <= 0 || expectedNext <= pageCount)) {
                warnings.add(IntegrityWarning.of(Kind.SECTION_GAP,
                    "pages %d-%d belong to no section", expectedNext, section.getStartPage() - 1));
            }
            expectedNext = Math.max(expectedNext, section.lastPage() + 1);
            previous = section;
        }

        if (pageCount > 0 && expectedNext <= pageCount) {
            warnings.add(IntegrityWarning.of(Kind.SECTION_GAP,
                "pages %d-%d belong to no section", expectedNext, pageCount));
        }
        return warnings;
    }
}
