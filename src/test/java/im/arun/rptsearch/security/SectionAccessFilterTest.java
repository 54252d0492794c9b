package im.arun.rptsearch.security;

import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.Section;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SectionAccessFilterTest {
    private static final List<Section> SECTIONS = List.of(
        new Section(1, "501", 1, 890),
        new Section(2, "201", 891, 2203),
        new Section(3, "305", 3094, 407));

    private final SectionAccessFilter filter = new SectionAccessFilter();

    @Test
    void keepsPagesInsideAuthorizedRanges() {
        List<Section> authorized = filter.resolveAuthorized(List.of("501", "305"), SECTIONS, new ArrayList<>());

        assertThat(filter.filterPages(Set.of(117, 120, 3200), authorized, SECTIONS))
            .containsExactly(117, 120, 3200);
        assertThat(filter.filterPages(Set.of(891), authorized, SECTIONS)).isEmpty();
    }

    @Test
    void singleSectionNarrowsToItsRange() {
        List<Section> authorized = filter.resolveAuthorized(List.of("305"), SECTIONS, new ArrayList<>());

        assertThat(filter.filterPages(Set.of(117, 120, 3200), authorized, SECTIONS)).containsExactly(3200);
    }

    @Test
    void rangeBoundariesAreInclusive() {
        List<Section> authorized = List.of(SECTIONS.get(1));

        assertThat(filter.filterPages(Set.of(890, 891, 3093, 3094), authorized, SECTIONS))
            .containsExactly(891, 3093);
    }

    @Test
    void reportWithoutSectionsIsOpen() {
        assertThat(filter.filterPages(Set.of(5, 1, 3), List.of(), List.of())).containsExactly(1, 3, 5);
    }

    @Test
    void reportWithSectionsFailsClosed() {
        assertThat(filter.filterPages(Set.of(1, 2, 3), List.of(), SECTIONS)).isEmpty();
    }

    @Test
    void resolvesByNameOrIdAndReportsUnknownIdentifiers() {
        List<IntegrityWarning> warnings = new ArrayList<>();

        List<Section> resolved = filter.resolveAuthorized(List.of(" 201 ", "3", "999", "", "501"), SECTIONS, warnings);

        assertThat(resolved).extracting(Section::getName).containsExactly("201", "305", "501");
        assertThat(warnings).extracting(IntegrityWarning::getKind)
            .containsExactly(IntegrityWarning.Kind.UNKNOWN_SECTION);
        assertThat(warnings.get(0).getMessage()).contains("999");
    }

    @Test
    void mergedRangesAnswerMembership() {
        PageRanges ranges = PageRanges.of(List.of(
            new Section(1, "a", 10, 5),
            new Section(2, "b", 15, 5),
            new Section(3, "c", 40, 1),
            new Section(4, "d", 12, 2),
            new Section(5, "e", 50, 0)));

        assertThat(ranges.intervalCount()).isEqualTo(2);
        assertThat(ranges.contains(9)).isFalse();
        assertThat(ranges.contains(10)).isTrue();
        assertThat(ranges.contains(19)).isTrue();
        assertThat(ranges.contains(20)).isFalse();
        assertThat(ranges.contains(40)).isTrue();
        assertThat(ranges.contains(50)).isFalse();
        assertThat(PageRanges.of(List.of()).isEmpty()).isTrue();
    }
}
