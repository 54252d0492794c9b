package im.arun.rptsearch.security;

import im.arun.rptsearch.model.Section;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Union of section page ranges, merged into sorted disjoint intervals.
 */
public final class PageRanges {
    private final int[] starts;
    private final int[] ends;

    private PageRanges(int[] starts, int[] ends) {
        this.starts = starts;
        this.ends = ends;
    }

    public static PageRanges of(Collection<Section> sections) {
        List<Section> ordered = new ArrayList<>(sections);
        ordered.sort(Comparator.comparingInt(Section::getStartPage));

        List<int[]> merged = new ArrayList<>();
        for (Section section : ordered) {
            if (section.getPageCount() < 1) {
                continue;
            }
            int start = section.getStartPage();
            int end = section.lastPage();
            if (!merged.isEmpty() && start <= merged.get(merged.size() - 1)[1] + 1) {
                int[] last = merged.get(merged.size() - 1);
                last[1] = Math.max(last[1], end);
            } else {
                merged.add(new int[] {start, end});
            }
        }

        int[] starts = new int[merged.size()];
        int[] ends = new int[merged.size()];
        for (int i = 0; i < merged.size(); i++) {
            starts[i] = merged.get(i)[0];
            ends[i] = merged.get(i)[1];
        }
        return new PageRanges(starts, ends);
    }

    public boolean isEmpty() {
        return starts.length == 0;
    }

    public int intervalCount() {
        return starts.length;
    }

    public boolean contains(int page) {
        int lo = 0;
        int hi = starts.length - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (page < starts[mid]) {
                hi = mid - 1;
            } else if (page > ends[mid]) {
                lo = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }
}
