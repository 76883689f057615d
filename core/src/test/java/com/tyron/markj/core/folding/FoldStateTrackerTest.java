package com.tyron.markj.core.folding;

import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.api.folding.FoldToggle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FoldStateTrackerTest {

    private FoldStateTracker tracker;
    private List<FoldToggle> toggles;

    @BeforeEach
    public void setUp() {
        tracker = new FoldStateTracker(4);
        toggles = new ArrayList<>();
        tracker.addFoldingListener(toggles::add);
    }

    @Test
    public void foldThenUnfoldRestoresVisibility() {
        tracker.updateRegions(List.of(new FoldRegion(1, 5, 0)));

        assertTrue(tracker.fold(1));
        assertTrue(tracker.isCollapsed(1));
        assertTrue(tracker.isLineVisible(1));
        for (int line = 2; line <= 5; line++) {
            assertFalse(tracker.isLineVisible(line), "line " + line);
        }
        assertTrue(tracker.isLineVisible(6));
        assertEquals(4, tracker.getHiddenLineCount());
        assertFalse(tracker.fold(1));

        assertTrue(tracker.unfold(1));
        assertFalse(tracker.unfold(1));
        assertEquals(0, tracker.getHiddenLineCount());
        assertEquals(List.of(new FoldToggle(1, 5, false), new FoldToggle(1, 5, true)), toggles);
    }

    @Test
    public void unknownStartLineIsNotFoldable() {
        tracker.updateRegions(List.of(new FoldRegion(1, 5, 0)));

        assertFalse(tracker.fold(2));
        assertFalse(tracker.unfold(3));
        assertFalse(tracker.toggle(0));
        assertTrue(toggles.isEmpty());
    }

    @Test
    public void nestedCollapsedRegionStaysCollapsedUnderParent() {
        tracker.updateRegions(List.of(new FoldRegion(0, 3, 0), new FoldRegion(1, 2, 4)));

        assertTrue(tracker.fold(1));
        assertTrue(tracker.fold(0));
        assertFalse(tracker.isLineVisible(1));

        assertTrue(tracker.unfold(0));
        assertTrue(tracker.isLineVisible(1));
        assertFalse(tracker.isLineVisible(2));
        assertTrue(tracker.isLineVisible(3));
    }

    @Test
    public void foldAtLevelMatchesIndentTimesUnit() {
        tracker.updateRegions(List.of(
                new FoldRegion(0, 9, 0),
                new FoldRegion(1, 8, 4),
                new FoldRegion(2, 4, 8),
                new FoldRegion(5, 7, 8)));

        assertEquals(2, tracker.foldAtLevel(2));
        assertTrue(tracker.isCollapsed(2));
        assertTrue(tracker.isCollapsed(5));
        assertFalse(tracker.isCollapsed(1));

        assertEquals(0, tracker.foldAtLevel(2));
        assertEquals(0, tracker.foldAtLevel(-1));
        assertEquals(0, tracker.foldAtLevel(7));
        assertEquals(1, tracker.foldAtLevel(0));
    }

    @Test
    public void foldAtLevelOneFoldsOnlyIndentFourRegions() {
        String text = String.join("\n",
                "<div>",
                "    <section>",
                "        <ul>",
                "            <li>a</li>",
                "        </ul>",
                "    </section>",
                "</div>");
        List<FoldRegion> regions = new FoldRegionDetector().detect(text);
        assertEquals(List.of(
                new FoldRegion(0, 5, 0),
                new FoldRegion(1, 4, 4),
                new FoldRegion(2, 3, 8)), regions);
        tracker.updateRegions(regions);

        assertEquals(1, tracker.foldAtLevel(1));

        assertEquals(List.of(new FoldRegion(1, 4, 4)), tracker.getCollapsedRegions());
        assertFalse(tracker.isCollapsed(0));
        assertFalse(tracker.isCollapsed(2));
        assertTrue(tracker.isLineVisible(1));
        assertFalse(tracker.isLineVisible(2));
        assertTrue(tracker.isLineVisible(5));
    }

    @Test
    public void foldAllAndUnfoldAllReportChangedCount() {
        tracker.updateRegions(List.of(new FoldRegion(0, 3, 0), new FoldRegion(1, 2, 4), new FoldRegion(5, 6, 0)));
        tracker.fold(1);

        assertEquals(2, tracker.foldAll());
        assertEquals(0, tracker.foldAll());
        assertEquals(3, tracker.getCollapsedRegions().size());
        assertEquals(3, tracker.unfoldAll());
        assertEquals(0, tracker.unfoldAll());
    }

    @Test
    public void recomputedRegionWithDifferentEndDropsCollapse() {
        tracker.updateRegions(List.of(new FoldRegion(1, 5, 0)));
        tracker.fold(1);
        toggles.clear();

        assertEquals(1, tracker.updateRegions(List.of(new FoldRegion(1, 6, 0))));

        assertFalse(tracker.isCollapsed(1));
        assertTrue(tracker.isLineVisible(3));
        assertEquals(List.of(new FoldToggle(1, 5, true)), toggles);
    }

    @Test
    public void recomputedIdenticalRegionKeepsCollapse() {
        tracker.updateRegions(List.of(new FoldRegion(1, 5, 0)));
        tracker.fold(1);
        toggles.clear();

        assertEquals(0, tracker.updateRegions(List.of(new FoldRegion(1, 5, 0), new FoldRegion(7, 9, 0))));

        assertTrue(tracker.isCollapsed(1));
        assertFalse(tracker.isLineVisible(2));
        assertTrue(toggles.isEmpty());
    }

    @Test
    public void vanishedRegionDropsCollapse() {
        tracker.updateRegions(List.of(new FoldRegion(1, 5, 0)));
        tracker.fold(1);

        assertEquals(1, tracker.updateRegions(List.of()));
        assertTrue(tracker.getCollapsedRegions().isEmpty());
        assertEquals(0, tracker.getHiddenLineCount());
    }

    @Test
    public void findRegionForLineReturnsInnermost() {
        tracker.updateRegions(List.of(new FoldRegion(0, 6, 0), new FoldRegion(2, 4, 4)));

        assertEquals(new FoldRegion(2, 4, 4), tracker.findRegionForLine(3).orElseThrow());
        assertEquals(new FoldRegion(2, 4, 4), tracker.findRegionForLine(2).orElseThrow());
        assertEquals(new FoldRegion(0, 6, 0), tracker.findRegionForLine(5).orElseThrow());
        assertTrue(tracker.findRegionForLine(7).isEmpty());
    }

    @Test
    public void zeroLengthRegionsAreIgnored() {
        tracker.updateRegions(List.of(new FoldRegion(3, 3, 0)));
        assertTrue(tracker.getRegions().isEmpty());
        assertFalse(tracker.fold(3));
    }

    @Test
    public void rejectsNonPositiveIndentUnit() {
        assertThrows(IllegalArgumentException.class, () -> new FoldStateTracker(0));
    }
}
