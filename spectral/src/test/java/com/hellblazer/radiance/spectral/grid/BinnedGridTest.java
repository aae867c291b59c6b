package com.hellblazer.radiance.spectral.grid;

import com.hellblazer.radiance.common.Interval;
import com.hellblazer.radiance.spectral.quadrature.QuadratureTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class BinnedGridTest {

    @Test
    void testBinsAreSortedAndOrdered() {
        var grid = new BinnedGrid(List.of(new Bin("b", 510, 520), new Bin("a", 500, 510)));
        assertEquals("a", grid.bin(0).id());
        for (int i = 1; i < grid.size(); i++) {
            assertTrue(grid.bin(i - 1).upper() <= grid.bin(i).lower());
        }
    }

    @Test
    void testRejectsOverlapAndDuplicateIds() {
        assertThrows(IllegalArgumentException.class,
                     () -> new BinnedGrid(List.of(new Bin("a", 500, 515), new Bin("b", 510, 520))));
        assertThrows(IllegalArgumentException.class,
                     () -> new BinnedGrid(List.of(new Bin("a", 500, 510), new Bin("a", 510, 520))));
        assertThrows(IllegalArgumentException.class, () -> new Bin("a", 500, 500));
    }

    @Test
    void testFromEdges() {
        var grid = BinnedGrid.fromEdges(500, 510, 525.5);
        assertEquals(2, grid.size());
        assertEquals("500-510", grid.bin(0).id());
        assertEquals("510-525.5", grid.bin(1).id());
        assertTrue(grid.isContiguous());
        assertTrue(grid.bin("510-525.5").isPresent());
    }

    @Test
    void testArange() {
        var grid = BinnedGrid.arange(535, 585, 10);
        assertEquals(5, grid.size());
        assertEquals(540, grid.bin(0).center());
        assertTrue(grid.isContiguous());
    }

    @Test
    void testNonContiguous() {
        var grid = new BinnedGrid(List.of(new Bin("a", 500, 510), new Bin("b", 520, 530)));
        assertFalse(grid.isContiguous());
    }

    @Test
    void testHalfOpenOverlap() {
        var bin = new Bin("a", 500, 510);
        assertTrue(bin.contains(500));
        assertFalse(bin.contains(510));
        assertTrue(bin.overlaps(Interval.point(500)));
        assertFalse(bin.overlaps(Interval.point(510)));
        assertFalse(bin.overlaps(Interval.of(510, 520)));
        assertTrue(bin.overlaps(Interval.of(509, 520)));
    }

    @Test
    void testAttachQuadratureTables() {
        var grid = BinnedGrid.arange(500, 520, 10);
        var table = QuadratureTable.builder("500-510").withMaxNodes(8).build();
        var attached = grid.withQuadratureTables(List.of(table));
        assertSame(table, attached.bin(0).quadratureTable().orElseThrow());
        assertTrue(attached.bin(1).quadratureTable().isEmpty());

        var stray = QuadratureTable.builder("900-910").build();
        assertThrows(IllegalArgumentException.class, () -> grid.withQuadratureTables(List.of(stray)));
        assertThrows(IllegalArgumentException.class, () -> new Bin("500-510", 500, 510, stray));
    }
}
