package io.vfslite.bench;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ZipfianFilePickerTest {

    private static final List<String> FILES = List.of("hot", "warm", "mild", "cool", "cold");

    @Test
    void picks_only_known_files_and_favours_the_head() {
        var picker = new ZipfianFilePicker(FILES, 0.99, 1L);
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < 20_000; i++) {
            counts.merge(picker.nextFile(), 1, Integer::sum);
        }
        assertTrue(FILES.containsAll(counts.keySet()), counts.toString());
        assertTrue(counts.get("hot") > counts.get("mild"), counts.toString());
        assertTrue(counts.get("hot") > counts.get("cold") * 3, counts.toString());
    }

    @Test
    void shares_sum_to_one_and_decrease_with_rank() {
        var picker = new ZipfianFilePicker(FILES, 1.0, 1L);
        double sum = 0.0;
        for (int r = 0; r < picker.fileCount(); r++) {
            sum += picker.share(r);
            if (r > 0) {
                assertTrue(picker.share(r) < picker.share(r - 1), "rank " + r);
            }
        }
        assertEquals(1.0, sum, 1e-9);
        // harmonic weights 1, 1/2, 1/3, 1/4, 1/5
        assertEquals(1.0 / (1 + 0.5 + 1.0 / 3 + 0.25 + 0.2), picker.share(0), 1e-9);
        assertThrows(IndexOutOfBoundsException.class, () -> picker.share(5));
    }

    @Test
    void same_seed_same_sequence() {
        var a = new ZipfianFilePicker(FILES, 1.2, 99L);
        var b = new ZipfianFilePicker(FILES, 1.2, 99L);
        for (int i = 0; i < 100; i++) {
            assertEquals(a.nextRank(), b.nextRank());
            assertEquals(a.roll(100), b.roll(100));
        }
    }

    @Test
    void rejects_bad_parameters() {
        assertThrows(IllegalArgumentException.class, () -> new ZipfianFilePicker(List.of(), 1.0, 1L));
        assertThrows(IllegalArgumentException.class, () -> new ZipfianFilePicker(FILES, 0.0, 1L));
    }
}
