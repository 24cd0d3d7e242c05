package io.github.yok.band.core.path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PathSegmentTest {

    @Test
    @DisplayName("逆向きの区間は終点から始点へ並ぶ")
    void reversedIndicesRunBackwards() {
        PathSegment segment = new PathSegment(0, 3, 7, "A", "B", false);

        assertArrayEquals(new int[] {3, 4, 5, 6}, segment.indices());
        assertArrayEquals(new int[] {6, 5, 4, 3}, segment.withReversed(true).indices());
        assertEquals("B", segment.withReversed(true).firstLabel());
        assertEquals("A", segment.withReversed(true).lastLabel());
    }

    @Test
    @DisplayName("2 回反転すると元の並びに戻る")
    void doubleReversalIsIdentity() {
        double[] row = {10, 11, 12, 13, 14, 15};
        ResolvedPath once = new ResolvedPath(
                List.of(new PathSegment(0, 1, 5, "A", "B", true)));
        double[] reversed = once.slice(row, 0);
        double[] back = new double[reversed.length];
        for (int i = 0; i < reversed.length; i++) {
            back[i] = reversed[reversed.length - 1 - i];
        }

        assertArrayEquals(new double[] {11, 12, 13, 14}, back);
        assertArrayEquals(new PathSegment(0, 1, 5, "A", "B", false).indices(),
                once.segment(0).withReversed(false).indices());
    }

    @Test
    @DisplayName("空の区間は生成できない")
    void emptyRangeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new PathSegment(0, 4, 4, "A", "B", false));
    }
}
