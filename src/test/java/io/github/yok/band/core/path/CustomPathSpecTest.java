package io.github.yok.band.core.path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.band.core.error.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CustomPathSpecTest {

    @Test
    @DisplayName("負の区間番号は逆向き、絶対値 - 1 が区間番号になる")
    void signedIndicesMapToSegmentAndFlip() {
        CustomPathSpec spec = CustomPathSpec.of(2, -1);

        assertEquals(2, spec.size());
        assertEquals(1, spec.segmentId(0));
        assertFalse(spec.flipped(0));
        assertEquals(0, spec.segmentId(1));
        assertTrue(spec.flipped(1));
    }

    @Test
    @DisplayName("0 を含む指定は拒否される")
    void zeroIsRejected() {
        assertThrows(ConfigurationException.class, () -> CustomPathSpec.of(1, 0));
    }

    @Test
    @DisplayName("空の指定は拒否される")
    void emptyIsRejected() {
        assertThrows(ConfigurationException.class, () -> CustomPathSpec.of(List.of()));
    }

    @Test
    @DisplayName("区間数を超える番号は validate で拒否される")
    void outOfRangeIsRejected() {
        CustomPathSpec spec = CustomPathSpec.of(1, -3);

        ConfigurationException e =
                assertThrows(ConfigurationException.class, () -> spec.validate(2));
        assertTrue(e.getMessage().contains("-3"));
    }

    @Test
    @DisplayName("区間数ちょうどの番号は受け付ける")
    void boundaryIndexIsAccepted() {
        CustomPathSpec.of(2, -2, 1).validate(2);
    }
}
