package org.satpath.baseline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DistanceTest {

    @Test
    @DisplayName("Una distanza non raggiunta è maggiore di ogni distanza raggiunta")
    void ordering() {
        assertAll(
                () -> assertTrue(Distance.reached(Long.MAX_VALUE - 1).compareTo(Distance.unreached()) < 0),
                () -> assertTrue(Distance.unreached().compareTo(Distance.reached(0)) > 0),
                () -> assertEquals(0, Distance.unreached().compareTo(Distance.unreached())),
                () -> assertTrue(Distance.reached(3).compareTo(Distance.reached(5)) < 0)
        );
    }

    @Test
    @DisplayName("Estensione di un arco")
    void plus() {
        assertEquals(Distance.reached(7), Distance.reached(4).plus(3));
        assertFalse(Distance.unreached().plus(3).isReached());
    }

    @Test
    @DisplayName("Valore di una distanza non raggiunta non disponibile")
    void unreachedHasNoValue() {
        assertThrows(IllegalStateException.class, () -> Distance.unreached().value());
        assertThrows(IllegalArgumentException.class, () -> Distance.reached(-1));
    }
}
