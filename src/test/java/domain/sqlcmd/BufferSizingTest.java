package domain.sqlcmd;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BufferSizingTest {

    @Test
    void nextPowerOf2Saturating() {
        assertEquals(0, BufferSizing.nextPowerOf2Saturating(0));
        assertEquals(1, BufferSizing.nextPowerOf2Saturating(1));
        assertEquals(2, BufferSizing.nextPowerOf2Saturating(2));
        assertEquals(4, BufferSizing.nextPowerOf2Saturating(3));
        assertEquals(4, BufferSizing.nextPowerOf2Saturating(4));
        assertEquals(8, BufferSizing.nextPowerOf2Saturating(5));
        assertEquals(8, BufferSizing.nextPowerOf2Saturating(8));
        assertEquals(0x4000_0000, BufferSizing.nextPowerOf2Saturating(0x3FFF_FFFF));
        assertEquals(0x4000_0000, BufferSizing.nextPowerOf2Saturating(0x4000_0000));
    }

    @Test
    void nextPowerOf2Saturating_saturatesAboveTwoToThe30() {
        assertEquals(Integer.MAX_VALUE, BufferSizing.nextPowerOf2Saturating(0x4000_0001));
        assertEquals(Integer.MAX_VALUE, BufferSizing.nextPowerOf2Saturating(Integer.MAX_VALUE - 1));
        assertEquals(Integer.MAX_VALUE, BufferSizing.nextPowerOf2Saturating(Integer.MAX_VALUE));
    }

    @Test
    void capacityFor_hasFloor() {
        assertEquals(4096, BufferSizing.capacityFor(0));
        assertEquals(4096, BufferSizing.capacityFor(4095));
        assertEquals(4096, BufferSizing.capacityFor(4096));
        assertEquals(8192, BufferSizing.capacityFor(4097));
    }
}
