package com.photocheck.sdk.camera;

import org.junit.Test;

import static org.junit.Assert.*;

public class PixelRegionTest {

    @Test
    public void fromEdges_roundsOutward() {
        PixelRegion r = PixelRegion.fromEdges(10.4f, 20.6f, 30.2f, 40.9f);
        assertEquals(10, r.x);
        assertEquals(20, r.y);
        assertEquals(21, r.width);
        assertEquals(21, r.height);
    }

    @Test
    public void pad_growsEverySide() {
        PixelRegion r = new PixelRegion(50, 50, 20, 10).pad(0.5f, 0.5f);
        assertEquals(40, r.x);
        assertEquals(45, r.y);
        assertEquals(40, r.width);
        assertEquals(20, r.height);
    }

    @Test
    public void clampTo_cutsAtFrameEdges() {
        PixelRegion r = new PixelRegion(-5, 190, 20, 20).clampTo(200, 200);
        assertEquals(0, r.x);
        assertEquals(190, r.y);
        assertEquals(15, r.width);
        assertEquals(10, r.height);
    }

    @Test
    public void outsideFrame_isEmpty() {
        assertTrue(new PixelRegion(250, 250, 10, 10).clampTo(200, 200).isEmpty());
        assertEquals(0, new PixelRegion(0, 0, -3, 4).area());
    }

    @Test
    public void contains_isHalfOpen() {
        PixelRegion r = new PixelRegion(0, 0, 10, 10);
        assertTrue(r.contains(0, 0));
        assertTrue(r.contains(9, 9));
        assertFalse(r.contains(10, 5));
    }
}
