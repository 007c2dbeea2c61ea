package com.flowmable.handwriting;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class BinarizerTest {

    private final Binarizer binarizer = new Binarizer(AnalysisSettings.DEFAULT);

    @Test
    void blankPage_hasNoInk() {
        BinaryMask mask = binarizer.binarize(RasterImage.of(SampleImages.blank(120, 80)));
        assertEquals(0, mask.inkCount());
        assertEquals(120, mask.width());
        assertEquals(80, mask.height());
    }

    @Test
    void darkBandOnWhite_isInk() {
        BufferedImage img = SampleImages.horizontalBands(100, 100, 10, 45);
        BinaryMask mask = binarizer.binarize(RasterImage.of(img));
        assertEquals(100 * 10, mask.inkCount());
        assertTrue(mask.isInk(50, 45));
        assertTrue(mask.isInk(50, 54));
        assertFalse(mask.isInk(50, 44));
        assertFalse(mask.isInk(50, 55));
    }

    @Test
    void uniformGrayPaper_localThresholdFindsNoInk() {
        // Uniformly darker paper is still paper under a local threshold
        BufferedImage img = SampleImages.blank(60, 60);
        SampleImages.fill(img, 0, 0, 60, 60, 0x909090);
        SampleImages.fill(img, 10, 28, 40, 3, 0x101010);
        BinaryMask mask = binarizer.binarize(RasterImage.of(img));
        assertEquals(40 * 3, mask.inkCount());
    }

    @Test
    void basicFidelity_usesGlobalThreshold() {
        Binarizer basic = new Binarizer(AnalysisSettings.DEFAULT.withFidelity(Fidelity.BASIC));
        BufferedImage img = SampleImages.blank(60, 60);
        SampleImages.fill(img, 0, 0, 60, 60, 0x909090);
        BinaryMask mask = basic.binarize(RasterImage.of(img));
        assertEquals(60 * 60, mask.inkCount());
    }

    @Test
    void imageSmallerThanBlock_windowIsClamped() {
        BufferedImage img = SampleImages.blank(5, 4);
        img.setRGB(2, 2, SampleImages.BLACK);
        BinaryMask mask = binarizer.binarize(RasterImage.of(img));
        assertEquals(1, mask.inkCount());
        assertTrue(mask.isInk(2, 2));
    }

    @Test
    void binarizedMask_isStableUnderRebinarization() {
        BufferedImage img = SampleImages.blank(200, 120);
        SampleImages.fill(img, 20, 30, 3, 40, 0x202020);
        SampleImages.fill(img, 20, 68, 30, 2, 0x303030);
        SampleImages.fill(img, 70, 30, 2, 40, 0x101060);
        SampleImages.fill(img, 90, 50, 40, 3, 0x000000);
        SampleImages.fill(img, 150, 20, 4, 80, 0x404040);
        img.setRGB(180, 100, 0x000000);

        BinaryMask once = binarizer.binarize(RasterImage.of(img));
        BinaryMask twice = binarizer.binarize(once.toRaster());

        assertTrue(once.inkCount() > 0);
        assertEquals(once, twice);
    }
}
