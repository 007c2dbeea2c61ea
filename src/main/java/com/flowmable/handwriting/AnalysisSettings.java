package com.flowmable.handwriting;

/**
 * Tunable parameters of the analysis pipeline.
 *
 * @param fidelity             Estimator variant selection
 * @param globalThreshold      Basic binarization: gray mean below this is ink (0–255)
 * @param blockSize            Enhanced binarization: side of the local mean window, in pixels
 * @param thresholdOffset      Enhanced binarization: constant subtracted from the local mean
 * @param darkPixelThreshold   Ink-colour candidates need every channel below this (0–255)
 * @param clusterMergeDistance Max RGB distance for merging a pixel into a running-mean cluster
 * @param colorSampleSize      Max pixels sampled for the ink colour, at a fixed stride
 * @param edgeThreshold        Sobel magnitude above which a mask pixel is an edge (mask read as {0,1})
 * @param houghVoteThreshold   Votes an angle needs in some ρ bin to be dominant
 * @param thetaStepDegrees     Hough θ discretization step over [0°, 180°)
 * @param maxSlantDegrees      Dominant angles further than this from vertical strokes are ignored
 * @param minCharDimension     Smallest accepted glyph-run width/height, in pixels
 * @param maxCharDimension     Largest accepted glyph-run width/height, in pixels
 * @param lastLineBandHeight   Band height assumed around a line with no neighbour on one side
 * @param recognizedTextWeight Weight of the recognized-text width estimate in the character width blend [0, 1]
 */
public record AnalysisSettings(
        Fidelity fidelity,
        int globalThreshold,
        int blockSize,
        double thresholdOffset,
        int darkPixelThreshold,
        double clusterMergeDistance,
        int colorSampleSize,
        double edgeThreshold,
        int houghVoteThreshold,
        double thetaStepDegrees,
        double maxSlantDegrees,
        int minCharDimension,
        int maxCharDimension,
        int lastLineBandHeight,
        double recognizedTextWeight
) {

    public static final AnalysisSettings DEFAULT = new AnalysisSettings(
            Fidelity.ENHANCED,
            200,    // globalThreshold
            15,     // blockSize
            10.0,   // thresholdOffset
            180,    // darkPixelThreshold
            50.0,   // clusterMergeDistance
            10_000, // colorSampleSize
            2.0,    // edgeThreshold
            10,     // houghVoteThreshold
            1.0,    // thetaStepDegrees
            45.0,   // maxSlantDegrees
            4,      // minCharDimension
            99,     // maxCharDimension
            50,     // lastLineBandHeight
            0.5     // recognizedTextWeight
    );

    public AnalysisSettings {
        if (fidelity == null) {
            throw new InvalidInputException("fidelity is required");
        }
        requireRange("globalThreshold", globalThreshold, 1, 255);
        requireRange("blockSize", blockSize, 1, Integer.MAX_VALUE);
        requireFinite("thresholdOffset", thresholdOffset);
        requireRange("darkPixelThreshold", darkPixelThreshold, 1, 256);
        requirePositive("clusterMergeDistance", clusterMergeDistance);
        requireRange("colorSampleSize", colorSampleSize, 1, Integer.MAX_VALUE);
        requirePositive("edgeThreshold", edgeThreshold);
        requireRange("houghVoteThreshold", houghVoteThreshold, 0, Integer.MAX_VALUE);
        if (!(thetaStepDegrees > 0 && thetaStepDegrees <= 90)) {
            throw new InvalidInputException("thetaStepDegrees must be in (0, 90]: " + thetaStepDegrees);
        }
        if (!(maxSlantDegrees >= 0 && maxSlantDegrees < 90)) {
            throw new InvalidInputException("maxSlantDegrees must be in [0, 90): " + maxSlantDegrees);
        }
        requireRange("minCharDimension", minCharDimension, 1, Integer.MAX_VALUE);
        requireRange("maxCharDimension", maxCharDimension, minCharDimension, Integer.MAX_VALUE);
        requireRange("lastLineBandHeight", lastLineBandHeight, 1, Integer.MAX_VALUE);
        if (!(recognizedTextWeight >= 0 && recognizedTextWeight <= 1)) {
            throw new InvalidInputException("recognizedTextWeight must be in [0, 1]: " + recognizedTextWeight);
        }
    }

    public AnalysisSettings withFidelity(Fidelity value) {
        return new AnalysisSettings(value, globalThreshold, blockSize, thresholdOffset, darkPixelThreshold,
                clusterMergeDistance, colorSampleSize, edgeThreshold, houghVoteThreshold, thetaStepDegrees,
                maxSlantDegrees, minCharDimension, maxCharDimension, lastLineBandHeight, recognizedTextWeight);
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new InvalidInputException(name + " must be in [" + min + ", " + max + "]: " + value);
        }
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(name + " must be finite: " + value);
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new InvalidInputException(name + " must be positive: " + value);
        }
    }
}
