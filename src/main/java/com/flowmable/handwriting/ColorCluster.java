package com.flowmable.handwriting;

/**
 * A group of similar ink pixels.
 *
 * @param centroid   Mean colour of the member pixels
 * @param pixelCount Number of sampled pixels in the group
 */
public record ColorCluster(InkColor centroid, int pixelCount) {}
