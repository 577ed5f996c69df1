package com.scholary.storage.image;

/**
 * Bounds and encoding for image optimization.
 *
 * @param quality JPEG quality 1-100
 * @param maxWidth largest width kept; wider images are scaled down
 * @param maxHeight largest height kept; taller images are scaled down
 * @param format output format, null keeps the input format
 */
public record ImageOptimizationOptions(int quality, int maxWidth, int maxHeight, String format) {

  public static ImageOptimizationOptions defaults() {
    return new ImageOptimizationOptions(85, 2048, 2048, null);
  }
}
