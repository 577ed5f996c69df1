package com.scholary.storage.image;

/**
 * Output of the optimizer.
 *
 * @param data bytes to store; the original bytes when {@code optimized} is false
 * @param optimized whether the bytes were re-encoded
 * @param format detected or requested format, null when the input was not a readable image
 * @param width pixel width, 0 when unknown
 * @param height pixel height, 0 when unknown
 */
public record OptimizedImage(byte[] data, boolean optimized, String format, int width, int height) {

  static OptimizedImage unchanged(byte[] data, String format) {
    return new OptimizedImage(data, false, format, 0, 0);
  }
}
