package com.scholary.storage.provider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * On-the-fly image transformation requested through a URL.
 *
 * @param width target width in pixels
 * @param height target height in pixels
 * @param quality encoder quality 1-100
 * @param format output format such as webp or avif
 * @param fit resize mode (cover, contain, scale-down ...)
 * @param gravity crop anchor
 */
public record ImageTransform(
    Integer width, Integer height, Integer quality, String format, String fit, String gravity) {

  public static ImageTransform resize(int width, int height) {
    return new ImageTransform(width, height, null, null, null, null);
  }

  public boolean isEmpty() {
    return queryParameters(true).isEmpty();
  }

  /**
   * Set parameters in a stable order.
   *
   * @param compact use the one-letter names of Cloudflare image resizing (w, h, q, f)
   */
  public Map<String, String> queryParameters(boolean compact) {
    Map<String, String> params = new LinkedHashMap<>();
    put(params, compact ? "w" : "width", width);
    put(params, compact ? "h" : "height", height);
    put(params, compact ? "q" : "quality", quality);
    put(params, compact ? "f" : "format", format);
    put(params, "fit", fit);
    put(params, "gravity", gravity);
    return params;
  }

  /** Canonical form used in cache keys. Equal transforms give equal strings. */
  public String canonical() {
    return queryParameters(true).entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining("&"));
  }

  private static void put(Map<String, String> params, String name, Object value) {
    if (value != null && !value.toString().isBlank()) {
      params.put(name, value.toString());
    }
  }
}
