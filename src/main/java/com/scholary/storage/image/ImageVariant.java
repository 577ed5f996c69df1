package com.scholary.storage.image;

import java.util.Locale;

/** Renditions generated next to an uploaded image. */
public enum ImageVariant {
  THUMBNAIL(150, 150, true),
  SMALL(300, 300, false),
  MEDIUM(600, 600, false),
  LARGE(1200, 1200, false);

  private final int width;
  private final int height;
  private final boolean crop;

  ImageVariant(int width, int height, boolean crop) {
    this.width = width;
    this.height = height;
    this.crop = crop;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  /** Whether the image is centre-cropped to fill the box instead of fitted inside it. */
  public boolean crop() {
    return crop;
  }

  /** Suffix used in variant keys, e.g. {@code thumbnail}. */
  public String suffix() {
    return name().toLowerCase(Locale.ROOT);
  }
}
