package com.scholary.storage.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downscales and re-encodes images before upload.
 *
 * <p>Images larger than the configured box are scaled down to fit inside it, keeping the aspect
 * ratio. Images are never enlarged. JPEG output honours the quality setting.
 *
 * <p>Optimization must never lose an upload: anything that cannot be decoded or encoded is passed
 * through unchanged with {@code optimized=false}.
 */
public class ImageOptimizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ImageOptimizer.class);

  public OptimizedImage optimize(byte[] data, ImageOptimizationOptions options) {
    String format = null;
    try {
      format = detectFormat(data);
      BufferedImage source = format != null ? ImageIO.read(new ByteArrayInputStream(data)) : null;
      if (source == null) {
        LOGGER.debug("Not a readable image, skipping optimization: size={}", data.length);
        return OptimizedImage.unchanged(data, format);
      }

      if ("gif".equals(format)) {
        // re-encoding drops animation frames
        return OptimizedImage.unchanged(data, format);
      }

      String targetFormat = options.format() != null ? normalize(options.format()) : format;
      if (!canWrite(targetFormat)) {
        LOGGER.debug("No encoder for format {}, skipping optimization", targetFormat);
        return OptimizedImage.unchanged(data, format);
      }

      int[] size =
          fitWithin(source.getWidth(), source.getHeight(), options.maxWidth(), options.maxHeight());
      boolean resized = size[0] != source.getWidth() || size[1] != source.getHeight();
      BufferedImage target = resized ? scale(source, size[0], size[1], targetFormat) : source;

      byte[] encoded = encode(target, targetFormat, options.quality());
      // keep the original when re-encoding alone would only make it bigger
      if (!resized && targetFormat.equals(format) && encoded.length >= data.length) {
        return new OptimizedImage(data, false, format, source.getWidth(), source.getHeight());
      }

      LOGGER.info(
          "Optimized image: format={}, {}x{} -> {}x{}, bytes {} -> {}",
          targetFormat,
          source.getWidth(),
          source.getHeight(),
          size[0],
          size[1],
          data.length,
          encoded.length);
      return new OptimizedImage(encoded, true, targetFormat, size[0], size[1]);

    } catch (IOException | RuntimeException e) {
      LOGGER.warn("Image optimization failed, keeping original: {}", e.getMessage());
      return OptimizedImage.unchanged(data, format);
    }
  }

  /**
   * Render a variant. Empty when the input is not a readable image or encoding fails.
   *
   * @param data original image bytes
   * @param variant target box
   * @param quality JPEG quality 1-100
   */
  public Optional<OptimizedImage> createVariant(byte[] data, ImageVariant variant, int quality) {
    try {
      String format = detectFormat(data);
      BufferedImage source = format != null ? ImageIO.read(new ByteArrayInputStream(data)) : null;
      if (source == null || !canWrite(format)) {
        return Optional.empty();
      }
      BufferedImage rendered =
          variant.crop()
              ? cover(source, variant.width(), variant.height(), format)
              : fitInside(source, variant, format);
      byte[] encoded = encode(rendered, format, quality);
      return Optional.of(
          new OptimizedImage(encoded, true, format, rendered.getWidth(), rendered.getHeight()));

    } catch (IOException | RuntimeException e) {
      LOGGER.warn("Variant {} failed: {}", variant.suffix(), e.getMessage());
      return Optional.empty();
    }
  }

  private BufferedImage fitInside(BufferedImage source, ImageVariant variant, String format) {
    int[] size =
        fitWithin(source.getWidth(), source.getHeight(), variant.width(), variant.height());
    if (size[0] == source.getWidth() && size[1] == source.getHeight()) {
      return source;
    }
    return scale(source, size[0], size[1], format);
  }

  /** Scale to cover the box, then crop the centre. */
  private BufferedImage cover(BufferedImage source, int width, int height, String format) {
    double scale =
        Math.max((double) width / source.getWidth(), (double) height / source.getHeight());
    int scaledWidth = Math.max(width, (int) Math.round(source.getWidth() * scale));
    int scaledHeight = Math.max(height, (int) Math.round(source.getHeight() * scale));
    BufferedImage scaled = scale(source, scaledWidth, scaledHeight, format);
    int x = (scaledWidth - width) / 2;
    int y = (scaledHeight - height) / 2;
    return scaled.getSubimage(x, y, width, height);
  }

  /** Largest size inside the box with the same aspect ratio, never larger than the input. */
  static int[] fitWithin(int width, int height, int maxWidth, int maxHeight) {
    if (width <= maxWidth && height <= maxHeight) {
      return new int[] {width, height};
    }
    double ratio = Math.min((double) maxWidth / width, (double) maxHeight / height);
    return new int[] {
      Math.max(1, (int) Math.round(width * ratio)), Math.max(1, (int) Math.round(height * ratio))
    };
  }

  private static BufferedImage scale(BufferedImage source, int width, int height, String format) {
    BufferedImage target = new BufferedImage(width, height, imageType(source, format));
    Graphics2D graphics = target.createGraphics();
    try {
      graphics.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      graphics.drawImage(source, 0, 0, width, height, null);
    } finally {
      graphics.dispose();
    }
    return target;
  }

  private static int imageType(BufferedImage source, String format) {
    if ("jpeg".equals(format) || "bmp".equals(format)) {
      return BufferedImage.TYPE_INT_RGB;
    }
    return source.getColorModel().hasAlpha()
        ? BufferedImage.TYPE_INT_ARGB
        : BufferedImage.TYPE_INT_RGB;
  }

  private static byte[] encode(BufferedImage image, String format, int quality)
      throws IOException {
    BufferedImage output = image;
    if (("jpeg".equals(format) || "bmp".equals(format)) && image.getColorModel().hasAlpha()) {
      output = scale(image, image.getWidth(), image.getHeight(), format);
    }

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    if ("jpeg".equals(format)) {
      ImageWriter writer = ImageIO.getImageWritersByFormatName("jpeg").next();
      try (ImageOutputStream out = ImageIO.createImageOutputStream(bytes)) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(Math.max(1, Math.min(100, quality)) / 100f);
        writer.setOutput(out);
        writer.write(null, new IIOImage(output, null, null), param);
      } finally {
        writer.dispose();
      }
      return bytes.toByteArray();
    }

    if (!ImageIO.write(output, format, bytes)) {
      throw new IOException("No writer accepted the image for format " + format);
    }
    return bytes.toByteArray();
  }

  static String detectFormat(byte[] data) throws IOException {
    try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
      if (in == null) {
        return null;
      }
      Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
      if (!readers.hasNext()) {
        return null;
      }
      ImageReader reader = readers.next();
      try {
        return normalize(reader.getFormatName());
      } finally {
        reader.dispose();
      }
    }
  }

  private static boolean canWrite(String format) {
    return format != null && ImageIO.getImageWritersByFormatName(format).hasNext();
  }

  private static String normalize(String format) {
    String lower = format.toLowerCase(Locale.ROOT);
    return "jpg".equals(lower) ? "jpeg" : lower;
  }
}
