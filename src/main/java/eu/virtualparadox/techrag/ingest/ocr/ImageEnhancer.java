package eu.virtualparadox.techrag.ingest.ocr;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Prepares raster images for OCR.
 *
 * <h2>Profiles</h2>
 * <ul>
 *   <li>{@link EOcrProfile#TEXT}: grayscale, adaptive Gaussian threshold over a
 *       {@code blockSize × blockSize} neighbourhood (pixel is white when it exceeds the local
 *       weighted mean minus {@value #ADAPTIVE_C}), then a morphological close followed by an open
 *       with a square kernel. Closing removes dark speckles smaller than the kernel, opening removes
 *       light ones; strokes wider than the kernel survive both.</li>
 *   <li>{@link EOcrProfile#DIAGRAM}: grayscale, contrast-limited adaptive histogram equalization
 *       (clip limit {@value #CLAHE_CLIP_LIMIT}, {@value #CLAHE_TILES}×{@value #CLAHE_TILES} tiles),
 *       then a global Otsu threshold.</li>
 * </ul>
 * <p>Output images are {@link BufferedImage#TYPE_BYTE_GRAY} with only the values 0 and 255.
 * The component is stateless and thread-safe.</p>
 */
@Component
public class ImageEnhancer {

    static final int ADAPTIVE_C = 2;
    static final double CLAHE_CLIP_LIMIT = 2.0;
    static final int CLAHE_TILES = 8;

    private static final int LEVELS = 256;

    private final int blockSize;
    private final int morphKernelSize;

    public ImageEnhancer(@Value("${techrag.ocr.adaptive-block-size:11}") final int blockSize,
                         @Value("${techrag.ocr.morph-kernel-size:2}") final int morphKernelSize) {
        if (blockSize < 3 || blockSize % 2 == 0) {
            throw new IllegalArgumentException("blockSize must be an odd number >= 3");
        }
        if (morphKernelSize < 1) {
            throw new IllegalArgumentException("morphKernelSize must be positive");
        }
        this.blockSize = blockSize;
        this.morphKernelSize = morphKernelSize;
    }

    public BufferedImage enhance(final BufferedImage source, final EOcrProfile profile) {
        return switch (profile) {
            case TEXT -> enhanceForText(source);
            case DIAGRAM -> enhanceForDiagram(source);
        };
    }

    public BufferedImage enhanceForText(final BufferedImage source) {
        final int width = source.getWidth();
        final int height = source.getHeight();

        final int[] gray = toGray(source);
        int[] binary = adaptiveThreshold(gray, width, height);
        binary = close(binary, width, height);
        binary = open(binary, width, height);
        return toImage(binary, width, height);
    }

    public BufferedImage enhanceForDiagram(final BufferedImage source) {
        final int width = source.getWidth();
        final int height = source.getHeight();

        final int[] equalized = clahe(toGray(source), width, height);
        final int threshold = otsuThreshold(equalized);

        final int[] binary = new int[equalized.length];
        for (int i = 0; i < equalized.length; i++) {
            binary[i] = equalized[i] > threshold ? 255 : 0;
        }
        return toImage(binary, width, height);
    }

    // ---------- grayscale ----------

    static int[] toGray(final BufferedImage image) {
        final int width = image.getWidth();
        final int height = image.getHeight();
        final int[] gray = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final int rgb = image.getRGB(x, y);
                final int r = (rgb >> 16) & 0xFF;
                final int g = (rgb >> 8) & 0xFF;
                final int b = rgb & 0xFF;
                gray[y * width + x] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
            }
        }
        return gray;
    }

    private static BufferedImage toImage(final int[] pixels, final int width, final int height) {
        final BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        final WritableRaster raster = out.getRaster();
        raster.setSamples(0, 0, width, height, 0, pixels);
        return out;
    }

    // ---------- adaptive threshold ----------

    private int[] adaptiveThreshold(final int[] gray, final int width, final int height) {
        final double[] kernel = gaussianKernel(blockSize);
        final double[] mean = separableBlur(gray, width, height, kernel);

        final int[] out = new int[gray.length];
        for (int i = 0; i < gray.length; i++) {
            out[i] = gray[i] > mean[i] - ADAPTIVE_C ? 255 : 0;
        }
        return out;
    }

    /**
     * Normalized 1-D Gaussian kernel; sigma is derived from the size the same way common
     * imaging libraries do when no sigma is given.
     */
    static double[] gaussianKernel(final int size) {
        final double sigma = 0.3 * ((size - 1) * 0.5 - 1) + 0.8;
        final double[] kernel = new double[size];
        final int half = size / 2;
        double sum = 0;
        for (int i = 0; i < size; i++) {
            final int d = i - half;
            kernel[i] = Math.exp(-(d * d) / (2 * sigma * sigma));
            sum += kernel[i];
        }
        for (int i = 0; i < size; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }

    private static double[] separableBlur(final int[] src, final int width, final int height, final double[] kernel) {
        final int half = kernel.length / 2;
        final double[] horizontal = new double[src.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double acc = 0;
                for (int k = 0; k < kernel.length; k++) {
                    final int xx = clamp(x + k - half, width);
                    acc += kernel[k] * src[y * width + xx];
                }
                horizontal[y * width + x] = acc;
            }
        }

        final double[] out = new double[src.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double acc = 0;
                for (int k = 0; k < kernel.length; k++) {
                    final int yy = clamp(y + k - half, height);
                    acc += kernel[k] * horizontal[yy * width + x];
                }
                out[y * width + x] = acc;
            }
        }
        return out;
    }

    // ---------- morphology ----------

    private int[] close(final int[] binary, final int width, final int height) {
        return erode(dilate(binary, width, height), width, height);
    }

    private int[] open(final int[] binary, final int width, final int height) {
        return dilate(erode(binary, width, height), width, height);
    }

    /**
     * Max filter over the reflected square structuring element.
     */
    private int[] dilate(final int[] src, final int width, final int height) {
        return rankFilter(src, width, height, true);
    }

    /**
     * Min filter over the square structuring element.
     */
    private int[] erode(final int[] src, final int width, final int height) {
        return rankFilter(src, width, height, false);
    }

    private int[] rankFilter(final int[] src, final int width, final int height, final boolean max) {
        if (morphKernelSize == 1) {
            return src.clone();
        }
        final int anchor = morphKernelSize / 2;
        // element offsets are [-anchor, size - 1 - anchor]; dilation visits them reflected
        final int from = max ? -(morphKernelSize - 1 - anchor) : -anchor;
        final int to = max ? anchor : morphKernelSize - 1 - anchor;

        final int[] horizontal = new int[src.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int acc = max ? 0 : 255;
                for (int d = from; d <= to; d++) {
                    final int v = src[y * width + clamp(x + d, width)];
                    acc = max ? Math.max(acc, v) : Math.min(acc, v);
                }
                horizontal[y * width + x] = acc;
            }
        }

        final int[] out = new int[src.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int acc = max ? 0 : 255;
                for (int d = from; d <= to; d++) {
                    final int v = horizontal[clamp(y + d, height) * width + x];
                    acc = max ? Math.max(acc, v) : Math.min(acc, v);
                }
                out[y * width + x] = acc;
            }
        }
        return out;
    }

    // ---------- CLAHE ----------

    static int[] clahe(final int[] gray, final int width, final int height) {
        final int tilesX = Math.min(CLAHE_TILES, width);
        final int tilesY = Math.min(CLAHE_TILES, height);
        final int tileWidth = (width + tilesX - 1) / tilesX;
        final int tileHeight = (height + tilesY - 1) / tilesY;

        final int[][][] luts = new int[tilesY][tilesX][];
        for (int ty = 0; ty < tilesY; ty++) {
            for (int tx = 0; tx < tilesX; tx++) {
                final int x0 = tx * tileWidth;
                final int y0 = ty * tileHeight;
                final int x1 = Math.min(x0 + tileWidth, width);
                final int y1 = Math.min(y0 + tileHeight, height);
                luts[ty][tx] = tileLut(gray, width, x0, y0, x1, y1);
            }
        }

        final int[] out = new int[gray.length];
        for (int y = 0; y < height; y++) {
            final double gy = (y + 0.5) / tileHeight - 0.5;
            final int ty1 = clamp((int) Math.floor(gy), tilesY);
            final int ty2 = clamp(ty1 + 1, tilesY);
            final double wy = Math.min(Math.max(gy - Math.floor(gy), 0.0), 1.0);
            final double weightY = gy < 0 ? 0.0 : wy;

            for (int x = 0; x < width; x++) {
                final double gx = (x + 0.5) / tileWidth - 0.5;
                final int tx1 = clamp((int) Math.floor(gx), tilesX);
                final int tx2 = clamp(tx1 + 1, tilesX);
                final double wx = Math.min(Math.max(gx - Math.floor(gx), 0.0), 1.0);
                final double weightX = gx < 0 ? 0.0 : wx;

                final int v = gray[y * width + x];
                final double top = (1 - weightX) * luts[ty1][tx1][v] + weightX * luts[ty1][tx2][v];
                final double bottom = (1 - weightX) * luts[ty2][tx1][v] + weightX * luts[ty2][tx2][v];
                out[y * width + x] = (int) Math.round((1 - weightY) * top + weightY * bottom);
            }
        }
        return out;
    }

    private static int[] tileLut(final int[] gray, final int width,
                                 final int x0, final int y0, final int x1, final int y1) {
        final int[] hist = new int[LEVELS];
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                hist[gray[y * width + x]]++;
            }
        }
        final int area = Math.max(1, (x1 - x0) * (y1 - y0));

        // clip and redistribute the excess uniformly
        final int clip = Math.max(1, (int) (CLAHE_CLIP_LIMIT * area / LEVELS));
        int excess = 0;
        for (int i = 0; i < LEVELS; i++) {
            if (hist[i] > clip) {
                excess += hist[i] - clip;
                hist[i] = clip;
            }
        }
        final int bonus = excess / LEVELS;
        final int residual = excess % LEVELS;
        for (int i = 0; i < LEVELS; i++) {
            hist[i] += bonus + (i < residual ? 1 : 0);
        }

        final int[] lut = new int[LEVELS];
        long cdf = 0;
        for (int i = 0; i < LEVELS; i++) {
            cdf += hist[i];
            lut[i] = (int) Math.min(255, Math.round(cdf * 255.0 / area));
        }
        return lut;
    }

    // ---------- Otsu ----------

    /**
     * Global threshold maximizing the between-class variance of the gray-level histogram.
     * Pixels strictly above the returned value belong to the bright class.
     */
    static int otsuThreshold(final int[] gray) {
        final long[] hist = new long[LEVELS];
        for (final int v : gray) {
            hist[v]++;
        }
        final long total = gray.length;
        double sumAll = 0;
        for (int i = 0; i < LEVELS; i++) {
            sumAll += (double) i * hist[i];
        }

        double sumBackground = 0;
        long weightBackground = 0;
        double bestVariance = -1;
        int threshold = 0;
        for (int t = 0; t < LEVELS; t++) {
            weightBackground += hist[t];
            if (weightBackground == 0) {
                continue;
            }
            final long weightForeground = total - weightBackground;
            if (weightForeground == 0) {
                break;
            }
            sumBackground += (double) t * hist[t];
            final double meanBackground = sumBackground / weightBackground;
            final double meanForeground = (sumAll - sumBackground) / weightForeground;
            final double diff = meanBackground - meanForeground;
            final double variance = (double) weightBackground * weightForeground * diff * diff;
            if (variance > bestVariance) {
                bestVariance = variance;
                threshold = t;
            }
        }
        return threshold;
    }

    private static int clamp(final int value, final int size) {
        if (value < 0) {
            return 0;
        }
        return Math.min(value, size - 1);
    }
}
