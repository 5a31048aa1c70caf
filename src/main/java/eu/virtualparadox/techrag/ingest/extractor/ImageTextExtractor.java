package eu.virtualparadox.techrag.ingest.extractor;

import eu.virtualparadox.techrag.ingest.cleaner.TextCleaner;
import eu.virtualparadox.techrag.ingest.enrich.TechnicalValueExtractor;
import eu.virtualparadox.techrag.ingest.model.ESourceType;
import eu.virtualparadox.techrag.ingest.model.ExtractedDocument;
import eu.virtualparadox.techrag.ingest.ocr.EOcrProfile;
import eu.virtualparadox.techrag.ingest.ocr.ImageEnhancer;
import eu.virtualparadox.techrag.ingest.ocr.OcrEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Extractor for raw images (scanned diagrams, schematics, photographed pages).
 * <p>
 * The image is enhanced with the {@link EOcrProfile#DIAGRAM} profile and recognized; the raw OCR
 * text is kept verbatim and followed by the technical-value block mined from it. An image in which
 * nothing is recognized yields a blank document.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class ImageTextExtractor implements TextExtractor {

    static final Set<String> EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".tiff", ".tif", ".bmp");

    private final TextCleaner textCleaner;
    private final ImageEnhancer imageEnhancer;
    private final OcrEngine ocrEngine;
    private final TechnicalValueExtractor technicalValueExtractor;

    @Override
    public boolean supports(final Path path) {
        final String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        final int dot = name.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(name.substring(dot));
    }

    @Override
    public ExtractedDocument extract(final Path path) {
        final BufferedImage image = read(path);
        final BufferedImage enhanced = imageEnhancer.enhance(image, EOcrProfile.DIAGRAM);
        final String ocrText = textCleaner.cleanPreservingLines(ocrEngine.recognize(enhanced, EOcrProfile.DIAGRAM));

        final String fileName = path.getFileName().toString();
        if (ocrText.isBlank()) {
            log.info("No text recognized in image {}", fileName);
            return new ExtractedDocument(path.toString(), ESourceType.IMAGE, fileName, "");
        }

        final String text = "Image Analysis:\n" + ocrText
                + "\n\nTechnical Information:\n" + technicalValueExtractor.describe(ocrText);
        return new ExtractedDocument(path.toString(), ESourceType.IMAGE, fileName, text);
    }

    private static BufferedImage read(final Path path) {
        try {
            final BufferedImage image = ImageIO.read(path.toFile());
            if (image == null) {
                throw new ExtractionException("Unsupported or corrupt image: " + path);
            }
            return image;
        }
        catch (IOException e) {
            throw new ExtractionException("Failed to read image " + path, e);
        }
    }
}
