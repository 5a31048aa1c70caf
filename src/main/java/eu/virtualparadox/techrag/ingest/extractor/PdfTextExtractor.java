package eu.virtualparadox.techrag.ingest.extractor;

import eu.virtualparadox.techrag.ingest.cleaner.TextCleaner;
import eu.virtualparadox.techrag.ingest.model.ESourceType;
import eu.virtualparadox.techrag.ingest.model.ExtractedDocument;
import eu.virtualparadox.techrag.ingest.ocr.EOcrProfile;
import eu.virtualparadox.techrag.ingest.ocr.ImageEnhancer;
import eu.virtualparadox.techrag.ingest.ocr.OcrEngine;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * PDF-specific extractor that uses Apache PDFBox to produce one continuous text in page order.
 * <ul>
 *   <li>Embedded text is extracted page by page.</li>
 *   <li>A page whose embedded text is shorter than {@code minTextChars} is treated as a scan:
 *       it is rendered at {@code dpi}, enhanced with the {@link EOcrProfile#TEXT} profile and
 *       passed through OCR.</li>
 *   <li>Every non-blank page is preceded by {@code --- Page N ---} so that chunks keep the page
 *       number for citation.</li>
 * </ul>
 * <p>A failing page is logged and skipped; a document that cannot be opened raises
 * {@link ExtractionException}.</p>
 */
@Service
@Slf4j
public final class PdfTextExtractor implements TextExtractor {

    static final String PAGE_MARKER = "\n\n--- Page %d ---\n\n";

    private final TextCleaner textCleaner;
    private final ImageEnhancer imageEnhancer;
    private final OcrEngine ocrEngine;
    private final int minTextChars;
    private final float dpi;

    public PdfTextExtractor(final TextCleaner textCleaner,
                            final ImageEnhancer imageEnhancer,
                            final OcrEngine ocrEngine,
                            @Value("${techrag.ocr.min-text-chars:100}") final int minTextChars,
                            @Value("${techrag.ocr.dpi:300}") final float dpi) {
        this.textCleaner = textCleaner;
        this.imageEnhancer = imageEnhancer;
        this.ocrEngine = ocrEngine;
        this.minTextChars = minTextChars;
        this.dpi = dpi;
    }

    @Override
    public boolean supports(final Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public ExtractedDocument extract(final Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();
            final PDFRenderer renderer = new PDFRenderer(pdf);

            final StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pageCount; page++) {
                final String pageText = extractPage(pdf, stripper, renderer, page, path);
                if (!pageText.isBlank()) {
                    text.append(String.format(PAGE_MARKER, page)).append(pageText);
                }
            }

            return new ExtractedDocument(
                    path.toString(),
                    ESourceType.PDF,
                    path.getFileName().toString(),
                    text.toString().trim());
        }
        catch (IOException e) {
            throw new ExtractionException("Failed to extract text from PDF " + path, e);
        }
    }

    private String extractPage(final PDDocument pdf,
                               final PDFTextStripper stripper,
                               final PDFRenderer renderer,
                               final int page,
                               final Path path) {
        String embedded = "";
        try {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            embedded = textCleaner.cleanPreservingLines(stripper.getText(pdf));
            if (embedded.length() >= minTextChars) {
                return embedded;
            }

            log.info("Page {} of {} appears to be image-based, using OCR", page, path.getFileName());
            final BufferedImage raster = renderer.renderImageWithDPI(page - 1, dpi, ImageType.RGB);
            final BufferedImage enhanced = imageEnhancer.enhance(raster, EOcrProfile.TEXT);
            final String recognized = textCleaner.cleanPreservingLines(ocrEngine.recognize(enhanced, EOcrProfile.TEXT));

            // keep the short embedded text when OCR finds nothing better
            return recognized.length() >= embedded.length() ? recognized : embedded;
        }
        catch (IOException | RuntimeException e) {
            log.warn("Extraction failed for page {} of {}, continuing with the remaining pages", page, path, e);
            return embedded;
        }
    }
}
