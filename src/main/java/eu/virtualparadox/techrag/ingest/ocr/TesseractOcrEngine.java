package eu.virtualparadox.techrag.ingest.ocr;

import eu.virtualparadox.techrag.ingest.extractor.ExtractionException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.TessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Tess4J-backed {@link OcrEngine}.
 * <p>
 * {@link Tesseract} instances are not thread-safe, so a configured instance is created per call.
 * Page segmentation mode 6 (single uniform block of text) is used for both profiles; the
 * {@link EOcrProfile#DIAGRAM} profile additionally restricts recognition to characters that
 * occur in component designators and values.
 * </p>
 * <p>
 * A missing or broken native Tesseract library surfaces as {@link ExtractionException} like any
 * other recognition failure, so callers can skip the page or item and carry on.
 * </p>
 */
@Slf4j
@Component
public class TesseractOcrEngine implements OcrEngine {

    static final String TECHNICAL_WHITELIST =
            "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz.,()[]{}+-=*/:;";

    private static final int PAGE_SEG_MODE_SINGLE_BLOCK = 6;

    private final String dataPath;
    private final String language;

    public TesseractOcrEngine(@Value("${techrag.ocr.tessdata-path:}") final String dataPath,
                              @Value("${techrag.ocr.language:eng}") final String language) {
        this.dataPath = dataPath;
        this.language = language;
    }

    /**
     * Loads the native library once at startup. Text PDFs and web pages still work without it,
     * so a failure is reported instead of stopping the application.
     */
    @PostConstruct
    public void checkNativeLibrary() {
        try {
            log.info("Tesseract native library loaded: {}", TessAPI.INSTANCE.TessVersion());
        }
        catch (LinkageError e) {
            log.warn("Tesseract native library is not available, OCR will fail: {}", e.getMessage());
        }
    }

    @Override
    public String recognize(final BufferedImage image, final EOcrProfile profile) {
        try {
            final String text = newTesseract(profile).doOCR(image);
            log.debug("Tesseract recognized {} characters with profile {}", text == null ? 0 : text.length(), profile);
            return text == null ? "" : text;
        }
        catch (TesseractException e) {
            throw new ExtractionException("Tesseract failed to recognize image", e);
        }
        catch (LinkageError e) {
            throw new ExtractionException("Tesseract native library is not available: " + e.getMessage(), e);
        }
    }

    protected Tesseract newTesseract(final EOcrProfile profile) {
        final Tesseract tesseract = new Tesseract();
        if (dataPath != null && !dataPath.isBlank()) {
            tesseract.setDatapath(dataPath);
        }
        tesseract.setLanguage(language);
        tesseract.setPageSegMode(PAGE_SEG_MODE_SINGLE_BLOCK);
        if (profile == EOcrProfile.DIAGRAM) {
            tesseract.setVariable("tessedit_char_whitelist", TECHNICAL_WHITELIST);
        }
        return tesseract;
    }
}
