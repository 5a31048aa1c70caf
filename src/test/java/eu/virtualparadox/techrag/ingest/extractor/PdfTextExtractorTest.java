package eu.virtualparadox.techrag.ingest.extractor;

import eu.virtualparadox.techrag.ingest.chunker.Chunker;
import eu.virtualparadox.techrag.ingest.cleaner.TextCleaner;
import eu.virtualparadox.techrag.ingest.model.ESourceType;
import eu.virtualparadox.techrag.ingest.model.ExtractedDocument;
import eu.virtualparadox.techrag.ingest.ocr.EOcrProfile;
import eu.virtualparadox.techrag.ingest.ocr.ImageEnhancer;
import eu.virtualparadox.techrag.testsupport.FakeOcrEngine;
import eu.virtualparadox.techrag.testsupport.TestVocabulary;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests PdfTextExtractor against PDFs generated on the fly: a page with embedded text and a
 * page without any (standing in for a scan).
 */
class PdfTextExtractorTest {

    private static final List<String> TEXT_LINES = List.of(
            "A quarter wave vertical needs a good ground plane to work well.",
            "Use a balun at the feed point to suppress common mode current.",
            "Check the SWR across the band before transmitting at full power.");

    private static final String OCR_TEXT = "Scanned page about impedance matching with a tuner";

    @TempDir
    Path tempDir;

    private PdfTextExtractor extractor(FakeOcrEngine ocr) {
        // 72 dpi keeps the rendered test pages small
        return new PdfTextExtractor(new TextCleaner(), new ImageEnhancer(11, 2), ocr, 100, 72f);
    }

    private Path writePdf(String name, boolean withTextPage, boolean withBlankPage) throws IOException {
        Path file = tempDir.resolve(name);
        try (PDDocument doc = new PDDocument()) {
            if (withTextPage) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(PDType1Font.HELVETICA, 12);
                    cs.setLeading(16);
                    cs.newLineAtOffset(50, 700);
                    for (String line : TEXT_LINES) {
                        cs.showText(line);
                        cs.newLine();
                    }
                    cs.endText();
                }
            }
            if (withBlankPage) {
                doc.addPage(new PDPage());
            }
            doc.save(file.toFile());
        }
        return file;
    }

    @Test
    @DisplayName("Embedded text is used directly and image-only pages fall back to OCR")
    void mixedDocument_usesOcrOnlyForImagePages() throws IOException {
        FakeOcrEngine ocr = new FakeOcrEngine(OCR_TEXT);
        Path pdf = writePdf("mixed.pdf", true, true);

        ExtractedDocument doc = extractor(ocr).extract(pdf);

        assertEquals(ESourceType.PDF, doc.sourceType());
        assertEquals("mixed.pdf", doc.title());
        assertEquals(pdf.toString(), doc.source());
        assertTrue(doc.text().startsWith("--- Page 1 ---"), doc.text());
        assertTrue(doc.text().contains("Use a balun at the feed point"));
        assertTrue(doc.text().contains("\n\n--- Page 2 ---\n\n" + OCR_TEXT));
        assertEquals(List.of(EOcrProfile.TEXT), ocr.calls());
    }

    @Test
    @DisplayName("A scanned page whose OCR finds nothing contributes no text and no marker")
    void blankScan_yieldsNoText() throws IOException {
        FakeOcrEngine ocr = new FakeOcrEngine("   ");
        Path pdf = writePdf("scan.pdf", false, true);

        ExtractedDocument doc = extractor(ocr).extract(pdf);

        assertTrue(doc.isBlank());
        assertEquals(1, ocr.calls().size());
        Chunker chunker = new Chunker(1000, 200, TestVocabulary.relevanceFilter());
        assertTrue(chunker.chunk(doc).isEmpty());
    }

    @Test
    @DisplayName("OCR output of a scanned page becomes chunkable text")
    void scannedPage_producesChunks() throws IOException {
        Path pdf = writePdf("scan.pdf", false, true);

        ExtractedDocument doc = extractor(new FakeOcrEngine(OCR_TEXT)).extract(pdf);

        Chunker chunker = new Chunker(1000, 200, TestVocabulary.relevanceFilter());
        assertEquals("--- Page 1 ---\n\n" + OCR_TEXT, doc.text());
        assertEquals(1, chunker.chunk(doc).size());
    }

    @Test
    @DisplayName("A file that is not a PDF raises ExtractionException")
    void corruptFile_raisesExtractionException() throws IOException {
        Path broken = tempDir.resolve("broken.pdf");
        Files.writeString(broken, "this is not a pdf");

        assertThrows(ExtractionException.class, () -> extractor(new FakeOcrEngine("")).extract(broken));
    }

    @Test
    void supportsPdfExtensionOnly() {
        PdfTextExtractor extractor = extractor(new FakeOcrEngine(""));

        assertTrue(extractor.supports(Path.of("manual.pdf")));
        assertTrue(extractor.supports(Path.of("MANUAL.PDF")));
        assertFalse(extractor.supports(Path.of("schematic.png")));
    }

    @Test
    @DisplayName("A page whose OCR fails is skipped and the other pages are kept")
    void failingOcrPage_isSkipped() throws IOException {
        FakeOcrEngine ocr = FakeOcrEngine.failing(new ExtractionException("OCR unavailable"));
        Path pdf = writePdf("mixed.pdf", true, true);

        ExtractedDocument doc = extractor(ocr).extract(pdf);

        assertEquals(1, ocr.calls().size());
        assertTrue(doc.text().startsWith("--- Page 1 ---"), doc.text());
        assertTrue(doc.text().contains("Check the SWR across the band"));
        assertFalse(doc.text().contains("--- Page 2 ---"), doc.text());
    }
}
