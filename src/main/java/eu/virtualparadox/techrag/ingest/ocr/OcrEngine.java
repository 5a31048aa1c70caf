package eu.virtualparadox.techrag.ingest.ocr;

import java.awt.image.BufferedImage;

/**
 * Optical character recognition over an already enhanced raster image.
 */
public interface OcrEngine {

    /**
     * @param image   enhanced (binarized) image
     * @param profile recognition settings to apply
     * @return recognized text, empty when nothing was found
     * @throws eu.virtualparadox.techrag.ingest.extractor.ExtractionException if the engine fails
     */
    String recognize(BufferedImage image, EOcrProfile profile);
}
