package eu.virtualparadox.techrag.ingest.ocr;

/**
 * Enhancement and recognition settings for a kind of raster input.
 */
public enum EOcrProfile {

    /**
     * Scanned text pages rendered from PDFs: adaptive thresholding plus speckle removal.
     */
    TEXT,

    /**
     * Photographed or scanned diagrams and schematics: contrast equalization plus Otsu
     * thresholding, recognition restricted to a technical character whitelist.
     */
    DIAGRAM
}
