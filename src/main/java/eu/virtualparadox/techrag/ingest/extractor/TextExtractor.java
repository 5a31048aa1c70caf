package eu.virtualparadox.techrag.ingest.extractor;

import eu.virtualparadox.techrag.ingest.model.ExtractedDocument;

import java.nio.file.Path;

public interface TextExtractor {

    boolean supports(final Path path);

    ExtractedDocument extract(final Path path);

}
