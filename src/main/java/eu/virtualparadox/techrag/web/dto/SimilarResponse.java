package eu.virtualparadox.techrag.web.dto;

import eu.virtualparadox.techrag.ingest.model.Chunk;

import java.util.List;

public record SimilarResponse(String query, List<Chunk> documents) {
}
