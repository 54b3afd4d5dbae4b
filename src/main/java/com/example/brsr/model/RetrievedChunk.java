package com.example.brsr.model;

/**
 * One chunk returned by the filtered similarity search.
 *
 * @param distance cosine distance to the query (lower is more similar)
 */
public record RetrievedChunk(String text, int pageNumber, String chunkId, double distance) {}
