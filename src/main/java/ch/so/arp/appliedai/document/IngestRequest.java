package ch.so.arp.appliedai.document;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Incoming payload for document ingestion.
 */
public record IngestRequest(@NotBlank String name, @NotNull String text) {
}
