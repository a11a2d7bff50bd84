package ch.so.arp.appliedai.chat;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Incoming payload for chat requests.
 */
public record ChatRequest(@NotBlank @Size(max = 255) String conversationId, @NotBlank String message) {
}
