package ch.so.arp.appliedai.status;

import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.appliedai.document.DocumentStore;
import ch.so.arp.appliedai.document.StoreCounts;

/**
 * Liveness and store statistics.
 */
@RestController
public class StatusController {

    private static final String OK = "ok";

    private final DocumentStore documentStore;

    public StatusController(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return Map.of("status", OK);
    }

    @GetMapping(path = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public StatsResponse stats() {
        StoreCounts counts = documentStore.counts();
        return new StatsResponse(OK, counts.turns(), counts.documents(), counts.chunks());
    }
}
