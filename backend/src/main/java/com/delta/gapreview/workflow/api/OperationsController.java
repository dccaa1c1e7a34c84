package com.delta.gapreview.workflow.api;

import com.delta.gapreview.cache.ResultCache;
import com.delta.gapreview.collab.JdbcDocumentStore;
import com.delta.gapreview.collab.StoredDocument;
import com.delta.gapreview.error.DocumentNotFoundException;
import com.delta.gapreview.quota.QuotaLedger;
import com.delta.gapreview.quota.QuotaSnapshot;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class OperationsController {
    private final QuotaLedger quotaLedger;
    private final ResultCache resultCache;
    private final JdbcDocumentStore documentStore;

    public OperationsController(QuotaLedger quotaLedger, ResultCache resultCache, JdbcDocumentStore documentStore) {
        this.quotaLedger = quotaLedger;
        this.resultCache = resultCache;
        this.documentStore = documentStore;
    }

    @GetMapping("/quota/{resource}")
    public QuotaSnapshot quota(@PathVariable("resource") String resource) {
        return quotaLedger.snapshot(resource);
    }

    @PostMapping("/cache/clear")
    public Map<String, List<String>> clearCache() {
        resultCache.clear();
        return Map.of("clearedTiers", resultCache.tierNames());
    }

    @PutMapping("/documents/{documentRef}")
    public StoredDocument putDocument(
        @PathVariable("documentRef") String documentRef,
        @RequestBody DocumentRequest request
    ) {
        if (request == null || request.content() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "content is required");
        }
        return documentStore.put(documentRef, request.content());
    }

    @GetMapping("/documents/{documentRef}")
    public StoredDocument getDocument(@PathVariable("documentRef") String documentRef) {
        return documentStore.get(documentRef)
            .orElseThrow(() -> new DocumentNotFoundException("document not found: " + documentRef));
    }
}
