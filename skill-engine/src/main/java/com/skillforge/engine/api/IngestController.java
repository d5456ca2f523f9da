package com.skillforge.engine.api;

import com.skillforge.engine.api.dto.IngestFolderRequest;
import com.skillforge.engine.api.dto.IngestFolderResponse;
import com.skillforge.engine.ingest.IngestionService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous single-folder ingestion from the skills root.
 *
 * POST /api/v1/ingest/folder {"folderName":"verify-expense-policy"}
 */
@RestController
@RequestMapping("/api/v1/ingest")
public class IngestController {

    private final IngestionService ingestion;

    public IngestController(IngestionService ingestion) {
        this.ingestion = ingestion;
    }

    @PostMapping("/folder")
    public IngestFolderResponse ingestFolder(@RequestBody IngestFolderRequest req) {
        return IngestFolderResponse.from(ingestion.ingestFolder(req.folderName()));
    }
}
