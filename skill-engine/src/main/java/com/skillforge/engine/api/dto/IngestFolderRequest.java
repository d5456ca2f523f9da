package com.skillforge.engine.api.dto;

/** Request body for POST /api/v1/ingest/folder. */
public record IngestFolderRequest(String folderName) {}
