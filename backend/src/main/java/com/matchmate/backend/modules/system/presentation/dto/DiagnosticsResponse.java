package com.matchmate.backend.modules.system.presentation.dto;

import java.util.List;

public record DiagnosticsResponse(
        String backend,
        String database,
        String databaseUrl,
        String databaseName,
        String connectionStatus,
        List<String> tables,
        String timestamp
) {
}
