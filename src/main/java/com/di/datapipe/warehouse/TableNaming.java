package com.di.datapipe.warehouse;

import java.util.Locale;

/**
 * Warehouse table names derived from dataset ids. BigQuery table ids allow letters, digits and
 * underscores; everything else maps to an underscore.
 */
public final class TableNaming {

    private TableNaming() {}

    public static String forDataset(String datasetId) {
        if (datasetId == null || datasetId.isBlank()) {
            throw new IllegalArgumentException("datasetId must not be blank");
        }
        String lower = datasetId.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(ok ? c : '_');
        }
        return sb.toString();
    }
}
