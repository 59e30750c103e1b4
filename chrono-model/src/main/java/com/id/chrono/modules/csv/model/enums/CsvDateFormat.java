package com.id.chrono.modules.csv.model.enums;

public enum CsvDateFormat {
    AUTO,
    ISO_DATE,
    ISO_8601,
    D_MMM_YY,
    EPOCH_MILLIS
}
