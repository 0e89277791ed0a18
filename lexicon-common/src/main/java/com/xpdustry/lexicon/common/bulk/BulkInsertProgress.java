package com.xpdustry.lexicon.common.bulk;

public record BulkInsertProgress(int processed, int total, int percentage) {

    static BulkInsertProgress of(final int processed, final int total) {
        return new BulkInsertProgress(
                processed, total, total == 0 ? 100 : (int) Math.round(processed * 100.0D / total));
    }
}
