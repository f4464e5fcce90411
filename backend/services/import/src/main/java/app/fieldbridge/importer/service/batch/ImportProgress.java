package app.fieldbridge.importer.service.batch;

public record ImportProgress(int batchIndex, int batchCount, int processed, int total, int percent) {

    static ImportProgress after(int batchIndex, int batchCount, int processed, int total) {
        int percent = total == 0 ? 100 : (int) ((long) processed * 100 / total);
        return new ImportProgress(batchIndex, batchCount, processed, total, percent);
    }
}
