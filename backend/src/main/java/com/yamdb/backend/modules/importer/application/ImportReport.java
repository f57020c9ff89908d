package com.yamdb.backend.modules.importer.application;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-file counts of created and skipped rows. Rows matching existing data count as neither.
 */
public final class ImportReport {

    private final Map<String, Integer> created = new LinkedHashMap<>();
    private final Map<String, Integer> skipped = new LinkedHashMap<>();
    private int titlesRecomputed;

    void recordCreated(String file) {
        created.merge(file, 1, Integer::sum);
    }

    void recordSkipped(String file) {
        skipped.merge(file, 1, Integer::sum);
    }

    void setTitlesRecomputed(int titlesRecomputed) {
        this.titlesRecomputed = titlesRecomputed;
    }

    public int created(String file) {
        return created.getOrDefault(file, 0);
    }

    public int skipped(String file) {
        return skipped.getOrDefault(file, 0);
    }

    public Map<String, Integer> getCreated() {
        return Collections.unmodifiableMap(created);
    }

    public Map<String, Integer> getSkipped() {
        return Collections.unmodifiableMap(skipped);
    }

    public int getTitlesRecomputed() {
        return titlesRecomputed;
    }

    @Override
    public String toString() {
        return "ImportReport[created=" + created + ", skipped=" + skipped + ", titlesRecomputed=" + titlesRecomputed + "]";
    }
}
