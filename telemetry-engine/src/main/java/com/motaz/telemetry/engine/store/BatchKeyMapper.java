package com.motaz.telemetry.engine.store;

/**
 * Derives output names from a batch's source key. The engine never looks inside the keys otherwise.
 */
public interface BatchKeyMapper {

    String outputKey(String sourceKey);

    default String summaryKey(String outputKey) {
        String stem = outputKey.endsWith(".csv") ? outputKey.substring(0, outputKey.length() - 4) : outputKey;
        return stem + "_summary.json";
    }

    /**
     * Maps {@code raw/x.csv} to {@code processed/x.csv}. Keys outside the raw area are placed under the
     * processed prefix as they are.
     */
    static BatchKeyMapper prefixSwap(String rawPrefix, String processedPrefix) {
        return sourceKey -> sourceKey.startsWith(rawPrefix)
                ? processedPrefix + sourceKey.substring(rawPrefix.length())
                : processedPrefix + sourceKey;
    }
}
