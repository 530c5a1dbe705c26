package org.metalineage.pipeline.stages;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.metalineage.pipeline.api.errors.ConfigurationException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * A reference database the queries are screened against.
 *
 * @param name               database name, also used for file names
 * @param sketch             sketch file for the screener
 * @param initialThreshold   starting screen threshold, {@code null} for the default
 * @param assemblySummaries  NCBI assembly summaries providing species keys
 */
public record ReferenceDatabase(String name, Path sketch, BigDecimal initialThreshold, List<Path> assemblySummaries) {

    /**
     * Reads the {@code metalineage.databases} list.
     */
    public static List<ReferenceDatabase> fromConfig(List<? extends Config> databases) {
        List<ReferenceDatabase> result = new ArrayList<>();
        for (Config db : databases) {
            try {
                BigDecimal initial = db.hasPath("initial-threshold")
                        ? new BigDecimal(db.getString("initial-threshold")) : null;
                List<Path> summaries = new ArrayList<>();
                if (db.hasPath("assembly-summaries")) {
                    db.getStringList("assembly-summaries").forEach(s -> summaries.add(Path.of(s)));
                }
                result.add(new ReferenceDatabase(db.getString("name"), Path.of(db.getString("sketch")),
                        initial, List.copyOf(summaries)));
            } catch (ConfigException | NumberFormatException e) {
                throw new ConfigurationException("Invalid database entry: " + e.getMessage(), e);
            }
        }
        return result;
    }
}
