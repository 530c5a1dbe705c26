package org.metalineage.pipeline.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.metalineage.pipeline.api.model.ClassificationResult;

/**
 * Writes {@code classified_sequences.tsv}: {@code Query, Lineage, Taxonomic Level, Confidence}.
 */
public final class ClassificationWriter {

    public static final String HEADER = "Query\tLineage\tTaxonomic Level\tConfidence";

    private ClassificationWriter() {
    }

    public static void write(Path target, List<ClassificationResult> results) throws IOException {
        AtomicFileWriter.write(target, content(results));
    }

    /**
     * @return the file content, for writing together with other outputs
     */
    public static AtomicFileWriter.ContentWriter content(List<ClassificationResult> results) {
        return out -> {
            out.write(HEADER);
            out.newLine();
            for (ClassificationResult result : results) {
                out.write(format(result));
                out.newLine();
            }
        };
    }

    static String format(ClassificationResult result) {
        return result.queryId() + '\t' + result.lineageString() + '\t' + result.taxonomicLevel() + '\t'
                + String.format(Locale.ROOT, "%.4f", result.confidence());
    }
}
