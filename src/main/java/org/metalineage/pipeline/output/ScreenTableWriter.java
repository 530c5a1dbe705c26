package org.metalineage.pipeline.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.metalineage.pipeline.api.model.ScreenHit;

/**
 * Writes screen hits back in Mash {@code screen} column layout, so that
 * {@link org.metalineage.pipeline.selection.ScreenTableReader} can read them again.
 */
public final class ScreenTableWriter {

    private ScreenTableWriter() {
    }

    public static void write(Path target, List<ScreenHit> hits) throws IOException {
        AtomicFileWriter.write(target, out -> {
            for (ScreenHit hit : hits) {
                ScreenHit.RawMetrics raw = hit.rawMetrics();
                out.write(String.format(Locale.ROOT, "%s\t%s\t%s\t%s\t%s\t%s",
                        Double.toString(hit.score()), raw.sharedHashes(),
                        Double.toString(raw.medianMultiplicity()), Double.toString(raw.pValue()),
                        hit.genomeId(), raw.comment()));
                out.newLine();
            }
        });
    }
}
