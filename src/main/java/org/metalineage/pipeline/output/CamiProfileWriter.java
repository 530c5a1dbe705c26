package org.metalineage.pipeline.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.metalineage.pipeline.api.model.ProfileEntry;
import org.metalineage.pipeline.taxonomy.Rank;

/**
 * Writes a profile in the CAMI taxonomic profiling format (version 0.9.1).
 */
public final class CamiProfileWriter {

    static final String VERSION = "0.9.1";

    private CamiProfileWriter() {
    }

    public static void write(Path target, String sampleId, List<ProfileEntry> entries) throws IOException {
        AtomicFileWriter.write(target, content(sampleId, entries));
    }

    public static AtomicFileWriter.ContentWriter content(String sampleId, List<ProfileEntry> entries) {
        String ranks = Rank.CAMI_RANKS.stream().map(Rank::label).collect(Collectors.joining("|"));
        return out -> {
            out.write("#CAMI Submission for Taxonomic Profiling");
            out.newLine();
            out.write("@Version:" + VERSION);
            out.newLine();
            out.write("@Ranks:" + ranks);
            out.newLine();
            out.write("@SampleID:" + sampleId);
            out.newLine();
            out.newLine();
            out.write("@@TAXID\tRANK\tTAXPATH\tTAXPATHSN\tPERCENTAGE");
            out.newLine();
            for (ProfileEntry entry : entries) {
                out.write(entry.taxid() + "\t" + entry.rank().label() + '\t' + entry.taxPath() + '\t'
                        + entry.taxPathSn() + '\t' + String.format(Locale.ROOT, "%.6f", entry.percentage()));
                out.newLine();
            }
        };
    }
}
