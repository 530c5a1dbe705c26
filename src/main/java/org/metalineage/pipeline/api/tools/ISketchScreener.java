package org.metalineage.pipeline.api.tools;

import java.nio.file.Path;
import java.util.List;

import org.metalineage.pipeline.api.model.ScreenHit;

/**
 * Approximate similarity screen of query sequences against a reference sketch database.
 */
public interface ISketchScreener {

    /**
     * Screens the inputs against one sketch database.
     *
     * @param inputFiles query FASTA files
     * @param sketchDb   sketch database of one reference collection
     * @return best hit per reference genome, score-descending
     * @throws org.metalineage.pipeline.api.errors.ExternalToolException if the screener fails
     */
    List<ScreenHit> screen(List<Path> inputFiles, Path sketchDb);
}
