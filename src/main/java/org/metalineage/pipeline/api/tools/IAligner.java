package org.metalineage.pipeline.api.tools;

import java.nio.file.Path;
import java.util.List;

/**
 * Sequence aligner producing PAF output.
 */
public interface IAligner {

    /**
     * Builds an alignment index for a reference.
     *
     * @param referenceFasta reference sequences
     * @param indexPath      file to write; the caller renames it into place
     */
    void index(Path referenceFasta, Path indexPath);

    /**
     * Aligns query sequences against an index.
     *
     * @param queryFiles query FASTA files
     * @param index      index built by {@link #index(Path, Path)}
     * @param pafOut     PAF file to write
     */
    void align(List<Path> queryFiles, Path index, Path pafOut);
}
