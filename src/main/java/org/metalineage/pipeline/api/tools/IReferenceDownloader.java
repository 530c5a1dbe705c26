package org.metalineage.pipeline.api.tools;

import java.nio.file.Path;
import java.util.List;

/**
 * Materializes the reference genomes of a candidate list on local disk.
 */
public interface IReferenceDownloader {

    /**
     * Files produced by a download.
     *
     * @param fasta       combined reference FASTA
     * @param taxonomyMap accession to taxid map in {@code GCF, TaxID, Identifiers} layout
     */
    record DownloadedReference(Path fasta, Path taxonomyMap) {
    }

    /**
     * Downloads the references into {@code targetDir}.
     *
     * @param candidateIds sorted candidate identifiers
     * @param targetDir    existing, empty directory owned by the caller
     * @return paths of the produced files, inside {@code targetDir}
     * @throws org.metalineage.pipeline.api.errors.ExternalToolException if the download fails
     */
    DownloadedReference fetch(List<String> candidateIds, Path targetDir);
}
