package org.metalineage.pipeline.api.model;

import java.util.List;

/**
 * One row of the accession-to-taxid map: an assembly (bucket) and the sequence identifiers
 * it contains, all resolving to the same taxid.
 *
 * @param bucketId       assembly accession or other bucket id
 * @param taxid          taxid every identifier maps to
 * @param identifierList sequence identifiers found in the assembly
 */
public record TaxonomyRecord(String bucketId, int taxid, List<String> identifierList) {

    public TaxonomyRecord {
        identifierList = List.copyOf(identifierList);
    }
}
