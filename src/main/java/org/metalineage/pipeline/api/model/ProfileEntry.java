package org.metalineage.pipeline.api.model;

import org.metalineage.pipeline.taxonomy.Rank;

/**
 * One row of a CAMI taxonomic profile.
 *
 * @param taxid      taxon id
 * @param rank       rank the row belongs to
 * @param taxPath    {@code |}-joined taxids from superkingdom to this taxon
 * @param taxPathSn  {@code |}-joined scientific names along the same path
 * @param percentage share of all queries assigned at or below this taxon
 */
public record ProfileEntry(int taxid, Rank rank, String taxPath, String taxPathSn, double percentage) {
}
