package agents.dataagent.intent.strategy;

import agents.dataagent.catalog.CatalogSnapshot;
import agents.dataagent.intent.ClassificationResult;

/**
 * Inputs shared by every strategy of one resolution: the catalog snapshot captured when the
 * resolution started, the candidate collection and the classification (null in match mode).
 */
public final class ResolutionContext {

  private final CatalogSnapshot catalog;
  private final String collectionName;
  private final int topK;
  private final ClassificationResult classification;

  public ResolutionContext(CatalogSnapshot catalog, String collectionName, int topK, ClassificationResult classification) {
    this.catalog = catalog;
    this.collectionName = collectionName;
    this.topK = topK;
    this.classification = classification;
  }

  public CatalogSnapshot getCatalog() { return catalog; }
  public String getCollectionName() { return collectionName; }
  public int getTopK() { return topK; }
  public ClassificationResult getClassification() { return classification; }
}
