package dev.medrag.evidence;

/** Which retrieval path produced an {@link EvidenceItem}. */
public enum EvidenceOrigin {
  VECTOR("vector"),
  LEXICAL("keyword"),
  RULE("rule"),
  EXTERNAL("web_search");

  private final String retrievalType;

  EvidenceOrigin(String retrievalType) {
    this.retrievalType = retrievalType;
  }

  /** Value written to the {@code retrieval_type} metadata key. */
  public String retrievalType() {
    return retrievalType;
  }
}
