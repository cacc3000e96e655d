package dev.medrag.rule;

/** Medical keyword categories recognized by the rule path. */
public enum RuleCategory {
  SYMPTOM("症状"),
  DISEASE("疾病"),
  MEDICATION("药物"),
  DIAGNOSTIC_PROCEDURE("检查"),
  EMERGENCY("紧急");

  private final String label;

  RuleCategory(String label) {
    this.label = label;
  }

  /** Chinese display label. */
  public String label() {
    return label;
  }
}
