package io.github.fiserro.growhab;

/** Health conditions inferred for a growspace. */
public enum Condition {
  STRESS("stress", true),
  MOLD_RISK("mold_risk", true),
  OPTIMAL("optimal", false);

  private final String key;
  private final boolean adverse;

  Condition(String key, boolean adverse) {
    this.key = key;
    this.adverse = adverse;
  }

  /** Key used in item names and verdict attributes. */
  public String key() {
    return key;
  }

  /**
   * Adverse conditions are pulled up by readings far from ideal; the favorable one (optimal) is
   * pulled up by readings close to ideal.
   */
  public boolean isAdverse() {
    return adverse;
  }

  /** Plant stress is meaningless once the crop is harvested. */
  public boolean appliesTo(GrowthStage stage) {
    return this != STRESS || !stage.isPostHarvest();
  }
}
