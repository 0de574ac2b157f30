package io.pagereach.engine.campaign;

/** Per-variant counters of an A/B campaign, aggregated from the recipient ledger. */
public record VariantResult(
    String name,
    int percentage,
    long recipients,
    long sent,
    long failed,
    long delivered,
    long opened,
    long clicked,
    long replied) {

  public double deliveryRate() {
    return rate(delivered);
  }

  public double responseRate() {
    return rate(replied);
  }

  public double clickRate() {
    return rate(clicked);
  }

  public double rateFor(AbWinnerCriteria criteria) {
    return switch (criteria) {
      case DELIVERY -> deliveryRate();
      case RESPONSE -> responseRate();
      case CLICK -> clickRate();
    };
  }

  private double rate(long numerator) {
    return sent == 0 ? 0.0 : (double) numerator / sent;
  }
}
