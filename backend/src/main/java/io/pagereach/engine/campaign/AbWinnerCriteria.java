package io.pagereach.engine.campaign;

public enum AbWinnerCriteria {
  DELIVERY,
  RESPONSE,
  CLICK
}
