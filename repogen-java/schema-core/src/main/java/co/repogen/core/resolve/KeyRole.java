package co.repogen.core.resolve;

public enum KeyRole {
  PARTITION,
  SORT
}
