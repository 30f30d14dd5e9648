package co.repogen.core.resolve;

/**
 * What a generated method returns, after applying index projections to the declared
 * return type.
 */
public enum ResponseShape {
  ENTITY,
  ENTITY_LIST,
  /** Index items that cannot be rebuilt into the entity. */
  ATTRIBUTE_MAP,
  ATTRIBUTE_MAP_LIST,
  SUCCESS_FLAG,
  /** Items of several entity types, e.g. an item collection query. */
  MIXED,
  NONE;

  public boolean isList() {
    return this == ENTITY_LIST || this == ATTRIBUTE_MAP_LIST || this == MIXED;
  }

  public boolean isRaw() {
    return this == ATTRIBUTE_MAP || this == ATTRIBUTE_MAP_LIST || this == MIXED;
  }
}
