package co.repogen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An enum constant with a fixed spelling in schema documents.
 */
public interface WireValue {

  String wire();

  static <E extends Enum<E> & WireValue> Optional<E> parse(Class<E> type, String value) {
    if (value == null) return Optional.empty();
    for (E e : type.getEnumConstants()) {
      if (e.wire().equals(value)) return Optional.of(e);
    }
    return Optional.empty();
  }

  static <E extends Enum<E> & WireValue> List<String> values(Class<E> type) {
    List<String> out = new ArrayList<>();
    for (E e : type.getEnumConstants()) out.add(e.wire());
    return out;
  }
}
