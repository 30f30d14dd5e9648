package co.repogen.core.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Validator settings.
 *
 * @param parallel  run rule groups on a parallel stream
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidatorOptions(boolean parallel) {

  @JsonCreator
  public ValidatorOptions(@JsonProperty("parallel") Boolean parallel) {
    this(Boolean.TRUE.equals(parallel));
  }

  public static ValidatorOptions defaults() {
    return new ValidatorOptions(false);
  }
}
