package co.repogen.generators;

import co.repogen.core.model.FieldKind;
import co.repogen.generators.java.JavaProfile;
import co.repogen.generators.python.PythonProfile;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class LanguageProfilesTest {

  @Test
  void registersJavaAndPython() {
    assertThat(LanguageProfiles.ids()).containsExactly("java", "python");
    assertThat(LanguageProfiles.get("java")).isInstanceOf(JavaProfile.class);
    assertThat(LanguageProfiles.get("python")).isInstanceOf(PythonProfile.class);
  }

  @Test
  void unknownLanguageSuggestsTheClosest() {
    assertThat(LanguageProfiles.find("pyhton")).isEmpty();
    assertThat(LanguageProfiles.find(null)).isEmpty();
    assertThatThrownBy(() -> LanguageProfiles.get("jav"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("supported: [java, python]")
      .hasMessageEndingWith("Did you mean 'java'?");
    assertThatThrownBy(() -> LanguageProfiles.get("cobol"))
      .hasMessageNotContaining("Did you mean");
  }

  @Test
  void javaNaming() {
    LanguageProfile java = LanguageProfiles.get("java");

    assertThat(java.methodName("get_users_by_status")).isEqualTo("getUsersByStatus");
    assertThat(java.fieldName("created_at")).isEqualTo("createdAt");
    assertThat(java.className("order_item")).isEqualTo("OrderItem");
    assertThat(java.requireRole(OutputRole.REPOSITORIES).pathFor("com/acme", "User"))
      .isEqualTo("com/acme/repository/UserRepository.java");
  }

  @Test
  void pythonNaming() {
    LanguageProfile python = LanguageProfiles.get("python");

    assertThat(python.methodName("getUsersByStatus")).isEqualTo("get_users_by_status");
    assertThat(python.fieldName("class")).isEqualTo("class_");
    assertThat(python.className("order_item")).isEqualTo("OrderItem");
    assertThat(python.fieldType(FieldKind.DECIMAL, null)).isEqualTo("Decimal");
    assertThat(python.outputRoles()).extracting(OutputRole::category)
      .doesNotContain(OutputRole.KEYS, OutputRole.CONFIG);
  }

  @Test
  void missingRoleIsAnError() {
    assertThatThrownBy(() -> LanguageProfiles.get("python").requireRole(OutputRole.KEYS))
      .isInstanceOf(IllegalStateException.class);
  }
}
