package co.repogen.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class NamesTest {

  @Test
  void splitsWords() {
    assertThat(Names.words("UserProfile")).containsExactly("user", "profile");
    assertThat(Names.words("user-profile")).containsExactly("user", "profile");
    assertThat(Names.words("HTTPRequest")).containsExactly("http", "request");
    assertThat(Names.words("order2Item")).containsExactly("order2", "item");
  }

  @Test
  void convertsCase() {
    assertThat(Names.toSnakeCase("OrderItem")).isEqualTo("order_item");
    assertThat(Names.toConstantCase("get_user")).isEqualTo("GET_USER");
    assertThat(Names.toCamelCase("get_users_by_status")).isEqualTo("getUsersByStatus");
    assertThat(Names.toPascalCase("order_item")).isEqualTo("OrderItem");
    assertThat(Names.cap("user")).isEqualTo("User");
    assertThat(Names.uncap("User")).isEqualTo("user");
  }
}
