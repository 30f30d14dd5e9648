package co.repogen.core.resolve;

import co.repogen.core.Names;

import java.util.List;

/**
 * Snake_case names of the four CRUD methods every repository gets.
 */
public record CrudMethods(String create, String get, String update, String delete) {

  public static CrudMethods forEntity(String entityName) {
    String snake = Names.toSnakeCase(entityName);
    return new CrudMethods("create_" + snake, "get_" + snake, "update_" + snake, "delete_" + snake);
  }

  public List<String> all() {
    return List.of(create, get, update, delete);
  }
}
