package co.repogen.generators.java;

import co.repogen.core.Names;
import com.squareup.javapoet.ClassName;

/**
 * Packages and class names of generated Java code under one base package.
 */
final class JavaLayout {
    static final String CLIENT_CLASS = "RepositoryClient";
    static final String ATTRIBUTE_VALUES_CLASS = "AttributeValues";
    static final String TRANSACTION_SERVICE_CLASS = "TransactionService";
    static final String USAGE_EXAMPLES_CLASS = "UsageExamples";

    private final String basePackage;

    JavaLayout(String basePackage) {
        this.basePackage = basePackage;
    }

    String basePackage() {
        return basePackage;
    }

    String packageOf(String sub) {
        return sub.isEmpty() ? basePackage : basePackage + "." + sub;
    }

    String packageDir() {
        return basePackage.replace('.', '/');
    }

    ClassName entity(String entityName) {
        return ClassName.get(basePackage, Names.toPascalCase(entityName));
    }

    ClassName keys(String entityName) {
        return ClassName.get(packageOf("keys"), Names.toPascalCase(entityName) + "Keys");
    }

    ClassName repository(String entityName) {
        return ClassName.get(packageOf("repository"), Names.toPascalCase(entityName) + "Repository");
    }

    ClassName config(String tableName) {
        return ClassName.get(packageOf("config"), Names.toPascalCase(tableName) + "Config");
    }

    ClassName client() {
        return ClassName.get(packageOf("client"), CLIENT_CLASS);
    }

    ClassName attributeValues() {
        return ClassName.get(packageOf("client"), ATTRIBUTE_VALUES_CLASS);
    }

    ClassName transactionService() {
        return ClassName.get(packageOf("transaction"), TRANSACTION_SERVICE_CLASS);
    }

    ClassName usageExamples() {
        return ClassName.get(packageOf("examples"), USAGE_EXAMPLES_CLASS);
    }
}
