package co.repogen.generators.python;

import co.repogen.core.Names;
import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handlebars engine over the classpath templates of the Python target. Output is source
 * code, so nothing is HTML escaped.
 */
class HandlebarsEngine {
    private final Handlebars handlebars;
    private final Map<String, Template> compiled = new ConcurrentHashMap<>();

    HandlebarsEngine() {
        ClassPathTemplateLoader loader = new ClassPathTemplateLoader();
        loader.setPrefix("/templates/python");
        loader.setSuffix(".hbs");
        this.handlebars = new Handlebars(loader).with(EscapingStrategy.NOOP);
        this.handlebars.setPrettyPrint(true);
        registerHelpers();
    }

    private void registerHelpers() {
        handlebars.registerHelper("upperSnake", (Helper<String>) (value, options) ->
            value == null || value.isEmpty() ? "" : Names.toConstantCase(value));

        handlebars.registerHelper("snakeCase", (Helper<String>) (value, options) ->
            value == null || value.isEmpty() ? "" : Names.toSnakeCase(value));
    }

    Template compile(String templateName) throws IOException {
        Template template = compiled.get(templateName);
        if (template == null) {
            template = handlebars.compile(templateName);
            compiled.putIfAbsent(templateName, template);
        }
        return template;
    }

    /**
     * @throws IllegalStateException if the template cannot be loaded or applied
     */
    String render(String templateName, Object context) {
        try {
            return compile(templateName).apply(context);
        } catch (IOException e) {
            throw new IllegalStateException("cannot render template " + templateName, e);
        }
    }
}
