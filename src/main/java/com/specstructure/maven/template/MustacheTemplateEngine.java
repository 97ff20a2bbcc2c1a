package com.specstructure.maven.template;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.MustacheFactory;

/**
 * Mustache-backed {@link TemplateEngine}. Generated Ruby is inserted with triple braces,
 * so no HTML escaping happens.
 */
public class MustacheTemplateEngine implements TemplateEngine {
    private final TemplateLoader templateLoader;
    private final MustacheFactory mustacheFactory;

    public MustacheTemplateEngine(TemplateLoader templateLoader) {
        this.templateLoader = templateLoader;
        this.mustacheFactory = new DefaultMustacheFactory();
    }

    @Override
    public String render(String templateName, Map<String, Object> context) throws IOException {
        String templateContent = templateLoader.loadTemplate(templateName);

        try {
            Mustache mustache = mustacheFactory.compile(new StringReader(templateContent), templateName);
            StringWriter writer = new StringWriter();
            mustache.execute(writer, context).flush();
            return writer.toString();
        } catch (MustacheException e) {
            throw new IOException("Cannot render template " + templateName + ": " + e.getMessage(), e);
        }
    }
}
