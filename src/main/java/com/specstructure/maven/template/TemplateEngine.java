package com.specstructure.maven.template;

import java.io.IOException;
import java.util.Map;

/**
 * Renders named spec file templates.
 */
public interface TemplateEngine {
    /**
     * Renders a template with the given context.
     *
     * @param templateName the template file name, e.g. {@code spec-file.rb.mustache}
     * @param context values referenced by the template
     * @return the rendered text
     * @throws IOException if the template cannot be found or rendered
     */
    String render(String templateName, Map<String, Object> context) throws IOException;
}
