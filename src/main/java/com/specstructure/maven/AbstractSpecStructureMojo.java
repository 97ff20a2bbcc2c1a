package com.specstructure.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import com.specstructure.maven.config.StructureConfig;
import com.specstructure.maven.config.StructureConfigLoader;
import com.specstructure.maven.template.MustacheTemplateEngine;
import com.specstructure.maven.template.TemplateEngine;
import com.specstructure.maven.template.TemplateLoader;

/**
 * Shared project config and template wiring for the spec-structure goals.
 */
public abstract class AbstractSpecStructureMojo extends AbstractMojo {

    @Parameter(defaultValue = "${project}", readonly = true, required = true)
    protected MavenProject project;

    /**
     * Spec helper required by generated files; overrides {@code helper} in the project config.
     */
    @Parameter(property = "specstructure.helper")
    protected String helper;

    /**
     * Directory with template overrides; overrides {@code templateDir} in the project config.
     */
    @Parameter(property = "specstructure.templateDir")
    protected File templateDir;

    protected Path baseDir() {
        if (project != null && project.getBasedir() != null) {
            return project.getBasedir().toPath();
        }
        return Path.of(".").toAbsolutePath().normalize();
    }

    protected StructureConfig loadConfig() throws MojoExecutionException {
        try {
            return StructureConfigLoader.load(baseDir(), getLog());
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to load " + StructureConfigLoader.PROJECT_CONFIG, e);
        }
    }

    protected String resolveHelper(StructureConfig config) {
        return StructureConfig.pick(helper, config.getHelper(), null);
    }

    protected TemplateEngine createTemplateEngine(StructureConfig config) {
        Path userTemplates = null;
        if (templateDir != null) {
            userTemplates = templateDir.toPath();
        } else if (config.getTemplateDir() != null) {
            userTemplates = baseDir().resolve(config.getTemplateDir());
        }
        return new MustacheTemplateEngine(new TemplateLoader(userTemplates, getLog()));
    }

    protected Path resolve(File file) {
        Path path = file.toPath();
        return path.isAbsolute() ? path : baseDir().resolve(path);
    }

    /**
     * Splits a comma separated parameter, dropping blanks.
     */
    protected static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }
}
