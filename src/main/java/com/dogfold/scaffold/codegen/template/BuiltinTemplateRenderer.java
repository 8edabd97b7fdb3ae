package com.dogfold.scaffold.codegen.template;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the FreeMarker templates shipped with the tool ({@code /templates/*.ftl}).
 * Used for artifacts the tool synthesizes itself rather than copying from a target's templates.
 */
public class BuiltinTemplateRenderer {

    public static final String CLASS_MODULE = "class-module.ftl";
    public static final String DOMAIN_COMMANDS = "domain-commands.ftl";

    private final Configuration freemarkerConfig;

    public BuiltinTemplateRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(String templateName, Map<String, Object> model) throws IOException {
        Template template = freemarkerConfig.getTemplate(templateName);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IllegalStateException("Builtin template " + templateName + " failed to render", e);
        }
        return out.toString();
    }
}
