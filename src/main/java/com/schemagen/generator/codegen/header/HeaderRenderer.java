package com.schemagen.generator.codegen.header;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.schemagen.generator.codegen.exception.TemplateRenderingException;
import com.schemagen.generator.codegen.writer.SourceBlock;
import com.schemagen.generator.model.ModuleInfo;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the comment block at the top of a generated document from
 * {@code /templates/header.ftl}.
 */
public class HeaderRenderer {

    static final String TEMPLATE_NAME = "header.ftl";

    private final Configuration freemarkerConfig;

    public HeaderRenderer() {
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

    /**
     * Header for {@code module}: the generated-code notice followed by the
     * module's doc comment, if any, as {@code #} comments.
     */
    public SourceBlock render(ModuleInfo module) throws TemplateRenderingException {
        Map<String, Object> model = new HashMap<>();
        model.put("moduleName", module.getName());
        model.put("commentLines", module.getDocComment()
                .map(doc -> doc.lines().map(String::strip).collect(Collectors.toList()))
                .orElse(List.of()));

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return SourceBlock.ofText(out.toString());
        } catch (IOException | TemplateException e) {
            throw new TemplateRenderingException("Failed to render " + TEMPLATE_NAME
                    + " for module " + module.getName(), e);
        }
    }
}
