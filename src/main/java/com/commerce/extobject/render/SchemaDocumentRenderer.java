package com.commerce.extobject.render;

import com.commerce.extobject.schema.ColumnDefinition;
import com.commerce.extobject.schema.TableDescriptor;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link TableDescriptor} as a markdown page.
 */
public class SchemaDocumentRenderer {

    private static final String TEMPLATE = "schema.md.ftl";

    private final Configuration freemarkerConfig;

    public SchemaDocumentRenderer() {
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

    public String render(TableDescriptor table) {
        Map<String, Object> model = new HashMap<>();
        model.put("table", table);
        model.put("rows", rows(table));

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load template " + TEMPLATE, e);
        } catch (TemplateException e) {
            throw new IllegalStateException("Failed to render schema of " + table.getName(), e);
        }
    }

    private List<Map<String, String>> rows(TableDescriptor table) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (ColumnDefinition column : table.getColumns()) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("name", column.getName());
            row.put("kind", column.getKind().name());
            row.put("size", describeSize(column));
            row.put("label", column.getLabel());
            row.put("description", column.getDescription());
            row.put("primaryKey", String.valueOf(column.getName().equals(table.getPrimaryKeyColumn())));
            rows.add(row);
        }
        return rows;
    }

    static String describeSize(ColumnDefinition column) {
        return switch (column.getKind()) {
            case INTEGER -> "precision " + column.getPrecision();
            case NUMBER -> "precision " + column.getPrecision() + ", scale " + column.getScale();
            case TEXT -> "length " + column.getLength();
            case INDIRECT_LOOKUP -> column.getReferenceTo() + "." + column.getReferenceTargetField();
            case BOOLEAN, URL -> "";
        };
    }
}
