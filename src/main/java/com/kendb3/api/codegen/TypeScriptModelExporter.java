package com.kendb3.api.codegen;

import com.kendb3.api.codegen.model.FieldDeclaration;
import com.kendb3.api.codegen.model.ModelDeclaration;
import com.kendb3.api.codegen.model.RelationWiring;
import com.kendb3.api.fields.ApiEngine;
import com.kendb3.api.fields.FieldMeta;
import com.kendb3.api.fields.RelationKind;
import com.kendb3.api.server.ModelRegistration;
import com.kendb3.api.server.ModelRegistry;
import com.kendb3.config.KenDb3Config;
import com.kendb3.util.FileWriteUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exports the declarations of every registered API model as a TypeScript module
 * consumed by the frontend data manager.
 *
 * <p>Each model becomes a class with one nullable property per API field, the
 * list of its field groups, a status tracker per group and a registration call
 * binding it to its endpoint. Relation fields whose target is also registered
 * additionally get a joined property, wired in a block after all classes so that
 * declaration order does not matter.
 */
public class TypeScriptModelExporter {

    private static final Logger log = LoggerFactory.getLogger(TypeScriptModelExporter.class);

    static final String TEMPLATE = "models.autogenerated.ts.ftl";

    private static final String OPAQUE_TYPE = "any | null";
    private static final String ID_TYPE = "number | null";
    private static final String IDS_TYPE = "number[] | null";

    private final KenDb3Config config;
    private final Clock clock;
    private final Configuration freemarkerConfig;

    public TypeScriptModelExporter(KenDb3Config config) {
        this(config, Clock.systemDefaultZone());
    }

    public TypeScriptModelExporter(KenDb3Config config, Clock clock) {
        this.config = config;
        this.clock = clock;
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
     * Renders and writes the declarations to the configured output path.
     */
    public ExportResult export(ModelRegistry registry) {
        Path outputPath = config.getOutputPath();
        if (outputPath == null) {
            return ExportResult.failure("No output path configured");
        }
        if (Files.exists(outputPath) && !config.isForce()) {
            return ExportResult.failure("Output file already exists: " + outputPath + ". Use --force to overwrite.");
        }

        try {
            List<ModelDeclaration> models = declarations(registry);
            FileWriteUtil.safeWriteString(outputPath, render(models));
            log.info("Exported {} model declarations to {}", models.size(), outputPath);

            return ExportResult.builder()
                    .success(true)
                    .outputPath(outputPath)
                    .modelsExported(models.size())
                    .fieldsExported(models.stream().mapToInt(m -> m.getFields().size()).sum())
                    .relationsWired(models.stream().mapToInt(m -> m.getRelations().size()).sum())
                    .build();
        } catch (IOException | TemplateException e) {
            log.error("Model export failed", e);
            return ExportResult.failure(e.getMessage());
        }
    }

    /**
     * Renders the declarations of every model of {@code registry}.
     */
    public String render(ModelRegistry registry) throws IOException, TemplateException {
        return render(declarations(registry));
    }

    private String render(List<ModelDeclaration> models) throws IOException, TemplateException {
        List<RelationWiring> relations = new ArrayList<>();
        models.forEach(m -> relations.addAll(m.getRelations()));

        Map<String, Object> data = new HashMap<>();
        data.put("generatorName", config.getGeneratorName());
        data.put("generatedAt", OffsetDateTime.now(clock).toString());
        data.put("endpointTemplate", config.getEndpointTemplate());
        data.put("models", models);
        data.put("relations", relations);

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter writer = new StringWriter();
        template.process(data, writer);
        return writer.toString();
    }

    // -------------------------------------------------------------------------
    // declarations
    // -------------------------------------------------------------------------

    List<ModelDeclaration> declarations(ModelRegistry registry) {
        List<ModelRegistration<?>> registrations = new ArrayList<>(registry.registrations());
        registrations.sort(Comparator.comparing((ModelRegistration<?> r) -> r.modelClass().getSimpleName()));

        List<ModelDeclaration> models = new ArrayList<>();
        for (ModelRegistration<?> registration : registrations) {
            models.add(declaration(registration.engine(), registry));
        }
        return models;
    }

    private ModelDeclaration declaration(ApiEngine<?> engine, ModelRegistry registry) {
        String modelName = engine.getModelClass().getSimpleName();
        ModelDeclaration.ModelDeclarationBuilder builder = ModelDeclaration.builder()
                .name(modelName)
                .apiName(engine.getApiName())
                .endpoint(config.endpointFor(engine.getApiName()))
                .groups(engine.getGroupNames());

        if (engine.getDescription() != null) {
            engine.getDescription().strip().lines().map(String::strip).forEach(builder::docLine);
        }

        Map<String, FieldMeta> fieldsByName = new LinkedHashMap<>();
        engine.getFieldGroups().values().forEach(group ->
                group.forEach(field -> fieldsByName.putIfAbsent(field.getName(), field)));

        Set<String> taken = new HashSet<>(engine.getAllFields());
        List<FieldDeclaration> joined = new ArrayList<>();
        for (String name : engine.getAllFields()) {
            FieldMeta field = fieldsByName.get(name);
            String joinedName = joinedName(field, registry);
            if (joinedName == null || !taken.add(joinedName)) {
                builder.field(new FieldDeclaration(name, OPAQUE_TYPE));
                continue;
            }

            boolean many = field.getRelationKind() == RelationKind.TO_MANY;
            String target = field.getRelationTarget().getSimpleName();
            builder.field(new FieldDeclaration(name, many ? IDS_TYPE : ID_TYPE));
            joined.add(new FieldDeclaration(joinedName,
                    (many ? "JoinedMany<" : "Joined<") + target + "> | null"));
            builder.relation(new RelationWiring(modelName, joinedName, name, target, many));
        }
        joined.forEach(builder::field);

        return builder.build();
    }

    /**
     * Name of the joined property of a relation field, or {@code null} if the field
     * stays opaque.
     */
    private static String joinedName(FieldMeta field, ModelRegistry registry) {
        if (field == null || !field.isRelation() || field.getRelationTarget() == null
                || !registry.contains(field.getRelationTarget())) {
            return null;
        }
        String suffix = field.getRelationKind() == RelationKind.TO_MANY ? "_ids" : "_id";
        String name = field.getName();
        if (!name.endsWith(suffix) || name.length() == suffix.length()) {
            return null;
        }
        return name.substring(0, name.length() - suffix.length());
    }
}
