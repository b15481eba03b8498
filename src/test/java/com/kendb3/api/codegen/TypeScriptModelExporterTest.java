package com.kendb3.api.codegen;

import com.kendb3.KenDb3Models;
import com.kendb3.api.fields.ApiEngine;
import com.kendb3.api.server.ModelRegistry;
import com.kendb3.config.KenDb3Config;
import com.kendb3.store.ForeignKey;
import com.kendb3.store.InMemoryObjectStore;
import com.kendb3.store.Model;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the TypeScript model declaration export.
 */
class TypeScriptModelExporterTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);

    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        registry = KenDb3Models.createRegistry();
    }

    private TypeScriptModelExporter exporter(Path output, boolean force) {
        return new TypeScriptModelExporter(KenDb3Config.builder()
                .outputPath(output)
                .generatorName("test-gen")
                .force(force)
                .build(), clock);
    }

    @Test
    void testHeaderAndEndpointFallback() throws Exception {
        String output = exporter(null, false).render(registry);

        assertThat(output).contains(" * THIS IS AN AUTOGENERATED FILE")
                .contains(" * Generator: test-gen")
                .contains(" * Generated at: 2024-01-02T03:04:05Z")
                .contains("getInjection<string>('dataman-endpoint') ?? 'api/v0/MODEL_NAME'");
    }

    @Test
    void testModelsDeclaredInNameOrder() throws Exception {
        String output = exporter(null, false).render(registry);

        int version = output.indexOf("export class MinecraftVersion extends ModelBase {");
        int profile = output.indexOf("export class Profile extends ModelBase {");
        int submission = output.indexOf("export class Submission extends ModelBase {");
        int revision = output.indexOf("export class SubmissionRevision extends ModelBase {");

        assertThat(version).isNotNegative();
        assertThat(version).isLessThan(profile);
        assertThat(profile).isLessThan(submission);
        assertThat(submission).isLessThan(revision);
    }

    @Test
    void testPlainFieldsGroupsAndRegistration() throws Exception {
        String output = exporter(null, false).render(registry);

        assertThat(output).contains("    comparator: any | null;\n")
                .contains("    is_common: any | null;\n")
                .contains("    static readonly fieldGroups: readonly string[] = ['*', 'basic'];\n")
                .contains("    private '_fields_*': Status = Status.NotRequested;\n")
                .contains("    private '_fields_basic': Status = Status.NotRequested;\n")
                .contains("     * Default endpoint: api/v0/minecraft_version\n")
                .contains("autogenManagerModel(MinecraftVersion, 'minecraft_version');\n")
                .contains("autogenManagerModel(SubmissionRevision, 'submission_revision');\n");
    }

    @Test
    void testRelationsWiredAfterDeclarations() throws Exception {
        String output = exporter(null, false).render(registry);

        assertThat(output).contains("    revision_of_id: number | null;\n")
                .contains("    revision_of: Joined<Submission> | null;\n")
                .contains("    revisions_ids: number[] | null;\n")
                .contains("    revisions: JoinedMany<SubmissionRevision> | null;\n")
                .contains("joinOne(SubmissionRevision, 'revision_of', 'revision_of_id', () => Submission);\n")
                .contains("joinMany(Submission, 'revisions', 'revisions_ids', () => SubmissionRevision);\n");

        int lastClass = output.lastIndexOf("export class");
        assertThat(output.indexOf("joinOne(")).isGreaterThan(lastClass);
    }

    @Test
    void testRelationToUnregisteredModelStaysOpaque() throws Exception {
        String output = exporter(null, false).render(registry);

        assertThat(output).contains("    user_id: any | null;\n")
                .doesNotContain("    user: ");
    }

    @Test
    void testModelDocumentation() throws Exception {
        String output = exporter(null, false).render(registry);

        assertThat(output).contains("/*\n * Submission model.\n *\n * Most fields describing the submission");
    }

    static class Crate extends Model {
        private final ForeignKey<Crate> parent = ForeignKey.to(Crate.class);
    }

    @Test
    void testSelfReferenceWiredWithinOneModel() throws Exception {
        ModelRegistry plain = new ModelRegistry();
        ApiEngine<Crate> engine = ApiEngine.of(Crate.class);
        engine.addField("parent", "other");
        plain.register(engine, new InMemoryObjectStore<>());

        String output = exporter(null, false).render(plain);

        assertThat(output).contains("    parent_id: number | null;\n")
                .contains("    parent: Joined<Crate> | null;\n")
                .contains("    Joined,\n")
                .doesNotContain("private '_fields_*'");
    }

    @Test
    void testExportWritesFile() throws Exception {
        Path output = tempDir.resolve("webpack_src").resolve("models.autogenerated.ts");

        ExportResult result = exporter(output, false).export(registry);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getModelsExported()).isEqualTo(4);
        assertThat(result.getRelationsWired()).isEqualTo(5);
        assertThat(Files.readString(output)).contains("export class Profile extends ModelBase {");
    }

    @Test
    void testExistingFileRequiresForce() throws Exception {
        Path output = tempDir.resolve("models.autogenerated.ts");
        Files.writeString(output, "old");

        ExportResult refused = exporter(output, false).export(registry);
        ExportResult forced = exporter(output, true).export(registry);

        assertThat(refused.isSuccess()).isFalse();
        assertThat(refused.getErrorMessage()).contains("already exists");
        assertThat(forced.isSuccess()).isTrue();
        assertThat(Files.readString(output)).isNotEqualTo("old");
    }

    @Test
    void testMissingOutputPathFails() {
        ExportResult result = exporter(null, false).export(registry);

        assertThat(result.isSuccess()).isFalse();
    }
}
