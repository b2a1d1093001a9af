package org.drivesage.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.drivesage.drive.DriveSageProperties;
import org.drivesage.drive.PendingOperationStore;
import org.drivesage.drive.SecurePathResolver;
import org.drivesage.drive.analysis.DriveAnalyzer;
import org.drivesage.drive.analysis.DuplicateDetector;
import org.drivesage.drive.analysis.DuplicateVerifier;
import org.drivesage.drive.dto.DuplicateListResult;
import org.drivesage.drive.dto.OperationConfirmResult;
import org.drivesage.drive.dto.OperationPlanResult;
import org.drivesage.drive.dto.OperationPrepareResult;
import org.drivesage.drive.dto.analysis.AnalysisReport;
import org.drivesage.drive.dto.analysis.DuplicateVerification;
import org.drivesage.drive.dto.analysis.FileRecord;
import org.drivesage.drive.dto.organize.OperationResult;
import org.drivesage.drive.organize.OperationExecutor;
import org.drivesage.drive.organize.OperationRequest;
import org.drivesage.drive.organize.OrganizePlanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DriveMcpToolsTest {

    @TempDir
    Path root;

    private DriveSageProperties properties;
    private DriveMcpTools tools;

    @BeforeEach
    void setUp() {
        properties = new DriveSageProperties();
        properties.setRoots(List.of(root.toString()));
        properties.setLargeFileThreshold(DataSize.ofBytes(8));
        tools = createTools();
    }

    @Test
    void analyze_usesConfiguredDefaultsAndCallOverrides() throws IOException {
        write("work/assistant-log.txt", "0123456789");
        write("work/bare.txt", "1");

        AnalysisReport defaults = tools.analyze(null, null, null, null);
        assertThat(defaults.folderCount()).isEqualTo(1);
        assertThat(defaults.largeFiles()).extracting(FileRecord::name).containsExactly("assistant-log.txt");
        assertThat(defaults.protectedFiles()).extracting(FileRecord::name).containsExactly("assistant-log.txt");

        AnalysisReport overridden = tools.analyze("root0", "work", "bare", 100L);
        assertThat(overridden.largeFiles()).isEmpty();
        assertThat(overridden.protectedFiles()).extracting(FileRecord::name).containsExactly("bare.txt");
    }

    @Test
    void analyze_rejectsPathsOutsideRoots() {
        assertThatThrownBy(() -> tools.analyze(null, "../", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.analyze(null, "missing", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findAndVerifyDuplicates() throws IOException {
        write("a/photo.jpg", "same");
        write("b/photo.jpg", "same");
        write("c/photo.jpg", "diff");

        DuplicateListResult duplicates = tools.findDuplicates(null, null);
        assertThat(duplicates.rootId()).isEqualTo("root0");
        assertThat(duplicates.path()).isEqualTo(".");
        assertThat(duplicates.duplicates()).hasSize(2);
        assertThat(duplicates.warnings()).isNull();

        DuplicateVerification verification = tools.verifyDuplicates(null, null);
        assertThat(verification.confirmed()).hasSize(1);
        assertThat(verification.mismatched()).hasSize(1);
    }

    @Test
    void planPrepareConfirm_movesFilesOnlyAfterConfirmation() throws Exception {
        write("inbox/photo.jpg", "img");
        write("inbox/.DS_Store", "x");

        OperationPlanResult plan = tools.planOrganize(null, null);
        assertThat(plan.path()).isEqualTo(".");
        assertThat(plan.operations()).hasSize(2);

        String json = new ObjectMapper().writeValueAsString(plan.operations());
        OperationPrepareResult prepared = tools.prepareOperations(null, json);

        assertThat(prepared.preview().dryRun()).isTrue();
        assertThat(prepared.preview().summary().successful()).isEqualTo(2);
        assertThat(prepared.token()).isNotBlank();
        assertThat(prepared.expiresAt()).isNotNull();
        assertThat(root.resolve("inbox/photo.jpg")).exists();

        OperationConfirmResult confirmed = tools.confirmOperations(prepared.token(), true);

        assertThat(confirmed.confirmed()).isTrue();
        assertThat(confirmed.executedAt()).isNotNull();
        assertThat(confirmed.result().dryRun()).isFalse();
        assertThat(confirmed.result().summary().successful()).isEqualTo(2);
        assertThat(root.resolve("inbox/Images/photo.jpg")).hasContent("img");
        assertThat(root.resolve("inbox/.DS_Store")).doesNotExist();

        assertThatThrownBy(() -> tools.confirmOperations(prepared.token(), true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("token 无效或已过期");
    }

    @Test
    void confirmFalse_cancelsPlan() throws IOException {
        write("old.txt", "x");

        OperationPrepareResult prepared = tools.prepareOperations(null, "[{\"type\":\"delete\",\"path\":\"old.txt\"}]");
        OperationConfirmResult cancelled = tools.confirmOperations(prepared.token(), false);

        assertThat(cancelled.confirmed()).isFalse();
        assertThat(cancelled.result()).isNull();
        assertThat(root.resolve("old.txt")).exists();
        assertThatThrownBy(() -> tools.confirmOperations(prepared.token(), true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void prepare_reportsBadOperationsWithoutToken() {
        OperationPrepareResult prepared = tools.prepareOperations(null,
                "[{\"type\":\"copy\",\"source\":\"a\"}, 42, {\"type\":\"delete\",\"path\":\"../outside\"}]");

        assertThat(prepared.token()).isNull();
        assertThat(prepared.preview().summary().total()).isEqualTo(3);
        assertThat(prepared.preview().summary().failed()).isEqualTo(3);
    }

    @Test
    void prepare_rejectsMalformedJson() {
        assertThatThrownBy(() -> tools.prepareOperations(null, "{not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不是合法的 JSON");
        assertThatThrownBy(() -> tools.prepareOperations(null, "{\"type\":\"delete\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("必须是 JSON 数组");
        assertThatThrownBy(() -> tools.prepareOperations(null, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteFile_requiresConfirmation() throws IOException {
        Path file = write("trash.tmp", "x");

        assertThatThrownBy(() -> tools.deleteFile(null, "trash.tmp", false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(file).exists();

        OperationResult result = tools.deleteFile(null, "trash.tmp", true);
        assertThat(result.deleted()).containsExactly(file.toAbsolutePath().normalize().toString());
        assertThat(file).doesNotExist();
    }

    @Test
    void mutationsDisabled_allowsOnlyDryRuns() throws IOException {
        properties.setAllowMutations(false);
        tools = createTools();
        write("keep.txt", "x");

        OperationPrepareResult prepared = tools.prepareOperations(null, "[{\"type\":\"delete\",\"path\":\"keep.txt\"}]");
        assertThat(prepared.token()).isNull();
        assertThat(prepared.preview().summary().successful()).isEqualTo(1);

        assertThatThrownBy(() -> tools.deleteFile(null, "keep.txt", true))
                .isInstanceOf(IllegalStateException.class);
        assertThat(root.resolve("keep.txt")).exists();
    }

    @Test
    void parseOperations_keepsNonObjectElementsAsEmptyRequests() {
        List<OperationRequest> requests = DriveMcpTools.parseOperations("[\"x\", {\"type\":\"move\",\"source\":\"a\",\"destination\":\" \"}]");

        assertThat(requests).containsExactly(
                new OperationRequest(null, null, null, null, null, null),
                new OperationRequest("move", "a", null, null, null, null)
        );
    }

    @Test
    void splitPatterns_trimsAndDropsBlanks() {
        assertThat(DriveMcpTools.splitPatterns(" ai, ,Code ,")).containsExactly("ai", "Code");
    }

    private DriveMcpTools createTools() {
        return new DriveMcpTools(
                properties,
                new SecurePathResolver(properties),
                new DriveAnalyzer(new DuplicateDetector()),
                new DuplicateVerifier(properties.getHashMaxBytes().toBytes()),
                new OrganizePlanner(properties.getOrganizeCategories()),
                new OperationExecutor(),
                new PendingOperationStore(properties.getPendingPlanTtl(), properties.getPendingPlanMaxOperations())
        );
    }

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
