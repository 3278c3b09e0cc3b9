package io.github.yok.itgluemigrate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.itgluemigrate.client.ApiException;
import io.github.yok.itgluemigrate.client.DestinationApiClient;
import io.github.yok.itgluemigrate.config.ApiConfig;
import io.github.yok.itgluemigrate.config.MigrationConfig;
import io.github.yok.itgluemigrate.core.MatchResult;
import io.github.yok.itgluemigrate.core.MigrationPlan;
import io.github.yok.itgluemigrate.state.MigrationState;
import io.github.yok.itgluemigrate.state.Phase;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private ApiConfig apiConfig;
    private MigrationConfig migrationConfig;
    private DestinationApiClient client;
    private Main main;
    private Path export;

    @BeforeEach
    void setup() throws Exception {
        apiConfig = new ApiConfig();
        migrationConfig = new MigrationConfig();
        client = mock(DestinationApiClient.class);
        when(client.listOrganizations()).thenReturn(mapper.createArrayNode());
        when(client.createOrganization(any(), anyBoolean(), any()))
                .thenReturn(mapper.createObjectNode().put("id", "org-uuid"));

        main = spy(new Main(apiConfig, migrationConfig));
        doReturn(client).when(main).createClient(anyString(), anyString());

        export = Files.createDirectories(tempDir.resolve("export"));
        Files.write(export.resolve("organizations.csv"),
                "id,name\n1,Acme\n".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void run_異常ケース_コマンド無しは終了コード1となること() {
        main.run();
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_異常ケース_未知のコマンドは終了コード1となること() {
        main.run("migrate");
        assertEquals(1, main.getExitCode());
    }

    @Test
    void preview_正常ケース_計画ファイルを書き出すこと() {
        Path output = tempDir.resolve("plan.json");

        main.run("preview", "--export-path", export.toString(), "--api-url", "https://dest",
                "--token", "secret", "--output", output.toString());

        assertEquals(0, main.getExitCode());
        assertTrue(Files.exists(output));
        MigrationPlan plan = MigrationPlan.read(output);
        assertEquals("https://dest", plan.getApiUrl());
        assertEquals(1, plan.getOrganizations().getToCreate());
        verify(main).createClient("https://dest", "secret");
        verify(client).close();
    }

    @Test
    void preview_異常ケース_トークンが無い場合はAPIに接続しないこと() {
        main.run("preview", "-e", export.toString(), "-u", "https://dest");

        assertEquals(1, main.getExitCode());
        verify(main, never()).createClient(anyString(), anyString());
    }

    @Test
    void preview_正常ケース_設定ファイルのURLとトークンを使うこと() {
        apiConfig.setUrl("https://configured");
        apiConfig.setToken("env-token");
        migrationConfig.setPlanFile(tempDir.resolve("default_plan.json").toString());

        main.run("preview", "--export-path", export.toString());

        assertEquals(0, main.getExitCode());
        verify(main).createClient("https://configured", "env-token");
        assertTrue(Files.exists(tempDir.resolve("default_plan.json")));
    }

    @Test
    void run_異常ケース_orgとallのどちらも無い場合は終了コード1となること() throws Exception {
        Path plan = writePlan();

        main.run("run", "--plan", plan.toString(), "--token", "t");

        assertEquals(1, main.getExitCode());
        verify(main, never()).createClient(anyString(), anyString());
    }

    @Test
    void run_異常ケース_orgとallの両方指定は終了コード1となること() throws Exception {
        Path plan = writePlan();

        main.run("run", "--plan", plan.toString(), "--org", "Acme", "--all", "--token", "t");

        assertEquals(1, main.getExitCode());
        verify(main, never()).createClient(anyString(), anyString());
    }

    @Test
    void run_異常ケース_計画ファイルが無い場合は終了コード1となること() {
        main.run("run", "--plan", tempDir.resolve("missing.json").toString(), "--all");
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_異常ケース_計画に無い組織名は終了コード1となること() throws Exception {
        Path plan = writePlan();

        main.run("run", "-p", plan.toString(), "-o", "Unknown", "-t", "t");

        assertEquals(1, main.getExitCode());
        verify(main, never()).createClient(anyString(), anyString());
    }

    @Test
    void run_異常ケース_オプション値が欠けている場合は終了コード1となること() {
        main.run("run", "--plan");
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_正常ケース_ドライランは接続確認も状態保存も行わないこと() throws Exception {
        Path plan = writePlan();
        Path state = tempDir.resolve("state.json");

        main.run("run", "--plan", plan.toString(), "--all", "--token", "t", "--dry-run",
                "--state-file", state.toString());

        assertEquals(0, main.getExitCode());
        verify(main).createClient("https://dest", "t");
        verify(client, never()).listOrganizations();
        verify(client, never()).createOrganization(any(), anyBoolean(), any());
        assertFalse(Files.exists(state));
    }

    @Test
    void run_正常ケース_移行して状態ファイルを保存すること() throws Exception {
        Path plan = writePlan();
        Path state = tempDir.resolve("state.json");

        main.run("run", "--plan", plan.toString(), "--all", "--token", "t", "--state-file",
                state.toString());

        assertEquals(0, main.getExitCode());
        verify(client).listOrganizations();
        verify(client).createOrganization(eq("Acme"), eq(true), any());
        MigrationState saved = MigrationState.load(state);
        assertTrue(saved.isCompleted(Phase.ORGANIZATIONS, "1"));
        assertEquals("https://dest", saved.getApiUrl());
    }

    @Test
    void run_正常ケース_失敗をクリアして再試行すること() throws Exception {
        Path plan = writePlan();
        Path statePath = tempDir.resolve("state.json");
        MigrationState previous = new MigrationState(export.toString(), "https://dest");
        previous.markFailed(Phase.ORGANIZATIONS, "1", "API Error 500: boom");
        previous.save(statePath);

        main.run("run", "--plan", plan.toString(), "--all", "--token", "t", "--state-file",
                statePath.toString(), "--clear-failures");

        assertEquals(0, main.getExitCode());
        MigrationState saved = MigrationState.load(statePath);
        assertTrue(saved.isCompleted(Phase.ORGANIZATIONS, "1"));
        assertEquals(0, saved.getTotalFailed());
    }

    @Test
    void run_異常ケース_接続確認に失敗した場合は終了コード1となること() throws Exception {
        when(client.listOrganizations()).thenThrow(new ApiException(401, "Unauthorized"));
        Path plan = writePlan();

        main.run("run", "--plan", plan.toString(), "--all", "--token", "t");

        assertEquals(1, main.getExitCode());
        verify(client, never()).createOrganization(any(), anyBoolean(), any());
        verify(client).close();
    }

    @Test
    void run_異常ケース_作成に失敗したエンティティがあれば終了コード1となること() throws Exception {
        when(client.createOrganization(any(), anyBoolean(), any()))
                .thenThrow(new ApiException(500, "boom"));
        Path plan = writePlan();

        main.run("run", "--plan", plan.toString(), "--org", "Acme", "--token", "t");

        assertEquals(1, main.getExitCode());
    }

    private Path writePlan() throws Exception {
        MigrationPlan plan = new MigrationPlan();
        plan.setExportPath(export.toString());
        plan.setApiUrl("https://dest");
        plan.getOrganizations().setTotal(1);
        plan.getOrganizations().setToCreate(1);
        plan.getOrganizations().getMapping().put("Acme",
                new MatchResult(MatchResult.STATUS_CREATE, null, null));
        Path file = tempDir.resolve("migration_plan.json");
        plan.write(file);
        return file;
    }
}
