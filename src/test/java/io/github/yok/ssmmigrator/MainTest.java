package io.github.yok.ssmmigrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.ssmmigrator.config.AwsConfig;
import io.github.yok.ssmmigrator.config.Environment;
import io.github.yok.ssmmigrator.config.MigrationConfig;
import io.github.yok.ssmmigrator.core.NameMapping;
import io.github.yok.ssmmigrator.core.ParameterCopier;
import io.github.yok.ssmmigrator.core.ParameterLister;
import io.github.yok.ssmmigrator.exception.ConfigLoadException;
import io.github.yok.ssmmigrator.exception.SourceNotFoundException;
import io.github.yok.ssmmigrator.store.ParameterStore;
import io.github.yok.ssmmigrator.store.SsmParameterStoreFactory;
import io.github.yok.ssmmigrator.util.ErrorHandler;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedConstruction;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private MigrationConfig migrationConfig;
    private AwsConfig awsConfig;
    private SsmParameterStoreFactory storeFactory;
    private ParameterStore store;

    private Main main;

    @BeforeEach
    void setup() {
        migrationConfig = new MigrationConfig();
        awsConfig = new AwsConfig();
        storeFactory = mock(SsmParameterStoreFactory.class);
        store = mock(ParameterStore.class);
        when(storeFactory.create(anyString())).thenReturn(store);

        main = new Main(migrationConfig, awsConfig, storeFactory);
        ErrorHandler.disableExitForCurrentThread();
    }

    @AfterEach
    void tearDown() {
        ErrorHandler.restoreExitForCurrentThread();
    }

    private NameMapping executedMapping(ParameterCopier copier) {
        ArgumentCaptor<NameMapping> captor = ArgumentCaptor.forClass(NameMapping.class);
        verify(copier).execute(captor.capture());
        return captor.getValue();
    }

    @Test
    void run_正常ケース_引数なしは設定の環境でコピーが実行されること() {
        try (MockedConstruction<ParameterCopier> mocked =
                mockConstruction(ParameterCopier.class)) {

            main.run();

            NameMapping mapping = executedMapping(mocked.constructed().get(0));
            assertEquals(Environment.STAGING, mapping.getEnvironment());
            assertEquals("/asset-accounting/staging/REDISCLOUD_URL",
                    mapping.getPairs().get(0).getOldName());
            verify(storeFactory).create("aa_stg");
            verify(store).close();
            assertEquals(0, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_productionを指定する_本番プロファイルで接続されること() {
        try (MockedConstruction<ParameterCopier> mocked =
                mockConstruction(ParameterCopier.class)) {

            main.run("--env", "production");

            verify(storeFactory).create("aa_prod");
            assertEquals(Environment.PRODUCTION,
                    executedMapping(mocked.constructed().get(0)).getEnvironment());
        }
    }

    @Test
    void run_正常ケース_短縮オプションでbetaを指定する_ステージングプロファイルで接続されること() {
        try (MockedConstruction<ParameterCopier> mocked =
                mockConstruction(ParameterCopier.class)) {

            main.run("-e", "beta");

            verify(storeFactory).create("aa_stg");
            assertEquals(Environment.BETA,
                    executedMapping(mocked.constructed().get(0)).getEnvironment());
        }
    }

    @Test
    void run_正常ケース_overwriteを指定する_上書き可でコピーが構築されること() {
        List<Object> overwriteFlags = new ArrayList<>();
        try (MockedConstruction<ParameterCopier> mocked = mockConstruction(ParameterCopier.class,
                (copier, context) -> overwriteFlags.add(context.arguments().get(1)))) {

            main.run("--overwrite");

            assertEquals(List.of(Boolean.TRUE), overwriteFlags);
        }
    }

    @Test
    void run_正常ケース_overwrite未指定_設定値の上書き不可で構築されること() {
        List<Object> overwriteFlags = new ArrayList<>();
        try (MockedConstruction<ParameterCopier> mocked = mockConstruction(ParameterCopier.class,
                (copier, context) -> overwriteFlags.add(context.arguments().get(1)))) {

            main.run();

            assertEquals(List.of(Boolean.FALSE), overwriteFlags);
        }
    }

    @Test
    void run_正常ケース_listを指定する_旧階層の一覧が実行されコピーは行われないこと() {
        try (MockedConstruction<ParameterLister> listers = mockConstruction(ParameterLister.class);
                MockedConstruction<ParameterCopier> copiers =
                        mockConstruction(ParameterCopier.class)) {

            main.run("--list", "-e", "production");

            verify(listers.constructed().get(0)).execute("/asset-accounting/production/");
            assertTrue(copiers.constructed().isEmpty());
            verify(store).close();
        }
    }

    @Test
    void run_正常ケース_未知の引数はwarnされても処理継続すること() {
        try (MockedConstruction<ParameterCopier> mocked =
                mockConstruction(ParameterCopier.class)) {

            main.run("--unknown", "xxx");

            verify(mocked.constructed().get(0)).execute(any(NameMapping.class));
            assertEquals(0, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_envの値が省略される_設定の環境が使われること() {
        migrationConfig.setEnvironment("beta");
        try (MockedConstruction<ParameterCopier> mocked =
                mockConstruction(ParameterCopier.class)) {

            main.run("--env");

            assertEquals(Environment.BETA,
                    executedMapping(mocked.constructed().get(0)).getEnvironment());
        }
    }

    @Test
    void run_異常ケース_未知の環境を指定する_接続せず終了コード1となること() {
        IllegalStateException ex =
                assertThrows(IllegalStateException.class, () -> main.run("--env", "dev"));

        assertInstanceOf(ConfigLoadException.class, ex.getCause());
        assertTrue(ex.getMessage().contains("operation=load-config"));
        verify(storeFactory, never()).create(anyString());
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_異常ケース_変数設定が不正_接続せず終了コード1となること() {
        migrationConfig.setVariables(List.of("REDIS/URL"));

        assertThrows(IllegalStateException.class, () -> main.run());

        verify(storeFactory, never()).create(anyString());
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_異常ケース_プロファイル読込に失敗する_終了コード1となること() {
        when(storeFactory.create(eq("aa_stg")))
                .thenThrow(new ConfigLoadException("Unable to load SDK config", null));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> main.run());

        assertTrue(ex.getMessage().contains("Unable to load SDK config"));
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_異常ケース_コピーが失敗する_操作名を含むエラーで終了コード1となりストアが閉じられること() {
        try (MockedConstruction<ParameterCopier> mocked = mockConstruction(ParameterCopier.class,
                (copier, context) -> when(copier.execute(any(NameMapping.class)))
                        .thenThrow(new SourceNotFoundException("/x", null)))) {

            IllegalStateException ex =
                    assertThrows(IllegalStateException.class, () -> main.run());

            assertTrue(ex.getMessage().contains("operation=get-source"));
            assertTrue(ex.getMessage().contains("/x"));
            verify(store).close();
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_予期しない例外_終了コード1となること() {
        try (MockedConstruction<ParameterCopier> mocked = mockConstruction(ParameterCopier.class,
                (copier, context) -> when(copier.execute(any(NameMapping.class)))
                        .thenThrow(new IllegalStateException("unexpected")))) {

            IllegalStateException ex =
                    assertThrows(IllegalStateException.class, () -> main.run());

            assertTrue(ex.getMessage().startsWith("Fatal error (mode=copy)"));
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_exit有効でコピーが失敗する_標準エラーへ出力され終了コード1となること() {
        ErrorHandler.restoreExitForCurrentThread();
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try (MockedConstruction<ParameterCopier> mocked = mockConstruction(ParameterCopier.class,
                (copier, context) -> when(copier.execute(any(NameMapping.class)))
                        .thenThrow(new SourceNotFoundException("/x", null)))) {
            System.setErr(new PrintStream(err));

            main.run();

        } finally {
            System.setErr(originalErr);
        }
        assertTrue(err.toString().contains("ERROR: Failed to copy parameter"));
        assertEquals(1, main.getExitCode());
        assertFalse(err.toString().isEmpty());
    }
}
