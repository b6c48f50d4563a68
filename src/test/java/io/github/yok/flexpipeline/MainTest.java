package io.github.yok.flexpipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flexpipeline.config.PathsConfig;
import io.github.yok.flexpipeline.config.PipelineConfig;
import io.github.yok.flexpipeline.core.PipelineOrchestrator;
import io.github.yok.flexpipeline.core.RunStatus;
import io.github.yok.flexpipeline.core.RunSummary;
import io.github.yok.flexpipeline.engine.QueryEngine;
import io.github.yok.flexpipeline.exception.ConfigurationException;
import io.github.yok.flexpipeline.exception.PipelineException;
import io.github.yok.flexpipeline.exception.RuleViolationException;
import io.github.yok.flexpipeline.exception.SourceUnreadableException;
import io.github.yok.flexpipeline.model.CustomRule;
import io.github.yok.flexpipeline.model.RuleKind;
import io.github.yok.flexpipeline.model.RuleViolation;
import io.github.yok.flexpipeline.util.ErrorHandler;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private PathsConfig pathsConfig;
    private Main main;

    @BeforeEach
    void setup() {
        pathsConfig = new PathsConfig();
        main = new Main(pathsConfig, new PipelineConfig(), mock(QueryEngine.class));
    }

    private static RunSummary completed() {
        return RunSummary.builder().entity("employees").status(RunStatus.COMPLETED).build();
    }

    /**
     * Runs {@code main.run(args)} with an orchestrator whose {@code run} throws {@code failure},
     * and returns the message passed to the error handler.
     */
    private String failWith(RuntimeException failure) {
        try (MockedConstruction<PipelineOrchestrator> ignored =
                mockConstruction(PipelineOrchestrator.class,
                        (mock, ctx) -> when(mock.run(anyString())).thenThrow(failure));
                MockedStatic<ErrorHandler> handler = mockStatic(ErrorHandler.class)) {
            main.run("employees");
            ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
            handler.verify(() -> ErrorHandler.errorAndExit(message.capture(), eq(failure)));
            return message.getValue();
        }
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(null);
                    Class<?>[] sources = (Class<?>[]) ctx.arguments().get(0);
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"employees"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("employees"));
        }
    }

    @Test
    void run_正常ケース_エンティティ指定_オーケストレーターが実行されること() {
        try (MockedConstruction<PipelineOrchestrator> mocked =
                mockConstruction(PipelineOrchestrator.class,
                        (mock, ctx) -> when(mock.run(anyString())).thenReturn(completed()))) {

            main.run("employees");

            assertEquals(1, mocked.constructed().size());
            verify(mocked.constructed().get(0)).run("employees");
        }
    }

    @Test
    void run_正常ケース_オプション指定_パス設定が上書きされること() {
        try (MockedConstruction<PipelineOrchestrator> mocked =
                mockConstruction(PipelineOrchestrator.class,
                        (mock, ctx) -> when(mock.run(anyString())).thenReturn(completed()))) {

            main.run("--config", "conf/other.yaml", "employees", "--output_dir", "out2");

            assertEquals("conf/other.yaml", pathsConfig.getConfigFile());
            assertEquals("out2", pathsConfig.getOutputDir());
            verify(mocked.constructed().get(0)).run("employees");
        }
    }

    @Test
    void run_正常ケース_短縮オプション指定_パス設定が上書きされること() {
        try (MockedConstruction<PipelineOrchestrator> mocked =
                mockConstruction(PipelineOrchestrator.class,
                        (mock, ctx) -> when(mock.run(anyString())).thenReturn(completed()))) {

            main.run("-c", "a.yaml", "-o", "b", "locations", "extra");

            assertEquals("a.yaml", pathsConfig.getConfigFile());
            assertEquals("b", pathsConfig.getOutputDir());
            verify(mocked.constructed().get(0)).run("locations");
        }
    }

    @Test
    void run_異常ケース_エンティティ未指定_使用方法エラーが通知されること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class);
                MockedConstruction<PipelineOrchestrator> orchestrators =
                        mockConstruction(PipelineOrchestrator.class)) {
            mocked.when(() -> ErrorHandler.errorAndExit(anyString())).thenAnswer(inv -> {
                throw new IllegalStateException("exit");
            });

            assertThrows(IllegalStateException.class, () -> main.run("--config", "x.yaml"));

            mocked.verify(() -> ErrorHandler.errorAndExit(
                    eq("Entity name is required. Usage: <entity> [--config <file>] "
                            + "[--output-dir <dir>]")));
            assertTrue(orchestrators.constructed().isEmpty());
        }
    }

    @Test
    void run_異常ケース_設定エラー_ConfigurationErrorとして通知されること() {
        String message = failWith(new ConfigurationException("Entity 'x' not found."));
        assertEquals("Configuration Error: Entity 'x' not found.", message);
    }

    @Test
    void run_異常ケース_ファイル読込エラー_FileErrorとして通知されること() {
        String message = failWith(new SourceUnreadableException("Source not found: a.csv"));
        assertEquals("File Error: Source not found: a.csv", message);
    }

    @Test
    void run_異常ケース_カスタムルール違反_ValidationErrorとして通知されること() {
        RuleViolation violation = new RuleViolation(
                new CustomRule("birthday_on", RuleKind.AGE_GTE, Map.of("min_age", 18)),
                List.of());
        String message = failWith(new RuleViolationException(violation));
        assertTrue(message.startsWith("Validation Error: Custom validation failed for field "
                + "'birthday_on'"));
    }

    @Test
    void run_異常ケース_想定外の例外_unexpectedとして通知されること() {
        String message = failWith(new PipelineException("Query engine failure: boom"));
        assertEquals("An unexpected error occurred: Query engine failure: boom", message);
    }
}
