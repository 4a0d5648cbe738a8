package io.github.drompincen.scriptops.runtime.ai;

import io.github.drompincen.scriptops.persistence.document.ExecutionDocument;
import io.github.drompincen.scriptops.protocol.api.AiHelpResponse;
import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import io.github.drompincen.scriptops.runtime.config.ScriptOpsProperties;
import io.github.drompincen.scriptops.runtime.error.ExternalFailureException;
import io.github.drompincen.scriptops.runtime.error.NotFoundException;
import io.github.drompincen.scriptops.runtime.error.PreconditionFailedException;
import io.github.drompincen.scriptops.runtime.execution.ExecutionLedger;
import io.github.drompincen.scriptops.runtime.lookup.ScriptInfo;
import io.github.drompincen.scriptops.runtime.lookup.ScriptLookup;
import io.github.drompincen.scriptops.runtime.lookup.SettingsLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AiHelpServiceTest {

    @Mock private ExecutionLedger ledger;
    @Mock private ScriptLookup scriptLookup;
    @Mock private SettingsLookup settings;
    @Mock private ErrorAnalyzer errorAnalyzer;

    @TempDir Path tempDir;

    private AiHelpService service;

    @BeforeEach
    void setUp() throws Exception {
        Path source = tempDir.resolve("cleanup.py");
        Files.writeString(source, "S".repeat(3000));
        when(scriptLookup.findScript("script-1"))
                .thenReturn(Optional.of(new ScriptInfo("script-1", "cleanup", source.toString())));
        when(settings.get(eq(SettingsLookup.ENABLE_AI_HELP), any())).thenReturn("true");
        when(settings.get(eq(SettingsLookup.OPENAI_API_KEY), any())).thenReturn("sk-test");
        service = new AiHelpService(ledger, scriptLookup, settings, errorAnalyzer, new ScriptOpsProperties());
    }

    @Test
    void getAiHelp_throwsNotFound_forNonFailedExecution() {
        when(ledger.find("exec-1")).thenReturn(Optional.of(makeExec(ExecutionStatus.SUCCESS)));

        assertThatThrownBy(() -> service.getAiHelp("exec-1"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Failed execution not found");
    }

    @Test
    void getAiHelp_throwsNotFound_forUnknownExecution() {
        when(ledger.find("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getAiHelp("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void getAiHelp_returnsCachedAnswerWithoutCallingAnalyzer() {
        ExecutionDocument doc = makeExec(ExecutionStatus.FAILED);
        doc.setAiAnalysis("cached analysis");
        doc.setAiSolution("cached solution");
        when(ledger.find("exec-1")).thenReturn(Optional.of(doc));
        when(settings.get(eq(SettingsLookup.ENABLE_AI_HELP), any())).thenReturn("false");

        AiHelpResponse response = service.getAiHelp("exec-1");

        assertThat(response.cached()).isTrue();
        assertThat(response.analysis()).isEqualTo("cached analysis");
        verify(errorAnalyzer, never()).analyze(any(), any(), any(), any());
    }

    @Test
    void getAiHelp_throwsPreconditionFailed_whenDisabled() {
        when(ledger.find("exec-1")).thenReturn(Optional.of(makeExec(ExecutionStatus.FAILED)));
        when(settings.get(eq(SettingsLookup.ENABLE_AI_HELP), any())).thenReturn("false");

        assertThatThrownBy(() -> service.getAiHelp("exec-1"))
                .isInstanceOf(PreconditionFailedException.class)
                .hasMessage("AI help is disabled in settings");
    }

    @Test
    void getAiHelp_throwsPreconditionFailed_withoutApiKey() {
        when(ledger.find("exec-1")).thenReturn(Optional.of(makeExec(ExecutionStatus.FAILED)));
        when(settings.get(eq(SettingsLookup.OPENAI_API_KEY), any())).thenReturn(" ");

        assertThatThrownBy(() -> service.getAiHelp("exec-1"))
                .isInstanceOf(PreconditionFailedException.class)
                .hasMessage("OpenAI API key not configured");
    }

    @Test
    void getAiHelp_truncatesInputsAndCachesResult() {
        ExecutionDocument doc = makeExec(ExecutionStatus.FAILED);
        doc.setOutput("x".repeat(2500) + "TAIL");
        when(ledger.find("exec-1")).thenReturn(Optional.of(doc));
        when(errorAnalyzer.analyze(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(new ErrorAnalysis("bad creds", "rotate keys"));

        AiHelpResponse response = service.getAiHelp("exec-1");

        assertThat(response.cached()).isFalse();
        assertThat(response.analysis()).isEqualTo("bad creds");
        assertThat(response.solution()).isEqualTo("rotate keys");
        verify(ledger).saveAiHelp("exec-1", "bad creds", "rotate keys");

        ArgumentCaptor<String> source = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> errors = ArgumentCaptor.forClass(String.class);
        verify(errorAnalyzer).analyze(eq("sk-test"), eq("cleanup"), source.capture(), errors.capture());
        assertThat(source.getValue()).hasSize(2000);
        assertThat(errors.getValue()).hasSize(2000).endsWith("TAIL");
    }

    @Test
    void getAiHelp_degradesWithoutCaching_whenAnalyzerFails() {
        when(ledger.find("exec-1")).thenReturn(Optional.of(makeExec(ExecutionStatus.FAILED)));
        when(errorAnalyzer.analyze(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new ExternalFailureException("OpenAI request failed: 401 invalid key sk-live-123", new RuntimeException()));

        AiHelpResponse response = service.getAiHelp("exec-1");

        assertThat(response.analysis()).isEqualTo("Error analysis could not be performed.");
        assertThat(response.solution()).isEqualTo("AI analysis failed.");
        assertThat(response.analysis() + response.solution()).doesNotContain("sk-live-123", "401");
        verify(ledger, never()).saveAiHelp(any(), any(), any());
    }

    @Test
    void getAiHelp_sendsEmptySource_whenScriptFileUnreadable() {
        when(scriptLookup.findScript("script-1"))
                .thenReturn(Optional.of(new ScriptInfo("script-1", "cleanup", tempDir.resolve("gone.py").toString())));
        when(ledger.find("exec-1")).thenReturn(Optional.of(makeExec(ExecutionStatus.FAILED)));
        when(errorAnalyzer.analyze(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(new ErrorAnalysis("a", "s"));

        service.getAiHelp("exec-1");

        verify(errorAnalyzer).analyze(eq("sk-test"), eq("cleanup"), eq(""), anyString());
    }

    private static ExecutionDocument makeExec(ExecutionStatus status) {
        ExecutionDocument doc = new ExecutionDocument();
        doc.setExecutionId("exec-1");
        doc.setScriptId("script-1");
        doc.setStatus(status);
        doc.setOutput("Traceback: AccessDenied");
        return doc;
    }
}
