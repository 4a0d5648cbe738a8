package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.runtime.config.ScriptOpsProperties;
import io.github.drompincen.scriptops.runtime.error.ExternalFailureException;
import io.github.drompincen.scriptops.runtime.lookup.CredentialProfile;
import io.github.drompincen.scriptops.runtime.lookup.ScriptInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds and starts the OS process for a script: interpreter picked by file extension, AWS
 * credentials injected into the inherited environment, stderr merged into stdout.
 */
@Component
public class ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessLauncher.class);

    private final ScriptOpsProperties properties;

    public ProcessLauncher(ScriptOpsProperties properties) {
        this.properties = properties;
    }

    public Process launch(ScriptInfo script, CredentialProfile profile, String regionOverride,
                          Map<String, Object> parameters) {
        List<String> command = buildCommand(script.path(), parameters);
        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        applyCredentials(pb.environment(), profile, regionOverride);
        try {
            Process process = pb.start();
            log.info("Started process {} for script {}", process.pid(), script.path());
            return process;
        } catch (IOException e) {
            throw new ExternalFailureException("Failed to start process: " + e.getMessage(), e);
        }
    }

    List<String> buildCommand(String scriptPath, Map<String, Object> parameters) {
        List<String> command = new ArrayList<>();
        String interpreter = properties.getExecution().getInterpreters().get(extensionOf(scriptPath));
        if (interpreter != null && !interpreter.isBlank()) {
            command.add(interpreter);
        }
        command.add(scriptPath);
        command.addAll(ScriptArguments.toCliArgs(parameters));
        return command;
    }

    static void applyCredentials(Map<String, String> env, CredentialProfile profile, String regionOverride) {
        putIfPresent(env, "AWS_ACCESS_KEY_ID", profile.accessKey());
        putIfPresent(env, "AWS_SECRET_ACCESS_KEY", profile.secretKey());
        String region = regionOverride != null && !regionOverride.isBlank() ? regionOverride : profile.region();
        putIfPresent(env, "AWS_DEFAULT_REGION", region);
    }

    private static void putIfPresent(Map<String, String> env, String key, String value) {
        if (value != null) env.put(key, value);
    }

    private static String extensionOf(String path) {
        String name = new File(path).getName();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
