package com.di.skyflow.collaborator;

import com.di.skyflow.common.Result;
import com.di.skyflow.config.SkyFlowProperties;
import com.di.skyflow.error.FailureCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a configured command template as a child process with a hard timeout and maps the
 * outcome onto a {@link Result}:
 * <ul>
 *   <li>exit 0: success with captured output</li>
 *   <li>timeout or a configured transient exit code: TRANSIENT</li>
 *   <li>any other exit code: FATAL</li>
 *   <li>launch failure: categorized by {@link FailureCategory}</li>
 * </ul>
 */
@Component
@Slf4j
public class ExternalToolRunner {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z]+)}");
    private static final int ERROR_TAIL_LINES = 20;

    private final Duration timeout;
    private final Set<Integer> transientExitCodes;

    public ExternalToolRunner(SkyFlowProperties props) {
        this.timeout = props.getTools().getTimeout();
        this.transientExitCodes = Set.copyOf(props.getTools().getTransientExitCodes());
    }

    public Result<ToolOutput> run(String tool, String template, Map<String, List<String>> vars) {
        String code = tool.toUpperCase(Locale.ROOT);
        if (template == null || template.isBlank()) {
            return Result.fatal(code + "_NOT_CONFIGURED", "no command configured for " + tool);
        }
        List<String> command;
        try {
            command = expand(template, vars);
        } catch (IllegalArgumentException e) {
            return Result.fatal(code + "_BAD_TEMPLATE", e.getMessage());
        }
        log.info("[TOOL] {}: {}", tool, String.join(" ", command));

        Path capture = null;
        try {
            capture = Files.createTempFile("skyflow-" + tool + "-", ".log");
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(capture.toFile())
                    .start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("[TOOL] {} exceeded {} and was killed", tool, timeout);
                return Result.transientFailure(code + "_TIMEOUT", tool + " timed out after " + timeout);
            }
            ToolOutput output = new ToolOutput(process.exitValue(),
                    Files.readAllLines(capture, StandardCharsets.UTF_8));
            if (output.exitCode() == 0) {
                return Result.success(output);
            }
            String message = tool + " exited with " + output.exitCode() + ":\n" + output.tail(ERROR_TAIL_LINES);
            if (transientExitCodes.contains(output.exitCode())) {
                return Result.transientFailure(code + "_EXIT_" + output.exitCode(), message);
            }
            return Result.fatal(code + "_EXIT_" + output.exitCode(), message);
        } catch (IOException e) {
            log.error("[TOOL] {} could not be run: {}", tool, e.getMessage(), e);
            return Result.failure(FailureCategory.toFailure(code, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(FailureCategory.toFailure(code, e));
        } finally {
            deleteQuietly(capture);
        }
    }

    /**
     * Splits the template on whitespace and substitutes {@code {name}} placeholders.
     * A token that is exactly one placeholder expands to one argument per value.
     */
    public static List<String> expand(String template, Map<String, List<String>> vars) {
        List<String> args = new ArrayList<>();
        for (String token : template.trim().split("\\s+")) {
            Matcher whole = PLACEHOLDER.matcher(token);
            if (whole.matches()) {
                args.addAll(lookup(vars, whole.group(1)));
                continue;
            }
            Matcher m = PLACEHOLDER.matcher(token);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                m.appendReplacement(sb, Matcher.quoteReplacement(String.join(",", lookup(vars, m.group(1)))));
            }
            m.appendTail(sb);
            args.add(sb.toString());
        }
        return args;
    }

    private static List<String> lookup(Map<String, List<String>> vars, String name) {
        List<String> values = vars.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown placeholder {" + name + "} in tool command");
        }
        return values;
    }

    private static void deleteQuietly(Path p) {
        if (p == null) {
            return;
        }
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("[TOOL] could not delete {}: {}", p, e.getMessage());
        }
    }
}
