/**
 * ErrorAnalysisService.java
 *
 * 将捕获到的错误整理为一段 Markdown 分析提示，供自动修复流程或人工阅读。
 */
package club.ppmc.dbgp.service;

import club.ppmc.dbgp.model.dbgp.ErrorEvent;
import club.ppmc.dbgp.model.dbgp.SourceLine;
import club.ppmc.dbgp.model.dbgp.StackFrame;
import club.ppmc.dbgp.model.dbgp.Variable;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

@Service
public class ErrorAnalysisService {

    public String buildAnalysisPrompt(ErrorEvent error) {
        String sourceLines = nullToEmpty(error.sourceContext()).stream()
                .map(this::formatSourceLine)
                .collect(Collectors.joining("\n"));

        String stackLines = nullToEmpty(error.stackTrace()).stream()
                .map(this::formatFrame)
                .collect(Collectors.joining("\n"));

        String localVars = nullToEmpty(error.localVariables()).stream()
                .map(this::formatVariable)
                .collect(Collectors.joining("\n"));

        var sb = new StringBuilder();
        sb.append("## Error Analysis\n\n");
        sb.append("**Error Type**: ").append(error.errorType()).append('\n');
        sb.append("**Message**: ").append(error.message()).append('\n');
        sb.append("**Location**: ").append(error.file()).append(':').append(error.line()).append("\n\n");
        sb.append("### Source Context\n```\n").append(sourceLines).append("\n```\n\n");
        sb.append("### Stack Trace\n")
                .append(stackLines.isEmpty() ? "  (no stack trace available)" : stackLines)
                .append("\n\n");
        sb.append("### Local Variables\n")
                .append(localVars.isEmpty() ? "  (no local variables)" : localVars)
                .append("\n\n");
        sb.append("### Task\n")
                .append("Analyze this error and provide:\n")
                .append("1. Root cause explanation\n")
                .append("2. A fix for the error line\n")
                .append("3. Any additional context or best practices");
        return sb.toString();
    }

    private String formatSourceLine(SourceLine line) {
        return line.line() + ": " + (line.errorLine() ? ">>> " : "    ") + line.text();
    }

    private String formatFrame(StackFrame frame) {
        String where = frame.where() == null || frame.where().isEmpty() ? "anonymous" : frame.where();
        return String.format("  %d: %s at %s:%d", frame.level(), where, frame.filename(), frame.lineNumber());
    }

    private String formatVariable(Variable variable) {
        return String.format("  %s: %s = %s", variable.name(), variable.type(), variable.value());
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
