import java.util.ArrayList;
import java.util.List;

import com.lux.script.parser.Diagnostic;
import com.lux.script.parser.LineOffsets;
import com.lux.script.parser.LuxRuntimeError;
import com.lux.script.report.ErrorReporter;

/** Test reporter that keeps everything it is given. */
public class CollectingErrorReporter implements ErrorReporter {
    public final List<Diagnostic> compileErrors = new ArrayList<>();
    public final List<LuxRuntimeError> runtimeErrors = new ArrayList<>();

    @Override
    public void compileError(Diagnostic diagnostic, LineOffsets lines) {
        compileErrors.add(diagnostic);
    }

    @Override
    public void runtimeError(LuxRuntimeError error, LineOffsets lines) {
        runtimeErrors.add(error);
    }
}
