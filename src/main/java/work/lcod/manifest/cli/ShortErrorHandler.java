package work.lcod.manifest.cli;

import picocli.CommandLine;
import work.lcod.manifest.pipeline.ImportException;

/**
 * Prints a one-line failure instead of a stack trace; {@code -Dmanifest.debug=true} restores the trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message;
        if (ex instanceof ImportException importError) {
            message = importError.summary() + ": " + importError.detail();
        } else {
            message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("manifest.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
