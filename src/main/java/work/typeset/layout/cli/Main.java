package work.typeset.layout.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    static final String COMMAND_NAME = "layout-render";

    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new RenderCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
