package io.sideinputs.tool;

import picocli.CommandLine;

@CommandLine.Command(name = "sideinput-tool", mixinStandardHelpOptions = true,
        description = "Read and generate length-prefixed side-input files",
        subcommands = {ReadCommand.class, GenerateCommand.class})
public final class SideInputToolMain implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new SideInputToolMain()).execute(args);
        System.exit(code);
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: read | generate");
    }
}
