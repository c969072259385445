package com.hypecycle.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for HypeCycle.
 * Routes to subcommands: analyze, history, health, serve.
 */
@Command(
        name = "hypecycle",
        mixinStandardHelpOptions = true,
        version = "HypeCycle 0.1.0",
        description = "Places technologies on the hype cycle from social, research, patent, news and market signals",
        subcommands = {
                AnalyzeCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HypeCycleCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
