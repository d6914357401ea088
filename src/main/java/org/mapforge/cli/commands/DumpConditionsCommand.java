package org.mapforge.cli.commands;

import org.mapforge.cli.CommandLineInterface;
import org.mapforge.conditions.ConditionDocWriter;
import org.mapforge.conditions.ConditionRegistry;
import org.mapforge.conditions.EngineOptions;
import org.mapforge.conditions.rules.BuiltinRules;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "dump-conditions", description = "Lists every registered test, result and meta-condition.")
public class DumpConditionsCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ConditionRegistry registry = ConditionRegistry.initialize(
                EngineOptions.fromConfig(parent.getConfig()), BuiltinRules.all());
        PrintWriter out = spec.commandLine().getOut();
        ConditionDocWriter.write(registry, out);
        out.flush();
        return 0;
    }
}
