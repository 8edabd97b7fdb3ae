package com.dogfold.scaffold.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.cli.exception.OptionsValidationException;
import com.dogfold.scaffold.cli.model.TargetOptions;
import com.dogfold.scaffold.cli.model.ValidatedWorkspaceOptions;
import com.dogfold.scaffold.cli.model.WorkspaceOptions;
import com.dogfold.scaffold.cli.output.ScaffoldResultPrinter;
import com.dogfold.scaffold.cli.validation.WorkspaceOptionsValidator;
import com.dogfold.scaffold.codegen.ScaffoldGenerator;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ConfigLoader;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.target.TargetResolver;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Mixin;

/**
 * Validate the workspace, load the configuration, discover targets, run one flow and print its
 * outcome. Subclasses only choose the flow.
 */
public abstract class AbstractScaffoldCommand implements Callable<Integer> {

    static final int USAGE_ERROR = 2;

    @Mixin
    protected WorkspaceOptions workspace;

    protected final ScaffoldResultPrinter printer = new ScaffoldResultPrinter();

    @Override
    public Integer call() {
        ValidatedWorkspaceOptions options;
        try {
            options = new WorkspaceOptionsValidator().validate(workspace);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return USAGE_ERROR;
        }
        configureLogging(options.isVerbose());

        ScaffoldConfig config = ConfigLoader.load(options.getConfigFile());
        TargetResolver resolver = TargetResolver.discover(options.getRepoRoot(), config);
        return execute(new ScaffoldGenerator(resolver, config));
    }

    /**
     * Runs the command against a ready generator and returns the exit status.
     */
    protected abstract int execute(ScaffoldGenerator generator);

    protected int report(ScaffoldResult result) {
        printer.print(result);
        return result.exitCode();
    }

    protected String targetSelector(ScaffoldGenerator generator, TargetOptions targetOptions) {
        return targetOptions.selector(generator.getResolver().getDefaultTarget());
    }

    private void configureLogging(boolean verbose) {
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(verbose ? Level.DEBUG : Level.INFO);
    }
}
