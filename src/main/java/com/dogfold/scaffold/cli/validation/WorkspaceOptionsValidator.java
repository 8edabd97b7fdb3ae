package com.dogfold.scaffold.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.dogfold.scaffold.cli.exception.OptionsValidationException;
import com.dogfold.scaffold.cli.model.ValidatedWorkspaceOptions;
import com.dogfold.scaffold.cli.model.WorkspaceOptions;
import com.dogfold.scaffold.codegen.config.ConfigLoader;

public class WorkspaceOptionsValidator {

    public ValidatedWorkspaceOptions validate(WorkspaceOptions o) {
        List<String> errors = new ArrayList<>();

        Path repoRoot = (o.getRepoRoot() != null ? o.getRepoRoot() : Path.of("."))
                .toAbsolutePath()
                .normalize();
        if (!Files.isDirectory(repoRoot)) {
            errors.add("Repository root does not exist or is not a directory: " + repoRoot);
        }

        // An explicit --config must exist; the default one is optional
        Path configFile;
        if (o.getConfigFile() != null) {
            configFile = o.getConfigFile().toAbsolutePath().normalize();
            if (!Files.isRegularFile(configFile)) {
                errors.add("Configuration file does not exist: " + configFile);
            }
        } else {
            configFile = repoRoot.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return new ValidatedWorkspaceOptions(repoRoot, configFile, o.isVerbose());
    }
}
