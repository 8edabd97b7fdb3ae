package com.dogfold.scaffold.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.cli.exception.OptionsValidationException;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.target.TargetResolver;

/**
 * Responsible only for printing CLI output. No validation, no execution.
 */
public class ScaffoldResultPrinter {

    private static final Logger log = LoggerFactory.getLogger(ScaffoldResultPrinter.class);

    public void print(ScaffoldResult result) {
        String rendered = result.render();
        switch (result.getStatus()) {
            case SUCCESS:
                log.info(rendered);
                break;
            case WARNING:
                log.warn(rendered);
                break;
            default:
                log.error(rendered);
                break;
        }
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        for (String error : e.getErrors()) {
            log.error("  - {}", error);
        }
    }

    public void printTargets(TargetResolver resolver) {
        log.info("Known targets (default: {}):", resolver.getDefaultTarget());
        for (String key : resolver.listTargets()) {
            Target target = resolver.getTargets().get(key);
            log.info("  {}  {}  {}", key, target.getPackageName(), target.getRoot());
            log.debug("      templates: {}", target.getTemplates());
        }
    }
}
